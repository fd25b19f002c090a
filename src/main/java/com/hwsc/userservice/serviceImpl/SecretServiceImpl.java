package com.hwsc.userservice.serviceImpl;

import com.github.benmanes.caffeine.cache.Cache;
import com.hwsc.userservice.config.CacheConfig;
import com.hwsc.userservice.entity.ActiveSecret;
import com.hwsc.userservice.entity.Secret;
import com.hwsc.userservice.exception.ServiceExceptions;
import com.hwsc.userservice.repository.ActiveSecretRepository;
import com.hwsc.userservice.repository.SecretRepository;
import com.hwsc.userservice.service.SecretService;
import com.hwsc.userservice.utils.RotationSchedule;
import io.jsonwebtoken.Jwts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Secret manager:
 * - The active_secret row is the source of truth; the Caffeine entry is only a read-through copy.
 * - Rotation inserts the new secret and repoints the active row in one transaction.
 * - All rotations in this process are serialized, so racing callers see one new secret.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecretServiceImpl implements SecretService {

    private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

    private final SecretRepository secretRepository;
    private final ActiveSecretRepository activeSecretRepository;
    private final Cache<String, Secret> activeSecretCache;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final ReentrantLock rotationLock = new ReentrantLock();

    @Override
    public Secret getActive() {
        Secret cached = activeSecretCache.getIfPresent(CacheConfig.ACTIVE_SECRET);
        if (cached != null && !cached.isExpiredAt(clock.instant())) {
            return cached;
        }

        rotationLock.lock();
        try {
            Instant now = clock.instant();
            Optional<Secret> stored = readActive();
            if (stored.isPresent() && !stored.get().isExpiredAt(now)) {
                activeSecretCache.put(CacheConfig.ACTIVE_SECRET, stored.get());
                return stored.get();
            }
            stored.ifPresent(s -> log.info("Active secret expired at {}; rotating", s.getExpiresAt()));
            return rotateLocked(now);
        } finally {
            rotationLock.unlock();
        }
    }

    @Override
    public Secret rotate() {
        rotationLock.lock();
        try {
            return rotateLocked(clock.instant());
        } finally {
            rotationLock.unlock();
        }
    }

    @Override
    public void invalidateCache() {
        activeSecretCache.invalidateAll();
    }

    private Optional<Secret> readActive() {
        try {
            return activeSecretRepository.findById(ActiveSecret.SLOT).map(ActiveSecret::getSecret);
        } catch (DataAccessException e) {
            throw new ServiceExceptions.Internal("failed to read active secret", e);
        }
    }

    private Secret rotateLocked(Instant now) {
        Instant createdAt = now.truncatedTo(ChronoUnit.MILLIS);
        Secret candidate = Secret.builder()
                .key(newKeyMaterial())
                .createdAt(createdAt)
                .expiresAt(RotationSchedule.nextExpiration(createdAt))
                .build();

        Secret saved;
        try {
            saved = transactionTemplate.execute(status -> {
                Secret persisted = secretRepository.save(candidate);
                ActiveSecret active = activeSecretRepository.findById(ActiveSecret.SLOT)
                        .orElseGet(() -> ActiveSecret.builder().slot(ActiveSecret.SLOT).build());
                active.setSecret(persisted);
                activeSecretRepository.save(active);
                return persisted;
            });
        } catch (DataAccessException e) {
            throw new ServiceExceptions.Internal("failed to persist new secret", e);
        }

        activeSecretCache.put(CacheConfig.ACTIVE_SECRET, saved);
        log.info("Secret rotated; new secret expires at {}", saved.getExpiresAt());
        return saved;
    }

    private static String newKeyMaterial() {
        byte[] raw = Jwts.SIG.HS256.key().build().getEncoded();
        return B64URL.encodeToString(raw);
    }
}
