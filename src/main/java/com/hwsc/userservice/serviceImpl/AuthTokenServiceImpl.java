package com.hwsc.userservice.serviceImpl;

import com.hwsc.userservice.entity.AuthToken;
import com.hwsc.userservice.entity.Secret;
import com.hwsc.userservice.exception.TokenExceptions;
import com.hwsc.userservice.repository.AuthTokenRepository;
import com.hwsc.userservice.service.AuthTokenService;
import com.hwsc.userservice.service.SecretService;
import com.hwsc.userservice.utils.TokenGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Auth token manager. Callers serialize per account (identity lock), so issue() does not race
 * with itself for one account.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthTokenServiceImpl implements AuthTokenService {

    private final AuthTokenRepository authTokenRepository;
    private final SecretService secretService;
    private final TokenGenerator tokenGenerator;
    private final Clock clock;

    @Override
    public IssuedToken issue(String accountId) {
        Secret active = secretService.getActive();

        Optional<AuthToken> existing = authTokenRepository.findByAccountId(accountId);
        if (existing.isPresent() && isBoundTo(existing.get(), active)) {
            log.debug("Reusing live auth token for account {}", accountId);
            return new IssuedToken(existing.get().getToken(), active);
        }
        if (existing.isPresent()) {
            authTokenRepository.deleteByAccountId(accountId);
        }

        AuthToken fresh = AuthToken.builder()
                .token(tokenGenerator.newToken())
                .accountId(accountId)
                .secret(active)
                .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .build();
        authTokenRepository.save(fresh);
        log.info("Issued auth token for account {}", accountId);
        return new IssuedToken(fresh.getToken(), active);
    }

    @Override
    public VerifiedToken verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenExceptions.MissingAuthToken();
        }

        AuthToken stored = authTokenRepository.findById(token).orElse(null);
        if (stored == null) {
            log.warn("Rejected unknown auth token");
            throw new TokenExceptions.AuthTokenRejected("auth token not recognized");
        }

        Secret active = secretService.getActive();
        if (!isBoundTo(stored, active)) {
            authTokenRepository.deleteByToken(stored.getToken());
            log.warn("Rejected auth token of account {} issued under a superseded secret", stored.getAccountId());
            throw new TokenExceptions.AuthTokenRejected("auth token secret is no longer active");
        }
        return new VerifiedToken(stored.getAccountId(), active);
    }

    @Override
    public void revoke(String accountId) {
        authTokenRepository.deleteByAccountId(accountId);
    }

    private static boolean isBoundTo(AuthToken token, Secret active) {
        return token.getSecret() != null && active.getKey().equals(token.getSecret().getKey());
    }
}
