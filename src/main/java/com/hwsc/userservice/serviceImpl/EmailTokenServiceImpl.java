package com.hwsc.userservice.serviceImpl;

import com.hwsc.userservice.entity.Account;
import com.hwsc.userservice.entity.EmailToken;
import com.hwsc.userservice.exception.RequestExceptions;
import com.hwsc.userservice.exception.TokenExceptions;
import com.hwsc.userservice.repository.AccountRepository;
import com.hwsc.userservice.repository.AuthTokenRepository;
import com.hwsc.userservice.repository.EmailTokenRepository;
import com.hwsc.userservice.service.EmailTokenService;
import com.hwsc.userservice.utils.TokenGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Email-verification tokens:
 * - One live token per account; issuing again replaces it.
 * - An expired token removes an unverified account (and its auth token),
 *   or discards the pending email change of a verified one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailTokenServiceImpl implements EmailTokenService {

    private final EmailTokenRepository emailTokenRepository;
    private final AccountRepository accountRepository;
    private final AuthTokenRepository authTokenRepository;
    private final TokenGenerator tokenGenerator;
    private final Clock clock;

    @Value("${user-service.email-token.ttl:PT2H}")
    private Duration ttl = Duration.ofHours(2);

    @Override
    @Transactional
    public String issue(String accountId) {
        emailTokenRepository.deleteByAccountId(accountId);

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        EmailToken token = EmailToken.builder()
                .token(tokenGenerator.newToken())
                .accountId(accountId)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .build();
        // flushed so a failing insert surfaces before the token is mailed
        emailTokenRepository.saveAndFlush(token);
        log.debug("Issued email token for account {} (expires {})", accountId, token.getExpiresAt());
        return token.getToken();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findOwner(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return emailTokenRepository.findById(token).map(EmailToken::getAccountId);
    }

    @Override
    @Transactional
    public EmailVerificationResult verify(String token) {
        if (token == null || token.isBlank()) {
            throw new RequestExceptions.InvalidArgument("empty email token");
        }
        EmailToken stored = emailTokenRepository.findById(token)
                .orElseThrow(TokenExceptions.EmailTokenNotFound::new);
        String accountId = stored.getAccountId();
        emailTokenRepository.delete(stored);

        Optional<Account> maybeAccount = accountRepository.findById(accountId);
        if (maybeAccount.isEmpty()) {
            log.warn("Email token referenced missing account {}", accountId);
            return new EmailVerificationResult(Outcome.ACCOUNT_MISSING, accountId);
        }
        Account account = maybeAccount.get();

        if (stored.isExpiredAt(clock.instant())) {
            if (!account.isVerified()) {
                authTokenRepository.deleteByAccountId(accountId);
                accountRepository.delete(account);
                log.warn("Email token expired; removed unverified account {}", accountId);
                return new EmailVerificationResult(Outcome.EXPIRED_ACCOUNT_REMOVED, accountId);
            }
            account.setProspectiveEmail(null);
            log.warn("Email token expired; discarded pending email change of account {}", accountId);
            return new EmailVerificationResult(Outcome.EXPIRED_EMAIL_CHANGE_DISCARDED, accountId);
        }

        if (account.getProspectiveEmail() != null) {
            account.setEmail(account.getProspectiveEmail());
            account.setProspectiveEmail(null);
        }
        account.setVerified(true);
        log.info("Email verified for account {}", accountId);
        return new EmailVerificationResult(Outcome.VERIFIED, accountId);
    }

    @Override
    @Transactional
    public void discard(String accountId) {
        emailTokenRepository.deleteByAccountId(accountId);
    }
}
