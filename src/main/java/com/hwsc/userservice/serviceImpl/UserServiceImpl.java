package com.hwsc.userservice.serviceImpl;

import com.hwsc.userservice.availability.ServiceStateGate;
import com.hwsc.userservice.availability.StoreLivenessProbe;
import com.hwsc.userservice.concurrency.IdentityLock;
import com.hwsc.userservice.concurrency.IdentityLockRegistry;
import com.hwsc.userservice.dto.*;
import com.hwsc.userservice.entity.Account;
import com.hwsc.userservice.exception.RequestExceptions;
import com.hwsc.userservice.exception.ServiceExceptions;
import com.hwsc.userservice.exception.TokenExceptions;
import com.hwsc.userservice.exception.UserExceptions;
import com.hwsc.userservice.service.AccountService;
import com.hwsc.userservice.service.AuthTokenService;
import com.hwsc.userservice.service.EmailTokenService;
import com.hwsc.userservice.service.SecretService;
import com.hwsc.userservice.service.UserService;
import com.hwsc.userservice.utils.CredentialHasher;
import com.hwsc.userservice.utils.IdentityValidator;
import com.hwsc.userservice.utils.TokenGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;

/**
 * Service facade:
 * - Every call is refused while the service is locked or the store is unreachable.
 * - Input is validated before any lock is taken or row is touched.
 * - Account-scoped work runs under that account's identity lock (readers shared, writers exclusive).
 * - Lock entries of accounts that turn out not to exist are evicted.
 * - Claiming an email (create, email change) also holds that email's lock until the claim commits,
 *   since uniqueness spans committed and pending emails of different accounts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private static final String EMAIL_CLAIM_PREFIX = "email:";

    private final ServiceStateGate stateGate;
    private final StoreLivenessProbe livenessProbe;
    private final IdentityLockRegistry lockRegistry;
    private final AccountService accountService;
    private final SecretService secretService;
    private final AuthTokenService authTokenService;
    private final EmailTokenService emailTokenService;
    private final CredentialHasher credentialHasher;
    private final TokenGenerator tokenGenerator;
    private final Clock clock;

    // ============================== Accounts ==============================

    @Override
    public CreateUserResponse createUser(CreateUserRequest request) {
        ensureServing();
        if (request == null) {
            throw new RequestExceptions.NilRequest("user");
        }
        IdentityValidator.firstName(request.getFirstName());
        IdentityValidator.lastName(request.getLastName());
        IdentityValidator.email(request.getEmail());
        IdentityValidator.password(request.getPassword());
        IdentityValidator.organization(request.getOrganization());

        String digest = credentialHasher.hash(request.getPassword());
        String email = IdentityValidator.normalizeEmail(request.getEmail());
        String id = tokenGenerator.newAccountId();

        try (IdentityLock lock = lockRegistry.acquireExclusive(id);
             IdentityLock emailClaim = claimEmail(email)) {
            Account account = Account.builder()
                    .id(id)
                    .firstName(request.getFirstName().trim())
                    .lastName(request.getLastName().trim())
                    .email(email)
                    .password(digest)
                    .organization(request.getOrganization())
                    .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                    .verified(false)
                    .build();
            try {
                accountService.register(account);
            } catch (RuntimeException e) {
                lock.evict();
                throw e;
            }
        }
        return new CreateUserResponse(id);
    }

    @Override
    public UserSummary getUser(String uuid) {
        ensureServing();
        IdentityValidator.accountId(uuid);

        try (IdentityLock lock = lockRegistry.acquireShared(uuid)) {
            Account account = accountService.find(uuid).orElse(null);
            if (account == null) {
                lock.evict();
                throw new UserExceptions.UserNotFound("no account with uuid " + uuid);
            }
            return UserSummary.from(account);
        }
    }

    @Override
    public UserSummary updateUser(String uuid, UpdateUserRequest request) {
        ensureServing();
        IdentityValidator.accountId(uuid);
        if (request == null) {
            throw new RequestExceptions.NilRequest("user");
        }
        if (hasText(request.getFirstName())) IdentityValidator.firstName(request.getFirstName());
        if (hasText(request.getLastName())) IdentityValidator.lastName(request.getLastName());
        if (hasText(request.getEmail())) IdentityValidator.email(request.getEmail());

        try (IdentityLock lock = lockRegistry.acquireExclusive(uuid);
             IdentityLock emailClaim = hasText(request.getEmail())
                     ? claimEmail(IdentityValidator.normalizeEmail(request.getEmail()))
                     : null) {
            try {
                return UserSummary.from(accountService.update(uuid, request));
            } catch (UserExceptions.UserNotFound e) {
                lock.evict();
                throw e;
            }
        }
    }

    @Override
    public void deleteUser(String uuid) {
        ensureServing();
        IdentityValidator.accountId(uuid);

        try (IdentityLock lock = lockRegistry.acquireExclusive(uuid)) {
            if (!accountService.exists(uuid)) {
                lock.evict();
                throw new UserExceptions.UserNotFound("no account with uuid " + uuid);
            }
            accountService.delete(uuid);
            lock.evict();
        }
    }

    @Override
    public UserSummary authenticateUser(AuthenticateRequest request) {
        ensureServing();
        if (request == null) {
            throw new RequestExceptions.NilRequest("user");
        }
        IdentityValidator.email(request.getEmail());
        IdentityValidator.password(request.getPassword());

        Account byEmail = accountService.findByEmail(request.getEmail())
                .orElseThrow(() -> new UserExceptions.UserNotFound("no account with that email"));

        try (IdentityLock lock = lockRegistry.acquireShared(byEmail.getId())) {
            Account account = accountService.find(byEmail.getId()).orElse(null);
            if (account == null) {
                lock.evict();
                throw new UserExceptions.UserNotFound("no account with that email");
            }
            if (!credentialHasher.matches(account.getPassword(), request.getPassword())) {
                throw new UserExceptions.CredentialsMismatch();
            }
            return UserSummary.from(account);
        }
    }

    @Override
    public void verifyEmailToken(TokenRequest request) {
        ensureServing();
        if (request == null || !hasText(request.getToken())) {
            throw new RequestExceptions.InvalidArgument("empty email token");
        }
        String owner = emailTokenService.findOwner(request.getToken())
                .orElseThrow(TokenExceptions.EmailTokenNotFound::new);

        EmailTokenService.EmailVerificationResult result;
        try (IdentityLock lock = lockRegistry.acquireExclusive(owner)) {
            result = emailTokenService.verify(request.getToken());
            if (result.outcome() == EmailTokenService.Outcome.EXPIRED_ACCOUNT_REMOVED
                    || result.outcome() == EmailTokenService.Outcome.ACCOUNT_MISSING) {
                lock.evict();
            }
        }

        switch (result.outcome()) {
            case VERIFIED -> log.debug("Email token accepted for account {}", result.accountId());
            case ACCOUNT_MISSING -> throw new TokenExceptions.EmailTokenNotFound();
            case EXPIRED_ACCOUNT_REMOVED, EXPIRED_EMAIL_CHANGE_DISCARDED -> throw new TokenExceptions.EmailTokenExpired();
        }
    }

    // ============================== Tokens & secrets ==============================

    @Override
    public AuthTokenResponse getAuthToken(AuthTokenRequest request) {
        ensureServing();
        if (request == null) {
            throw new RequestExceptions.NilRequest("identification");
        }
        IdentityValidator.accountId(request.getUuid());
        IdentityValidator.email(request.getEmail());
        IdentityValidator.password(request.getPassword());

        try (IdentityLock lock = lockRegistry.acquireExclusive(request.getUuid())) {
            Account account = accountService.find(request.getUuid()).orElse(null);
            if (account == null) {
                lock.evict();
                throw new UserExceptions.UserNotFound("no account with uuid " + request.getUuid());
            }
            if (!account.getEmail().equals(IdentityValidator.normalizeEmail(request.getEmail()))
                    || !credentialHasher.matches(account.getPassword(), request.getPassword())) {
                throw new UserExceptions.CredentialsMismatch();
            }

            AuthTokenService.IssuedToken issued = authTokenService.issue(account.getId());
            return AuthTokenResponse.builder()
                    .token(issued.token())
                    .secret(SecretMeta.from(issued.secret()))
                    .build();
        }
    }

    @Override
    public VerifiedIdentity verifyAuthToken(TokenRequest request) {
        ensureServing();
        AuthTokenService.VerifiedToken verified =
                authTokenService.verify(request == null ? null : request.getToken());
        return VerifiedIdentity.builder()
                .uuid(verified.accountId())
                .secret(SecretMeta.from(verified.secret()))
                .build();
    }

    @Override
    public SecretMeta makeNewSecret() {
        ensureServing();
        return SecretMeta.from(secretService.rotate());
    }

    @Override
    public SecretMeta getSecret() {
        ensureServing();
        return SecretMeta.from(secretService.getActive());
    }

    @Override
    public StatusResponse getStatus() {
        ensureServing();
        return new StatusResponse(stateGate.current(), true);
    }

    // ============================== helpers ==============================

    private void ensureServing() {
        if (!stateGate.isAvailable()) {
            throw new ServiceExceptions.Unavailable("service is unavailable");
        }
        if (!livenessProbe.isReachable()) {
            throw new ServiceExceptions.Unavailable("relational store is unreachable");
        }
    }

    /** Exclusive hold on an email address; the entry is dropped once nobody holds or waits on it. */
    private IdentityLock claimEmail(String normalizedEmail) {
        IdentityLock claim = lockRegistry.acquireExclusive(EMAIL_CLAIM_PREFIX + normalizedEmail);
        claim.evict();
        return claim;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
