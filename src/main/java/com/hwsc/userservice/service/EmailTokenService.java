package com.hwsc.userservice.service;

import java.util.Optional;

public interface EmailTokenService {

    /** Issues a new email token for the account, replacing any previous one. */
    String issue(String accountId);

    Optional<String> findOwner(String token);

    /**
     * Consumes the token. Expired tokens are not an exception here: the cascade they trigger
     * must commit, so the outcome is reported instead.
     */
    EmailVerificationResult verify(String token);

    void discard(String accountId);

    record EmailVerificationResult(Outcome outcome, String accountId) {}

    enum Outcome {
        VERIFIED,
        EXPIRED_ACCOUNT_REMOVED,
        EXPIRED_EMAIL_CHANGE_DISCARDED,
        ACCOUNT_MISSING
    }
}
