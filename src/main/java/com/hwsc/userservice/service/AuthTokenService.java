package com.hwsc.userservice.service;

import com.hwsc.userservice.entity.Secret;

public interface AuthTokenService {

    /**
     * Returns the account's token when it was issued under the active secret,
     * otherwise replaces it with a fresh one bound to the active secret.
     */
    IssuedToken issue(String accountId);

    /** Resolves a token to its account; rejects tokens whose secret is no longer active. */
    VerifiedToken verify(String token);

    void revoke(String accountId);

    record IssuedToken(String token, Secret secret) {}

    record VerifiedToken(String accountId, Secret secret) {}
}
