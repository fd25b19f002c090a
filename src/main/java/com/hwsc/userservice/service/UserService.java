package com.hwsc.userservice.service;

import com.hwsc.userservice.dto.*;

/**
 * Entry point for every remote operation. Checks availability, validates input,
 * takes the per-account lock and delegates.
 */
public interface UserService {

    CreateUserResponse createUser(CreateUserRequest request);

    UserSummary getUser(String uuid);

    UserSummary updateUser(String uuid, UpdateUserRequest request);

    void deleteUser(String uuid);

    UserSummary authenticateUser(AuthenticateRequest request);

    void verifyEmailToken(TokenRequest request);

    AuthTokenResponse getAuthToken(AuthTokenRequest request);

    VerifiedIdentity verifyAuthToken(TokenRequest request);

    SecretMeta makeNewSecret();

    SecretMeta getSecret();

    StatusResponse getStatus();
}
