package com.hwsc.userservice.serviceImpl;

import com.hwsc.userservice.entity.AuthToken;
import com.hwsc.userservice.entity.Secret;
import com.hwsc.userservice.exception.StatusCode;
import com.hwsc.userservice.exception.TokenExceptions;
import com.hwsc.userservice.repository.AuthTokenRepository;
import com.hwsc.userservice.service.AuthTokenService;
import com.hwsc.userservice.service.SecretService;
import com.hwsc.userservice.utils.TokenGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuthTokenServiceImpl with the repository and secret manager stubbed.
 */
@ExtendWith(MockitoExtension.class)
class AuthTokenServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-05-15T10:00:00Z");
    private static final String ACCOUNT = "01hxz8k3b3w4v1f6q2n9yjz0ta";

    @Mock
    private AuthTokenRepository authTokenRepository;

    @Mock
    private SecretService secretService;

    @Mock
    private TokenGenerator tokenGenerator;

    private AuthTokenServiceImpl service;

    @BeforeEach
    void setup() {
        service = new AuthTokenServiceImpl(authTokenRepository, secretService, tokenGenerator,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ── Helper ────────────────────────────────────────────────────────────────

    private static Secret secret(String key) {
        return Secret.builder()
                .key(key)
                .createdAt(NOW)
                .expiresAt(Instant.parse("2024-05-20T03:00:00Z"))
                .build();
    }

    private static AuthToken token(String value, Secret secret) {
        return AuthToken.builder()
                .token(value)
                .accountId(ACCOUNT)
                .secret(secret)
                .createdAt(NOW)
                .build();
    }

    // ── issue ─────────────────────────────────────────────────────────────────

    @Test
    void reusesTokenIssuedUnderActiveSecret() {
        Secret active = secret("active-key");
        when(secretService.getActive()).thenReturn(active);
        when(authTokenRepository.findByAccountId(ACCOUNT))
                .thenReturn(Optional.of(token("existing", secret("active-key"))));

        AuthTokenService.IssuedToken issued = service.issue(ACCOUNT);

        assertEquals("existing", issued.token());
        assertSame(active, issued.secret());
        verify(authTokenRepository, never()).save(any());
        verify(authTokenRepository, never()).deleteByAccountId(any());
    }

    @Test
    void replacesTokenIssuedUnderSupersededSecret() {
        Secret active = secret("new-key");
        when(secretService.getActive()).thenReturn(active);
        when(authTokenRepository.findByAccountId(ACCOUNT))
                .thenReturn(Optional.of(token("stale", secret("old-key"))));
        when(tokenGenerator.newToken()).thenReturn("fresh");

        AuthTokenService.IssuedToken issued = service.issue(ACCOUNT);

        assertEquals("fresh", issued.token());
        verify(authTokenRepository).deleteByAccountId(ACCOUNT);
        ArgumentCaptor<AuthToken> saved = ArgumentCaptor.forClass(AuthToken.class);
        verify(authTokenRepository).save(saved.capture());
        assertEquals("new-key", saved.getValue().getSecret().getKey());
        assertEquals(ACCOUNT, saved.getValue().getAccountId());
        assertEquals(NOW, saved.getValue().getCreatedAt());
    }

    @Test
    void issuesFirstTokenWithoutDeleting() {
        when(secretService.getActive()).thenReturn(secret("active-key"));
        when(authTokenRepository.findByAccountId(ACCOUNT)).thenReturn(Optional.empty());
        when(tokenGenerator.newToken()).thenReturn("first");

        assertEquals("first", service.issue(ACCOUNT).token());
        verify(authTokenRepository, never()).deleteByAccountId(any());
        verify(authTokenRepository).save(any(AuthToken.class));
    }

    // ── verify ────────────────────────────────────────────────────────────────

    @Test
    void blankTokenIsNotFound() {
        TokenExceptions.MissingAuthToken ex =
                assertThrows(TokenExceptions.MissingAuthToken.class, () -> service.verify(" "));
        assertEquals(StatusCode.NOT_FOUND, ex.getCode());
        verifyNoInteractions(authTokenRepository, secretService);
    }

    @Test
    void unknownTokenIsUnauthenticated() {
        when(authTokenRepository.findById("ghost")).thenReturn(Optional.empty());

        TokenExceptions.AuthTokenRejected ex =
                assertThrows(TokenExceptions.AuthTokenRejected.class, () -> service.verify("ghost"));
        assertEquals(StatusCode.UNAUTHENTICATED, ex.getCode());
    }

    @Test
    void tokenUnderSupersededSecretIsRemovedAndRejected() {
        when(authTokenRepository.findById("stale")).thenReturn(Optional.of(token("stale", secret("old-key"))));
        when(secretService.getActive()).thenReturn(secret("new-key"));

        assertThrows(TokenExceptions.AuthTokenRejected.class, () -> service.verify("stale"));
        verify(authTokenRepository).deleteByToken("stale");
        verify(authTokenRepository, never()).deleteById(any());
    }

    @Test
    void liveTokenResolvesToAccount() {
        Secret active = secret("active-key");
        when(authTokenRepository.findById("live")).thenReturn(Optional.of(token("live", secret("active-key"))));
        when(secretService.getActive()).thenReturn(active);

        AuthTokenService.VerifiedToken verified = service.verify("live");

        assertEquals(ACCOUNT, verified.accountId());
        assertEquals("active-key", verified.secret().getKey());
        verify(authTokenRepository, never()).deleteByToken(any());
    }
}
