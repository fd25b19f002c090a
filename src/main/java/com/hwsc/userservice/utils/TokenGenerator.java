package com.hwsc.userservice.utils;

import com.github.f4b6a3.ulid.UlidCreator;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;

/**
 * Identifier and opaque-token generation.
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom secureRandom;

    @Value("${user-service.token.random-bytes:32}")
    private int tokenBytes = 32;

    /** Monotonic ULID, lower-cased: sortable by creation time and unique within the process. */
    public String newAccountId() {
        return UlidCreator.getMonotonicUlid().toString().toLowerCase(Locale.ROOT);
    }

    /** URL-safe random token. */
    public String newToken() {
        byte[] buf = new byte[tokenBytes];
        secureRandom.nextBytes(buf);
        return B64URL.encodeToString(buf);
    }
}
