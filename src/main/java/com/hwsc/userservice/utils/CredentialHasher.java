package com.hwsc.userservice.utils;

import com.hwsc.userservice.exception.RequestExceptions;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Thin seam over the configured {@link PasswordEncoder}.
 */
@Component
@RequiredArgsConstructor
public class CredentialHasher {

    private final PasswordEncoder passwordEncoder;

    public String hash(String password) {
        if (password == null || password.isEmpty() || !password.strip().equals(password)) {
            throw new RequestExceptions.InvalidArgument("invalid password");
        }
        return passwordEncoder.encode(password);
    }

    public boolean matches(String digest, String password) {
        if (digest == null || digest.isEmpty() || password == null || password.isEmpty()) {
            return false;
        }
        return passwordEncoder.matches(password, digest);
    }
}
