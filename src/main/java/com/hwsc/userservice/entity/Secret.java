package com.hwsc.userservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Signing key material. Rows are never deleted on rotation so that tokens
 * referencing a superseded secret still resolve (and are then rejected).
 */
@Entity
@Table(name = "secrets")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Secret {

    /** base64url of 256-bit HMAC key material. */
    @Id
    @Column(name = "secret_key", length = 64, updatable = false, nullable = false)
    private String key;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
