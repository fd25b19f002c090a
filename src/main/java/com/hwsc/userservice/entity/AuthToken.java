package com.hwsc.userservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Opaque auth token bound to the secret that was active when it was issued.
 * One row per account.
 */
@Entity
@Table(name = "auth_tokens")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuthToken {

    @Id
    @Column(name = "token", length = 128, updatable = false, nullable = false)
    private String token;

    @Column(name = "account_id", length = 26, nullable = false, unique = true)
    private String accountId;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "secret_key", nullable = false)
    private Secret secret;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
