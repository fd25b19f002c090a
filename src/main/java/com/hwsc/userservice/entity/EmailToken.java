package com.hwsc.userservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "email_tokens")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmailToken {

    @Id
    @Column(name = "token", length = 128, updatable = false, nullable = false)
    private String token;

    @Column(name = "account_id", length = 26, nullable = false, unique = true)
    private String accountId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }
}
