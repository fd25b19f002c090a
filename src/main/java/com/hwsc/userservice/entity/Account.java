package com.hwsc.userservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A registered user account.
 * - Id is a lower-case ULID assigned by the service, never by the store.
 * - Email is unique and stored trimmed + lower-cased.
 * - A pending email change lives in prospectiveEmail until verified.
 */
@Entity
@Table(
        name = "accounts",
        indexes = {
                @Index(name = "ux_accounts_prospective_email", columnList = "prospective_email", unique = true)
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Account {

    @Id
    @Column(name = "account_id", length = 26, updatable = false, nullable = false)
    private String id;

    @Column(name = "first_name", nullable = false, length = 32)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 32)
    private String lastName;

    @Column(name = "email", nullable = false, length = 320, unique = true)
    private String email;

    /** BCrypt digest, never the raw password. */
    @Column(name = "password", nullable = false, length = 100)
    private String password;

    @Column(name = "organization", nullable = false, length = 255)
    private String organization;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @Column(name = "prospective_email", length = 320)
    private String prospectiveEmail;
}
