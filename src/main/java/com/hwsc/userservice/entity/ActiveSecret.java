package com.hwsc.userservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Single-row pointer to the secret currently used for issuance and verification.
 */
@Entity
@Table(name = "active_secret")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActiveSecret {

    public static final int SLOT = 1;

    @Id
    @Column(name = "slot", nullable = false)
    private Integer slot;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "secret_key", nullable = false)
    private Secret secret;
}
