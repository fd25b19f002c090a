package com.hwsc.userservice.dto;

import com.hwsc.userservice.entity.Secret;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class SecretMeta {

    private String key;
    private Instant createdAt;
    private Instant expiresAt;

    public static SecretMeta from(Secret secret) {
        return SecretMeta.builder()
                .key(secret.getKey())
                .createdAt(secret.getCreatedAt())
                .expiresAt(secret.getExpiresAt())
                .build();
    }
}
