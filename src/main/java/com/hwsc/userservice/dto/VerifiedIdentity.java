package com.hwsc.userservice.dto;

import lombok.Builder;
import lombok.Data;

/** Result of a successful auth-token verification. */
@Data
@Builder
public class VerifiedIdentity {

    private String uuid;
    private SecretMeta secret;
}
