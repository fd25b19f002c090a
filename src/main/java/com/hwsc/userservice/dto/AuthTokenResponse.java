package com.hwsc.userservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AuthTokenResponse {

    private String token;
    private SecretMeta secret;
}
