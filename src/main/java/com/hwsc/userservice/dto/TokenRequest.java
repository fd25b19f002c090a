package com.hwsc.userservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Carries an auth token or an email token; emptiness is checked by the service. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenRequest {

    private String token;
}
