package com.hwsc.userservice.controller;

import com.hwsc.userservice.dto.*;
import com.hwsc.userservice.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final UserService userService;

    @PostMapping("/token")
    public ApiResponse<AuthTokenResponse> getAuthToken(@Valid @RequestBody AuthTokenRequest request) {
        return ApiResponse.ok("token issued", userService.getAuthToken(request));
    }

    @PostMapping("/token/verify")
    public ApiResponse<VerifiedIdentity> verifyAuthToken(@RequestBody TokenRequest request) {
        return ApiResponse.ok("token verified", userService.verifyAuthToken(request));
    }

    @PostMapping("/secrets")
    public ApiResponse<SecretMeta> makeNewSecret() {
        SecretMeta meta = userService.makeNewSecret();
        log.info("Secret rotation requested; new secret expires at {}", meta.getExpiresAt());
        return ApiResponse.ok("secret rotated", meta);
    }

    @GetMapping("/secrets/active")
    public ApiResponse<SecretMeta> getSecret() {
        return ApiResponse.ok(userService.getSecret());
    }
}
