package com.hwsc.userservice.controller;

import com.hwsc.userservice.dto.*;
import com.hwsc.userservice.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @PostMapping("/users")
    public ResponseEntity<ApiResponse<CreateUserResponse>> createUser(@Valid @RequestBody CreateUserRequest request) {
        CreateUserResponse created = userService.createUser(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("user created", created));
    }

    @GetMapping("/users/{uuid}")
    public ApiResponse<UserSummary> getUser(@PathVariable String uuid) {
        return ApiResponse.ok(userService.getUser(uuid));
    }

    @PutMapping("/users/{uuid}")
    public ApiResponse<UserSummary> updateUser(@PathVariable String uuid,
                                               @RequestBody UpdateUserRequest request) {
        return ApiResponse.ok("user updated", userService.updateUser(uuid, request));
    }

    @DeleteMapping("/users/{uuid}")
    public ApiResponse<Void> deleteUser(@PathVariable String uuid) {
        userService.deleteUser(uuid);
        return ApiResponse.ok("user deleted", null);
    }

    @PostMapping("/users/authenticate")
    public ApiResponse<UserSummary> authenticate(@Valid @RequestBody AuthenticateRequest request) {
        return ApiResponse.ok("authenticated", userService.authenticateUser(request));
    }

    @PostMapping("/users/verify-email")
    public ApiResponse<Void> verifyEmail(@RequestBody TokenRequest request) {
        userService.verifyEmailToken(request);
        return ApiResponse.ok("email verified", null);
    }

    @GetMapping("/status")
    public ApiResponse<StatusResponse> status() {
        return ApiResponse.ok(userService.getStatus());
    }
}
