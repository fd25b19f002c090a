package com.hwsc.userservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;

/**
 * Success envelope. Errors are written as RFC 7807 problems instead.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    @Builder.Default
    private boolean success = true;

    /** Outcome code, always "OK" on this envelope. */
    private String code;

    private String message;

    private T data;

    private Instant timestamp;

    public static <U> ApiResponse<U> ok(U data) {
        return ok("success", data);
    }

    public static <U> ApiResponse<U> ok(String message, U data) {
        return ApiResponse.<U>builder()
                .success(true)
                .code("OK")
                .message(message)
                .data(data)
                .timestamp(Instant.now())
                .build();
    }
}
