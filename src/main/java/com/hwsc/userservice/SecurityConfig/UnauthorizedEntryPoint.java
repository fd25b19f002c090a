package com.hwsc.userservice.SecurityConfig;

import com.hwsc.userservice.exception.StatusCode;
import com.hwsc.userservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 401 for any request outside the service's public operations.
 */
@Slf4j
@Component
public class UnauthorizedEntryPoint implements AuthenticationEntryPoint {

    private final ErrorResponseWriter writer;

    public UnauthorizedEntryPoint(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void commence(@NonNull HttpServletRequest request,
                         @NonNull HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        log.debug("Rejected request to {}", request.getRequestURI());
        writer.write(
                request,
                response,
                HttpStatus.UNAUTHORIZED,
                StatusCode.UNAUTHENTICATED,
                "https://hwsc.org/problems/unauthorized",
                "Unauthorized",
                "This resource is not exposed by the user service."
        );
    }
}
