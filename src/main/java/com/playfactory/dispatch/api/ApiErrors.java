package com.playfactory.dispatch.api;

import com.playfactory.core.error.ErrorCode;
import com.playfactory.core.error.GameFactoryException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps factory errors to HTTP responses with a {@code {"error", "code"}} body.
 */
final class ApiErrors {

    private ApiErrors() {}

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case RESOURCE_EXHAUSTED, NO_PORT_AVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case BUILD_FAILED, LAUNCH_FAILED -> HttpStatus.BAD_GATEWAY;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case GONE -> HttpStatus.GONE;
        };
    }

    static ResponseEntity<Map<String, Object>> of(GameFactoryException e) {
        return ResponseEntity.status(statusOf(e.code()))
                .body(Map.of("error", e.getMessage(), "code", e.code().name()));
    }
}
