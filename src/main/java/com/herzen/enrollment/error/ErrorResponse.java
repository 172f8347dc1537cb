package com.herzen.enrollment.error;

import org.springframework.http.ResponseEntity;

import java.time.Instant;

public record ErrorResponse(String code, String message, Instant timestamp) {

    public static ResponseEntity<ErrorResponse> toResponseEntity(EnrollmentException e) {
        return ResponseEntity.status(e.errorCode().status())
                .body(new ErrorResponse(e.errorCode().code(), e.getMessage(), Instant.now()));
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, String message) {
        return ResponseEntity.status(errorCode.status())
                .body(new ErrorResponse(errorCode.code(), message, Instant.now()));
    }
}
