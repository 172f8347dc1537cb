package com.herzen.enrollment.error;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    STUDENT_NOT_FOUND("E001", HttpStatus.NOT_FOUND, "Student not found"),
    COURSE_NOT_FOUND("E002", HttpStatus.NOT_FOUND, "Course not found"),
    ENROLLMENT_NOT_FOUND("E003", HttpStatus.NOT_FOUND, "Active enrollment not found"),
    INVALID_REQUEST("E400", HttpStatus.BAD_REQUEST, "Invalid request"),
    RESOURCE_NOT_FOUND("E404", HttpStatus.NOT_FOUND, "Resource not found"),
    METHOD_NOT_ALLOWED("E405", HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed"),
    UNSUPPORTED_MEDIA_TYPE("E415", HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported media type"),
    INTERNAL_ERROR("S001", HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final String code;
    private final HttpStatus status;
    private final String message;

    ErrorCode(String code, HttpStatus status, String message) {
        this.code = code;
        this.status = status;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }

    public String message() {
        return message;
    }
}
