package com.herzen.enrollment.error;

/**
 * Base for lookup failures raised by the services. Rule violations are not exceptions; they come back as
 * {@link com.herzen.enrollment.validation.ValidationModels.EnrollmentDecision}.
 */
public abstract class EnrollmentException extends RuntimeException {
    private final ErrorCode errorCode;

    protected EnrollmentException(ErrorCode errorCode, String detail) {
        super(errorCode.message() + ": " + detail);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
