package com.herzen.enrollment.error;

public class EnrollmentNotFoundException extends EnrollmentException {
    public EnrollmentNotFoundException(String studentId, String courseCode) {
        super(ErrorCode.ENROLLMENT_NOT_FOUND, studentId + " in " + courseCode);
    }
}
