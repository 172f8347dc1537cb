package com.herzen.enrollment.error;

public class StudentNotFoundException extends EnrollmentException {
    public StudentNotFoundException(String studentId) {
        super(ErrorCode.STUDENT_NOT_FOUND, studentId);
    }
}
