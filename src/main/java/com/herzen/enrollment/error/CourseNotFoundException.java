package com.herzen.enrollment.error;

public class CourseNotFoundException extends EnrollmentException {
    public CourseNotFoundException(String courseCode) {
        super(ErrorCode.COURSE_NOT_FOUND, courseCode);
    }
}
