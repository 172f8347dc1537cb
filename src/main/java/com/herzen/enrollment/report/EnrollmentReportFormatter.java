package com.herzen.enrollment.report;

import com.herzen.enrollment.domain.DomainModels.Course;
import com.herzen.enrollment.domain.DomainModels.Enrollment;
import com.herzen.enrollment.domain.Student;
import com.herzen.enrollment.validation.ValidationModels.EnrollmentDecision;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
public class EnrollmentReportFormatter {

    public String outcome(Student student, Course course, EnrollmentDecision decision) {
        if (decision.eligible()) {
            return student.name() + " enrolled in: " + course.display();
        }
        return "Could not enroll in " + course.display() + ": " + decision.message();
    }

    public String summary(Student student) {
        String enrolled = student.activeEnrollments().isEmpty()
                ? "none"
                : student.activeEnrollments().stream().map(Enrollment::courseCode).collect(Collectors.joining(", "));
        String approved = student.approvedCourseCodes().isEmpty()
                ? "none"
                : String.join(", ", student.approvedCourseCodes());
        return student.name() + ": enrolled in " + enrolled
                + " (" + student.totalActiveCredits() + " credits), approved " + approved;
    }
}
