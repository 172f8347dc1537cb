package com.herzen.enrollment.validation;

import com.herzen.enrollment.config.EnrollmentProperties;
import com.herzen.enrollment.domain.DomainModels.Course;
import com.herzen.enrollment.domain.DomainModels.Enrollment;
import com.herzen.enrollment.domain.Student;
import com.herzen.enrollment.validation.ValidationModels.EnrollmentDecision;
import com.herzen.enrollment.validation.ValidationModels.IneligibilityReason;
import org.springframework.stereotype.Component;

@Component
public class EnrollmentValidator {
    private final int maxCredits;

    public EnrollmentValidator(EnrollmentProperties properties) {
        this.maxCredits = properties.maxCredits();
    }

    public EnrollmentDecision evaluate(Student student, Course course) {
        if (student.isEnrolledIn(course.code())) {
            return EnrollmentDecision.ineligible(course.code(), IneligibilityReason.ALREADY_ENROLLED, null);
        }

        for (String prerequisite : course.prerequisiteCodes()) {
            if (!student.hasApproved(prerequisite)) {
                return EnrollmentDecision.ineligible(course.code(), IneligibilityReason.MISSING_PREREQUISITE, prerequisite);
            }
        }

        if (course.credits() > maxCredits - student.totalActiveCredits()) {
            return EnrollmentDecision.ineligible(course.code(), IneligibilityReason.CREDIT_LIMIT_EXCEEDED, null);
        }

        for (Enrollment active : student.activeEnrollments()) {
            if (active.overlaps(course)) {
                return EnrollmentDecision.ineligible(course.code(), IneligibilityReason.SCHEDULE_CONFLICT, active.courseCode());
            }
        }

        return EnrollmentDecision.eligible(course.code());
    }

    public int maxCredits() {
        return maxCredits;
    }
}
