package com.herzen.enrollment.validation;

public class ValidationModels {
    public enum IneligibilityReason {
        ALREADY_ENROLLED("already enrolled"),
        MISSING_PREREQUISITE("missing prerequisite"),
        CREDIT_LIMIT_EXCEEDED("exceeds credit limit"),
        SCHEDULE_CONFLICT("schedule conflict with another course");

        private final String description;

        IneligibilityReason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    /**
     * Outcome of one eligibility check. {@code reason} is null exactly when {@code eligible};
     * {@code subject} names the missing prerequisite or the conflicting course when there is one.
     */
    public record EnrollmentDecision(String courseCode,
                                     boolean eligible,
                                     IneligibilityReason reason,
                                     String subject,
                                     String message) {

        public static EnrollmentDecision eligible(String courseCode) {
            return new EnrollmentDecision(courseCode, true, null, null, "enrollment valid");
        }

        public static EnrollmentDecision ineligible(String courseCode, IneligibilityReason reason, String subject) {
            String message = subject == null ? reason.description() : reason.description() + ": " + subject;
            return new EnrollmentDecision(courseCode, false, reason, subject, message);
        }
    }
}
