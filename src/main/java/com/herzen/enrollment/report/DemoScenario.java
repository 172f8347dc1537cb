package com.herzen.enrollment.report;

import com.herzen.enrollment.domain.DomainModels.Course;
import com.herzen.enrollment.domain.DomainModels.Enrollment;
import com.herzen.enrollment.domain.DomainModels.Schedule;
import com.herzen.enrollment.domain.Student;
import com.herzen.enrollment.validation.EnrollmentValidator;
import com.herzen.enrollment.validation.ValidationModels.EnrollmentDecision;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Sample run over a private three-course catalog. Leaves the shared catalog and student registry untouched.
 */
@Component
public class DemoScenario {
    static final Course PROGRAMMING_1 = new Course("INF101", "Programming I", 4, 1,
            List.of(new Schedule(DayOfWeek.MONDAY, LocalTime.of(8, 0), LocalTime.of(10, 0))));
    static final Course PROGRAMMING_2 = new Course("INF201", "Programming II", 4, 2, List.of("INF101"),
            List.of(new Schedule(DayOfWeek.TUESDAY, LocalTime.of(10, 0), LocalTime.of(12, 0))));
    static final Course MATHEMATICS_1 = new Course("MAT101", "Mathematics I", 6, 1,
            List.of(new Schedule(DayOfWeek.MONDAY, LocalTime.of(9, 30), LocalTime.of(11, 30))));

    private final EnrollmentValidator validator;
    private final EnrollmentReportFormatter formatter;

    public DemoScenario(EnrollmentValidator validator, EnrollmentReportFormatter formatter) {
        this.validator = validator;
        this.formatter = formatter;
    }

    public List<String> run() {
        Student student = new Student("demo-1", "John Doe");
        List<String> lines = new ArrayList<>();

        lines.add(attempt(student, PROGRAMMING_1));
        lines.add(attempt(student, PROGRAMMING_2));
        lines.add(attempt(student, MATHEMATICS_1));

        student.approve(PROGRAMMING_1.code());
        lines.add(student.name() + " passed: " + PROGRAMMING_1.display());
        lines.add(attempt(student, PROGRAMMING_2));

        lines.add(formatter.summary(student));
        return lines;
    }

    private String attempt(Student student, Course course) {
        EnrollmentDecision decision = validator.evaluate(student, course);
        if (decision.eligible()) {
            student.addEnrollment(new Enrollment(student.id(), course, Instant.now()));
        }
        return formatter.outcome(student, course, decision);
    }
}
