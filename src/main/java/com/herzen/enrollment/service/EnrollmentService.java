package com.herzen.enrollment.service;

import com.herzen.enrollment.catalog.CourseCatalog;
import com.herzen.enrollment.domain.DomainModels.Course;
import com.herzen.enrollment.domain.DomainModels.Enrollment;
import com.herzen.enrollment.domain.Student;
import com.herzen.enrollment.error.EnrollmentNotFoundException;
import com.herzen.enrollment.error.StudentNotFoundException;
import com.herzen.enrollment.validation.EnrollmentValidator;
import com.herzen.enrollment.validation.ValidationModels.EnrollmentDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class EnrollmentService {
    private static final Logger log = LoggerFactory.getLogger(EnrollmentService.class);

    private final CourseCatalog catalog;
    private final EnrollmentValidator validator;
    private final Map<String, Student> students = new ConcurrentHashMap<>();

    public EnrollmentService(CourseCatalog catalog, EnrollmentValidator validator) {
        this.catalog = catalog;
        this.validator = validator;
    }

    public Student registerStudent(String id, String name) {
        Student student = new Student(id, name);
        if (students.putIfAbsent(id, student) != null) {
            throw new IllegalArgumentException("Student already registered: " + id);
        }
        log.info("Student registered: {}", student);
        return student;
    }

    public Student student(String studentId) {
        Student student = studentId == null ? null : students.get(studentId);
        if (student == null) throw new StudentNotFoundException(studentId);
        return student;
    }

    public EnrollmentDecision evaluate(String studentId, String courseCode) {
        Student student = student(studentId);
        Course course = catalog.require(courseCode);
        synchronized (student) {
            return validator.evaluate(student, course);
        }
    }

    public EnrollmentDecision enroll(String studentId, String courseCode) {
        Student student = student(studentId);
        Course course = catalog.require(courseCode);
        synchronized (student) {
            EnrollmentDecision decision = validator.evaluate(student, course);
            if (decision.eligible()) {
                student.addEnrollment(new Enrollment(student.id(), course, Instant.now()));
                log.info("Enrolled {} in {} (credits now {})", student, course.code(), student.totalActiveCredits());
            } else {
                log.info("Enrollment of {} in {} rejected: {}", student, course.code(), decision.message());
            }
            return decision;
        }
    }

    public Enrollment withdraw(String studentId, String courseCode) {
        Student student = student(studentId);
        synchronized (student) {
            Enrollment removed = student.removeEnrollment(courseCode)
                    .orElseThrow(() -> new EnrollmentNotFoundException(studentId, courseCode));
            log.info("Withdrew {} from {}", student, courseCode);
            return removed;
        }
    }

    public Student approveCourse(String studentId, String courseCode) {
        Student student = student(studentId);
        Course course = catalog.require(courseCode);
        synchronized (student) {
            if (student.approve(course.code())) {
                log.info("Approved {} for {}", course.code(), student);
            }
        }
        return student;
    }

    public StudentView view(String studentId) {
        Student student = student(studentId);
        synchronized (student) {
            return StudentView.of(student);
        }
    }

    public record StudentView(String id,
                              String name,
                              List<String> approvedCourseCodes,
                              List<EnrollmentView> enrollments,
                              long totalCredits) {
        static StudentView of(Student student) {
            return new StudentView(
                    student.id(),
                    student.name(),
                    List.copyOf(student.approvedCourseCodes()),
                    student.activeEnrollments().stream()
                            .map(e -> new EnrollmentView(e.courseCode(), e.course().name(), e.course().credits(), e.enrolledAt()))
                            .toList(),
                    student.totalActiveCredits());
        }
    }

    public record EnrollmentView(String courseCode, String courseName, int credits, Instant enrolledAt) {}
}
