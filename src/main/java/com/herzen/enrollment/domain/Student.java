package com.herzen.enrollment.domain;

import com.herzen.enrollment.domain.DomainModels.Enrollment;

import java.util.*;

/**
 * Not thread-safe; callers sharing a student synchronize on it.
 */
public class Student {
    private final String id;
    private final String name;
    private final Set<String> approvedCourseCodes = new LinkedHashSet<>();
    private final List<Enrollment> enrollments = new ArrayList<>();

    public Student(String id, String name) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Student id is required");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Student name is required: " + id);
        this.id = id;
        this.name = name;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Set<String> approvedCourseCodes() {
        return Collections.unmodifiableSet(approvedCourseCodes);
    }

    public List<Enrollment> activeEnrollments() {
        return Collections.unmodifiableList(enrollments);
    }

    public boolean hasApproved(String courseCode) {
        return approvedCourseCodes.contains(courseCode);
    }

    public boolean isEnrolledIn(String courseCode) {
        return enrollments.stream().anyMatch(e -> e.courseCode().equals(courseCode));
    }

    public long totalActiveCredits() {
        return enrollments.stream().mapToLong(e -> e.course().credits()).sum();
    }

    public void addEnrollment(Enrollment enrollment) {
        if (!id.equals(enrollment.studentId())) {
            throw new IllegalArgumentException("Enrollment belongs to student " + enrollment.studentId() + ", not " + id);
        }
        if (isEnrolledIn(enrollment.courseCode())) {
            throw new IllegalStateException("Student " + id + " is already enrolled in " + enrollment.courseCode());
        }
        enrollments.add(enrollment);
    }

    public Optional<Enrollment> removeEnrollment(String courseCode) {
        Iterator<Enrollment> it = enrollments.iterator();
        while (it.hasNext()) {
            Enrollment e = it.next();
            if (e.courseCode().equals(courseCode)) {
                it.remove();
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /** @return {@code false} if the course was already approved */
    public boolean approve(String courseCode) {
        if (courseCode == null || courseCode.isBlank()) throw new IllegalArgumentException("Course code is required");
        return approvedCourseCodes.add(courseCode);
    }

    @Override
    public String toString() {
        return name + " (" + id + ")";
    }
}
