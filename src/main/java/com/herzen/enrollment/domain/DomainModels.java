package com.herzen.enrollment.domain;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

public class DomainModels {
    public record Course(String code, String name, int credits, int term,
                         List<String> prerequisiteCodes,
                         List<Schedule> schedules) {
        public Course {
            if (code == null || code.isBlank()) throw new IllegalArgumentException("Course code is required");
            if (name == null || name.isBlank()) throw new IllegalArgumentException("Course name is required: " + code);
            if (credits <= 0) throw new IllegalArgumentException("Course credits must be positive: " + code + " has " + credits);
            if (term <= 0) throw new IllegalArgumentException("Course term must be positive: " + code + " has " + term);

            prerequisiteCodes = prerequisiteCodes == null ? List.of() : List.copyOf(prerequisiteCodes);
            schedules = schedules == null ? List.of() : List.copyOf(schedules);

            if (prerequisiteCodes.contains(code)) {
                throw new IllegalArgumentException("Course cannot require itself: " + code);
            }
            if (new HashSet<>(prerequisiteCodes).size() != prerequisiteCodes.size()) {
                throw new IllegalArgumentException("Duplicate prerequisite in course " + code + ": " + prerequisiteCodes);
            }
        }

        public Course(String code, String name, int credits, int term, List<Schedule> schedules) {
            this(code, name, credits, term, List.of(), schedules);
        }

        public String display() {
            return code + " - " + name + " (" + credits + " credits)";
        }
    }

    public record Schedule(DayOfWeek day, LocalTime start, LocalTime end) {
        public Schedule {
            if (day == null || start == null || end == null) {
                throw new IllegalArgumentException("Schedule day/start/end required");
            }
            if (!end.isAfter(start)) {
                throw new IllegalArgumentException("Schedule end must be after start: " + start + "-" + end);
            }
        }

        public boolean overlaps(Schedule other) {
            if (day != other.day()) return false;
            // half-open: back-to-back slots do not overlap
            return start.isBefore(other.end()) && end.isAfter(other.start());
        }
    }

    public record Enrollment(String studentId, Course course, Instant enrolledAt) {
        public Enrollment {
            Objects.requireNonNull(studentId, "studentId");
            Objects.requireNonNull(course, "course");
            if (enrolledAt == null) enrolledAt = Instant.now();
        }

        public String courseCode() {
            return course.code();
        }

        public boolean overlaps(Course candidate) {
            for (Schedule mine : course.schedules()) {
                for (Schedule theirs : candidate.schedules()) {
                    if (mine.overlaps(theirs)) return true;
                }
            }
            return false;
        }
    }
}
