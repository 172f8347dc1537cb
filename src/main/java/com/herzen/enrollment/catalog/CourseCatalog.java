package com.herzen.enrollment.catalog;

import com.herzen.enrollment.domain.DomainModels.Course;
import com.herzen.enrollment.error.CourseNotFoundException;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
public class CourseCatalog {
    private final Map<String, Course> courses = new ConcurrentHashMap<>();

    public void register(Collection<Course> loaded) {
        loaded.forEach(c -> courses.put(c.code(), c));
    }

    public Optional<Course> find(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(courses.get(code));
    }

    public Course require(String code) {
        return find(code).orElseThrow(() -> new CourseNotFoundException(code));
    }

    public List<Course> all() {
        return courses.values().stream()
                .sorted(Comparator.comparingInt(Course::term).thenComparing(Course::code))
                .toList();
    }

    public Map<String, List<String>> prerequisiteGraph() {
        return courses.values().stream().collect(Collectors.toMap(Course::code, Course::prerequisiteCodes));
    }
}
