package com.herzen.enrollment.validation;

import com.herzen.enrollment.parser.ParserDtos.CatalogDoc;
import com.herzen.enrollment.parser.ParserDtos.CourseDoc;
import com.herzen.enrollment.parser.ParserDtos.ParseError;
import com.herzen.enrollment.parser.ParserDtos.ScheduleDoc;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class CatalogDocValidator {

    /**
     * @param catalogPrerequisites prerequisites of courses already in the catalog, by course code;
     *                             entries redefined by {@code doc} are superseded
     */
    public List<ParseError> validate(CatalogDoc doc, Map<String, List<String>> catalogPrerequisites) {
        List<ParseError> errors = new ArrayList<>();

        Map<String, Long> counts = doc.courses().stream().collect(Collectors.groupingBy(CourseDoc::code, Collectors.counting()));
        doc.courses().forEach(c -> {
            if (counts.getOrDefault(c.code(), 0L) > 1) {
                errors.add(new ParseError("DUPLICATE_COURSE", "Duplicate course code: " + c.code(), c.line(), "course", c.code()));
            }
        });

        Map<String, List<String>> graph = new HashMap<>(catalogPrerequisites);
        doc.courses().forEach(c -> graph.put(c.code(), c.prerequisiteCodes()));

        for (CourseDoc course : doc.courses()) {
            for (String prerequisite : course.prerequisiteCodes()) {
                if (prerequisite.equals(course.code())) {
                    errors.add(new ParseError("SELF_PREREQUISITE", "Course requires itself: " + course.code(), course.line(), "course", course.code()));
                } else if (!graph.containsKey(prerequisite)) {
                    errors.add(new ParseError("PREREQUISITE_NOT_FOUND", "Course " + course.code() + " requires unknown course: " + prerequisite,
                            course.line(), "course", course.code()));
                }
            }
            for (ScheduleDoc schedule : course.schedules()) {
                if (!schedule.end().isAfter(schedule.start())) {
                    errors.add(new ParseError("INVALID_SCHEDULE", "Schedule end must be after start: " + schedule.start() + "-" + schedule.end(),
                            schedule.line(), "schedule", course.code()));
                }
            }
        }

        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (CourseDoc course : doc.courses()) {
            if (hasCycle(course.code(), graph, visiting, visited)) {
                errors.add(new ParseError("PREREQUISITE_CYCLE", "Cycle detected in prerequisites of " + course.code(),
                        course.line(), "course", course.code()));
                break;
            }
        }

        return errors;
    }

    private boolean hasCycle(String node, Map<String, List<String>> graph, Set<String> visiting, Set<String> visited) {
        if (visited.contains(node)) return false;
        if (visiting.contains(node)) return true;

        visiting.add(node);
        for (String next : graph.getOrDefault(node, List.of())) {
            // self references are reported separately
            if (next.equals(node)) continue;
            if (hasCycle(next, graph, visiting, visited)) return true;
        }
        visiting.remove(node);
        visited.add(node);
        return false;
    }
}
