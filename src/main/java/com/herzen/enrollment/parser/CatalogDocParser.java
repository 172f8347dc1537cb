package com.herzen.enrollment.parser;

import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.herzen.enrollment.parser.ParserDtos.*;

/**
 * Reads the line-oriented catalog format:
 * <pre>
 * # comment
 * &#64;course code="INF201" name="Programming II" credits="4" term="2" requires="INF101"
 * &#64;schedule day="TUESDAY" start="10:00" end="12:00"
 * </pre>
 * Each {@code @schedule} belongs to the closest {@code @course} above it.
 */
@Component
public class CatalogDocParser {
    private static final Pattern MARKER_PATTERN = Pattern.compile("^@([a-z][a-z0-9_]*)\\s*(.*)$");
    private static final Pattern ATTR_PATTERN = Pattern.compile("([a-z][a-z0-9_]*)=\"((?:\\\\.|[^\"\\\\])*)\"");

    public ParseResult parse(String content) {
        List<ParseError> errors = new ArrayList<>();
        List<CourseDoc> courses = new ArrayList<>();
        if (content == null || content.isBlank()) {
            errors.add(new ParseError("EMPTY_CATALOG", "Catalog document is empty", 1, "catalog", null));
            return new ParseResult(new CatalogDoc(courses), errors);
        }

        List<String> lines = Arrays.asList(content.split("\\R", -1));
        CourseDoc current = null;
        boolean currentRejected = false;

        for (int i = 0; i < lines.size(); i++) {
            int lineNo = i + 1;
            String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

            Matcher markerMatcher = MARKER_PATTERN.matcher(trimmed);
            if (!markerMatcher.matches()) {
                errors.add(new ParseError("UNEXPECTED_TEXT", "Line is not a marker: " + trimmed, lineNo, "catalog",
                        current == null ? null : current.code()));
                continue;
            }

            String marker = markerMatcher.group(1);
            Map<String, String> attrs = parseAttrs(markerMatcher.group(2), lineNo, marker, errors);
            switch (marker) {
                case "course" -> {
                    current = course(attrs, lineNo, errors);
                    currentRejected = current == null;
                    if (current != null) courses.add(current);
                }
                case "schedule" -> {
                    if (current == null) {
                        // a rejected course already carries its own error
                        if (!currentRejected) {
                            errors.add(new ParseError("ORPHAN_SCHEDULE", "@schedule must follow a @course", lineNo, "schedule", null));
                        }
                        continue;
                    }
                    ScheduleDoc schedule = schedule(attrs, lineNo, current.code(), errors);
                    if (schedule != null) current.schedules().add(schedule);
                }
                default -> errors.add(new ParseError("UNKNOWN_MARKER", "Unsupported marker @" + marker, lineNo, marker, marker));
            }
        }

        if (courses.isEmpty() && errors.isEmpty()) {
            errors.add(new ParseError("EMPTY_CATALOG", "Catalog document contains no @course", 1, "catalog", null));
        }
        return new ParseResult(new CatalogDoc(courses), errors);
    }

    private CourseDoc course(Map<String, String> attrs, int line, List<ParseError> errors) {
        String code = attrs.get("code");
        String name = attrs.get("name");
        if (code == null || code.isBlank() || name == null || name.isBlank()) {
            errors.add(new ParseError("MISSING_FIELD", "@course code/name required", line, "course", code));
            return null;
        }
        Integer credits = positiveInt(attrs.get("credits"), "credits", line, code, errors);
        Integer term = positiveInt(attrs.get("term"), "term", line, code, errors);
        if (credits == null || term == null) return null;

        return new CourseDoc(code, name, credits, term, csv(attrs.get("requires")), new ArrayList<>(), line);
    }

    private ScheduleDoc schedule(Map<String, String> attrs, int line, String courseCode, List<ParseError> errors) {
        String day = attrs.get("day");
        String start = attrs.get("start");
        String end = attrs.get("end");
        if (day == null || start == null || end == null) {
            errors.add(new ParseError("MISSING_FIELD", "@schedule day/start/end required", line, "schedule", courseCode));
            return null;
        }

        DayOfWeek dayOfWeek;
        try {
            dayOfWeek = DayOfWeek.valueOf(day.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            errors.add(new ParseError("INVALID_FIELD", "@schedule day must be a day of week: " + day, line, "schedule", courseCode));
            return null;
        }

        try {
            return new ScheduleDoc(dayOfWeek, LocalTime.parse(start.trim()), LocalTime.parse(end.trim()), line);
        } catch (DateTimeParseException e) {
            errors.add(new ParseError("INVALID_FIELD", "@schedule start/end must be HH:mm: " + e.getParsedString(), line, "schedule", courseCode));
            return null;
        }
    }

    private Integer positiveInt(String raw, String field, int line, String code, List<ParseError> errors) {
        if (raw == null) {
            errors.add(new ParseError("MISSING_FIELD", "@course " + field + " required", line, "course", code));
            return null;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            value = 0;
        }
        if (value <= 0) {
            errors.add(new ParseError("INVALID_FIELD", "@course " + field + " must be a positive integer", line, "course", code));
            return null;
        }
        return value;
    }

    private Map<String, String> parseAttrs(String attrsStr, int line, String marker, List<ParseError> errors) {
        Map<String, String> attrs = new HashMap<>();
        Matcher matcher = ATTR_PATTERN.matcher(attrsStr);
        while (matcher.find()) {
            attrs.put(matcher.group(1), unescape(matcher.group(2), line, marker, errors));
        }

        String rest = ATTR_PATTERN.matcher(attrsStr).replaceAll("").trim();
        if (!rest.isEmpty()) {
            errors.add(new ParseError("INVALID_ATTR_SYNTAX", "Cannot parse attributes: " + rest, line, marker, marker));
        }
        return attrs;
    }

    private String unescape(String raw, int line, String marker, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\') {
                if (i + 1 >= raw.length()) {
                    errors.add(new ParseError("INVALID_ESCAPE", "Dangling escape", line, marker, marker));
                    break;
                }
                char n = raw.charAt(++i);
                switch (n) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> {
                        errors.add(new ParseError("INVALID_ESCAPE", "Unknown escape: \\" + n, line, marker, marker));
                        sb.append(n);
                    }
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private List<String> csv(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(",")).map(String::trim).filter(v -> !v.isEmpty()).distinct().toList();
    }

    public record ParseResult(CatalogDoc doc, List<ParseError> errors) {}
}
