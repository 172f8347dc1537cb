package com.herzen.enrollment.parser;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

public class ParserDtos {
    public record CatalogDoc(List<CourseDoc> courses) {}

    public record CourseDoc(String code, String name, int credits, int term,
                            List<String> prerequisiteCodes,
                            List<ScheduleDoc> schedules,
                            int line) {}

    public record ScheduleDoc(DayOfWeek day, LocalTime start, LocalTime end, int line) {}

    public record ParseError(String code, String message, int line, String block, String sectionId) {}
}
