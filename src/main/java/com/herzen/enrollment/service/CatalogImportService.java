package com.herzen.enrollment.service;

import com.herzen.enrollment.catalog.CourseCatalog;
import com.herzen.enrollment.domain.DomainModels;
import com.herzen.enrollment.parser.CatalogDocParser;
import com.herzen.enrollment.parser.ParserDtos;
import com.herzen.enrollment.validation.CatalogDocValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class CatalogImportService {
    private static final Logger log = LoggerFactory.getLogger(CatalogImportService.class);

    private final CatalogDocParser parser;
    private final CatalogDocValidator validator;
    private final CourseCatalog catalog;

    public CatalogImportService(CatalogDocParser parser,
                                CatalogDocValidator validator,
                                CourseCatalog catalog) {
        this.parser = parser;
        this.validator = validator;
        this.catalog = catalog;
    }

    public ImportResult importCatalog(String content, boolean dryRun) {
        CatalogDocParser.ParseResult parseResult = parser.parse(content);
        List<ParserDtos.ParseError> errors = new ArrayList<>(parseResult.errors());
        errors.addAll(validator.validate(parseResult.doc(), catalog.prerequisiteGraph()));

        if (!errors.isEmpty()) {
            log.info("Catalog import rejected: {} error(s), first={}", errors.size(), errors.get(0).code());
            return new ImportResult(dryRun, false, List.of(), errors);
        }

        List<DomainModels.Course> courses = parseResult.doc().courses().stream()
                .map(this::toDomain)
                .toList();
        if (!dryRun) {
            catalog.register(courses);
            log.info("Catalog imported: {} course(s)", courses.size());
        }
        return new ImportResult(dryRun, true, courses, errors);
    }

    private DomainModels.Course toDomain(ParserDtos.CourseDoc doc) {
        List<DomainModels.Schedule> schedules = doc.schedules().stream()
                .map(s -> new DomainModels.Schedule(s.day(), s.start(), s.end()))
                .toList();
        return new DomainModels.Course(doc.code(), doc.name(), doc.credits(), doc.term(), doc.prerequisiteCodes(), schedules);
    }

    public record ImportResult(boolean dryRun,
                               boolean valid,
                               List<DomainModels.Course> courses,
                               List<ParserDtos.ParseError> errors) {
    }
}
