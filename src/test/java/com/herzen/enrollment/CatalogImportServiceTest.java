package com.herzen.enrollment;

import com.herzen.enrollment.catalog.CourseCatalog;
import com.herzen.enrollment.service.CatalogImportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CatalogImportServiceTest {
    @Autowired
    private CatalogImportService service;

    @Autowired
    private CourseCatalog catalog;

    @Test
    void importsValidCatalogAndRegistersCourses() {
        String doc = """
                @course code="IMP101" name="Programming I" credits="4" term="1"
                @schedule day="MONDAY" start="08:00" end="10:00"
                @course code="IMP201" name="Programming II" credits="4" term="2" requires="IMP101"
                @schedule day="TUESDAY" start="10:00" end="12:00"
                """;
        var result = service.importCatalog(doc, false);
        assertTrue(result.valid(), result.errors().toString());
        assertEquals(2, result.courses().size());

        var registered = catalog.require("IMP201");
        assertEquals(List.of("IMP101"), registered.prerequisiteCodes());
        assertEquals(1, registered.schedules().size());
    }

    @Test
    void dryRunValidatesWithoutRegistering() {
        String doc = """
                @course code="DRY101" name="Dry" credits="2" term="1"
                """;
        var result = service.importCatalog(doc, true);
        assertTrue(result.valid());
        assertTrue(result.dryRun());
        assertEquals("DRY101", result.courses().get(0).code());
        assertTrue(catalog.find("DRY101").isEmpty());
    }

    @Test
    void prerequisiteMayReferToAlreadyImportedCourse() {
        assertTrue(service.importCatalog("@course code=\"BASE1\" name=\"Base\" credits=\"3\" term=\"1\"", false).valid());

        var result = service.importCatalog("@course code=\"NEXT1\" name=\"Next\" credits=\"3\" term=\"2\" requires=\"BASE1\"", false);
        assertTrue(result.valid(), result.errors().toString());
    }

    @Test
    void reportsCatalogLevelErrors() {
        String doc = """
                @course code="ERR1" name="One" credits="3" term="1" requires="ERR2"
                @course code="ERR2" name="Two" credits="3" term="1" requires="ERR1"
                @course code="ERR3" name="Three" credits="3" term="1" requires="NOPE,ERR3"
                @schedule day="FRIDAY" start="12:00" end="11:00"
                @course code="ERR3" name="Again" credits="3" term="1"
                """;
        var result = service.importCatalog(doc, false);
        assertFalse(result.valid());
        assertTrue(result.courses().isEmpty());

        List<String> codes = result.errors().stream().map(e -> e.code()).toList();
        assertTrue(codes.contains("DUPLICATE_COURSE"));
        assertTrue(codes.contains("PREREQUISITE_NOT_FOUND"));
        assertTrue(codes.contains("SELF_PREREQUISITE"));
        assertTrue(codes.contains("INVALID_SCHEDULE"));
        assertTrue(codes.contains("PREREQUISITE_CYCLE"));
        assertTrue(catalog.find("ERR1").isEmpty());
    }

    @Test
    void parseErrorsBlockImport() {
        var result = service.importCatalog("@course code=\"BAD1\" name=\"Bad\" credits=\"-1\" term=\"1\"", false);
        assertFalse(result.valid());
        assertEquals("INVALID_FIELD", result.errors().get(0).code());
        assertEquals(1, result.errors().get(0).line());
    }
}
