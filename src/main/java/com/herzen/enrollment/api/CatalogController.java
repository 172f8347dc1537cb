package com.herzen.enrollment.api;

import com.herzen.enrollment.catalog.CourseCatalog;
import com.herzen.enrollment.domain.DomainModels;
import com.herzen.enrollment.service.CatalogImportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {
    private final CatalogImportService importService;
    private final CourseCatalog catalog;

    public CatalogController(CatalogImportService importService, CourseCatalog catalog) {
        this.importService = importService;
        this.catalog = catalog;
    }

    @PostMapping("/import")
    public ResponseEntity<CatalogImportService.ImportResult> importCatalog(@RequestBody ImportRequest request) {
        return ResponseEntity.ok(importService.importCatalog(request.content(), request.dryRun()));
    }

    @GetMapping("/courses")
    public ResponseEntity<List<DomainModels.Course>> courses() {
        return ResponseEntity.ok(catalog.all());
    }

    @GetMapping("/courses/{code}")
    public ResponseEntity<DomainModels.Course> course(@PathVariable String code) {
        return ResponseEntity.ok(catalog.require(code));
    }

    public record ImportRequest(String content, boolean dryRun) {}
}
