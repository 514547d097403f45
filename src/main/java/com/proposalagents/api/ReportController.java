package com.proposalagents.api;

import com.proposalagents.reports.ReportListing;
import com.proposalagents.reports.ReportStorageService;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/reports")
public class ReportController {

    static final MediaType TEXT_MARKDOWN = new MediaType("text", "markdown", StandardCharsets.UTF_8);

    private final ReportStorageService reportStorageService;

    public ReportController(ReportStorageService reportStorageService) {
        this.reportStorageService = reportStorageService;
    }

    @GetMapping
    public ReportListing list() {
        return reportStorageService.list();
    }

    @GetMapping("/{name}")
    public ResponseEntity<Resource> download(@PathVariable String name) {
        Resource report = reportStorageService.read(name);
        return ResponseEntity.ok()
                .contentType(TEXT_MARKDOWN)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(name, StandardCharsets.UTF_8).build().toString())
                .body(report);
    }
}
