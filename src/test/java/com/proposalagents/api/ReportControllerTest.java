package com.proposalagents.api;

import com.proposalagents.reports.ReportEntry;
import com.proposalagents.reports.ReportListing;
import com.proposalagents.reports.ReportStorageService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReportController.class)
class ReportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReportStorageService reportStorageService;

    @Test
    void testListReports() throws Exception {
        when(reportStorageService.list()).thenReturn(new ReportListing("/srv/reports", List.of(
                new ReportEntry("Smart_irrigation-0307.md", 2048L, Instant.parse("2026-03-07T10:00:00Z")))));

        mockMvc.perform(get("/api/reports"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reports").isArray())
                .andExpect(jsonPath("$.reports[0].name").value("Smart_irrigation-0307.md"));
    }

    @Test
    void testDownloadReport() throws Exception {
        when(reportStorageService.read("Smart_irrigation-0307.md"))
                .thenReturn(new ByteArrayResource("# R&D Project Proposal: Smart irrigation".getBytes(StandardCharsets.UTF_8)));

        mockMvc.perform(get("/api/reports/Smart_irrigation-0307.md"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/markdown"))
                .andExpect(content().string("# R&D Project Proposal: Smart irrigation"));
    }

    @Test
    void testDownloadMissingReport() throws Exception {
        when(reportStorageService.read("missing.md"))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Report not found."));

        mockMvc.perform(get("/api/reports/missing.md"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Report not found."));
    }
}
