package com.proposalagents.api;

import com.proposalagents.config.ProposalAgentsProperties;
import com.proposalagents.orchestration.api.GenerationCapability;
import com.proposalagents.orchestration.model.AgentIdentity;
import com.proposalagents.reports.ReportStorageService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api")
public class ConfigController {

    private final ProposalAgentsProperties properties;
    private final GenerationCapability generationCapability;
    private final ReportStorageService reportStorageService;

    public ConfigController(ProposalAgentsProperties properties,
                            GenerationCapability generationCapability,
                            ReportStorageService reportStorageService) {
        this.properties = properties;
        this.generationCapability = generationCapability;
        this.reportStorageService = reportStorageService;
    }

    @GetMapping("/config")
    public ConfigResponse getConfig() {
        return new ConfigResponse(
                properties.getAiProvider().name(),
                properties.getOpenai().getModel(),
                seconds(properties.getTaskTimeout()),
                seconds(properties.getSynthesisTimeout()),
                properties.getJobDeadline() != null ? seconds(properties.getJobDeadline()) : null,
                properties.getWorkerConcurrency(),
                properties.getMaxTopicLength(),
                specialistKeys()
        );
    }

    @GetMapping("/health")
    public HealthResponse health() {
        String reportsDirectory = reportStorageService.getReportsRoot().toString();
        if (!generationCapability.isAvailable()) {
            return new HealthResponse("error", generationCapability.describe(), specialistKeys(), reportsDirectory,
                    generationCapability.describe() + " chat client is not configured.");
        }
        return new HealthResponse("ok", generationCapability.describe(), specialistKeys(), reportsDirectory, null);
    }

    private static List<String> specialistKeys() {
        return AgentIdentity.specialists().stream().map(AgentIdentity::key).toList();
    }

    private static Long seconds(Duration duration) {
        return duration != null ? duration.toSeconds() : null;
    }

    public record ConfigResponse(
            String provider,
            String model,
            Long taskTimeoutSeconds,
            Long synthesisTimeoutSeconds,
            Long jobDeadlineSeconds,
            int workerConcurrency,
            int maxTopicLength,
            List<String> specialists
    ) {}

    public record HealthResponse(
            String status,
            String provider,
            List<String> specialists,
            String reportsDirectory,
            String message
    ) {}
}
