package com.proposalagents.orchestration.model;

import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public record JobResult(
        String jobId,
        JobStatus status,
        String message,
        @Nullable Path artifactPath,
        String topic,
        @Nullable PipelineStage failedStage,
        @Nullable PipelineError error,
        List<SpecialistFailure> specialistFailures,
        Duration elapsed
) {
    public JobResult {
        specialistFailures = specialistFailures == null ? List.of() : List.copyOf(specialistFailures);
    }
}
