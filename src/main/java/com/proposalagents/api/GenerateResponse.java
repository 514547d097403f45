package com.proposalagents.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalagents.orchestration.model.JobResult;
import com.proposalagents.orchestration.model.SpecialistFailure;

import java.util.List;

public record GenerateResponse(
        String status,
        @JsonProperty("job_status") String jobStatus,
        String message,
        @JsonProperty("file_path") String filePath,
        String topic,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("failed_stage") String failedStage,
        @JsonProperty("specialist_failures") List<SpecialistFailure> specialistFailures,
        @JsonProperty("elapsed_ms") long elapsedMs
) {

    public static GenerateResponse from(JobResult result) {
        return new GenerateResponse(
                result.status().producedArtifact() ? "success" : "error",
                result.status().wireValue(),
                result.message(),
                result.artifactPath() != null ? result.artifactPath().toString() : null,
                result.topic(),
                result.jobId(),
                result.failedStage() != null ? result.failedStage().name() : null,
                result.specialistFailures(),
                result.elapsed().toMillis()
        );
    }
}
