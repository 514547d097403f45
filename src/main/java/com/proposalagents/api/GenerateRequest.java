package com.proposalagents.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Positive;

/**
 * Body of {@code POST /api/generate}. Blank topics are rejected by the pipeline, not here,
 * so the caller still gets a job id and a stage-specific message.
 */
public record GenerateRequest(
        @JsonAlias("idea") String topic,
        @Positive Long taskTimeoutSeconds,
        @Positive Long jobDeadlineSeconds
) {
}
