package com.proposalagents.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * One proposal job. Null durations fall back to the configured defaults.
 */
public record JobRequest(
        String topic,
        @Nullable Duration taskTimeout,
        @Nullable Duration jobDeadline
) {

    public static JobRequest of(String topic) {
        return new JobRequest(topic, null, null);
    }
}
