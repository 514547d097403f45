package com.proposalagents.orchestration.model;

import java.util.List;
import java.util.Map;

public record AggregatedResults(
        Map<AgentIdentity, String> namedResults,
        BatchHealth batchHealth,
        List<TaskOutcome> failures
) {
    public AggregatedResults {
        namedResults = namedResults == null ? Map.of() : namedResults;
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
