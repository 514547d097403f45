package com.proposalagents.orchestration.service;

import static com.proposalagents.orchestration.OrchestrationConstants.FAILED_SECTION_TEMPLATE;

import com.proposalagents.orchestration.model.AgentIdentity;
import com.proposalagents.orchestration.model.AggregatedResults;
import com.proposalagents.orchestration.model.BatchHealth;
import com.proposalagents.orchestration.model.TaskOutcome;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds specialist outcomes into named sections. Stateless; the same input always
 * yields an equal result and no identity is dropped.
 */
@Service
public class OutcomeAggregator {

    public AggregatedResults aggregate(List<TaskOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return new AggregatedResults(Map.of(), BatchHealth.ALL_SUCCEEDED, List.of());
        }
        Map<AgentIdentity, String> named = new LinkedHashMap<>();
        List<TaskOutcome> failures = new ArrayList<>();
        for (TaskOutcome outcome : outcomes) {
            if (outcome == null) {
                continue;
            }
            if (outcome.succeeded()) {
                named.put(outcome.identity(), outcome.payload());
            } else {
                named.put(outcome.identity(), placeholder(outcome));
                failures.add(outcome);
            }
        }
        BatchHealth health = failures.isEmpty() ? BatchHealth.ALL_SUCCEEDED : BatchHealth.PARTIALLY_FAILED;
        return new AggregatedResults(Collections.unmodifiableMap(named), health, failures);
    }

    static String placeholder(TaskOutcome failure) {
        return FAILED_SECTION_TEMPLATE.formatted(failure.identity().key(), failure.failureReason().label(), failure.detail());
    }
}
