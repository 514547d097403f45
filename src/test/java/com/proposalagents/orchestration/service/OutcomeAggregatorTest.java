package com.proposalagents.orchestration.service;

import com.proposalagents.orchestration.model.AgentIdentity;
import com.proposalagents.orchestration.model.AggregatedResults;
import com.proposalagents.orchestration.model.BatchHealth;
import com.proposalagents.orchestration.model.FailureReason;
import com.proposalagents.orchestration.model.TaskOutcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeAggregatorTest {

    private final OutcomeAggregator aggregator = new OutcomeAggregator();

    @Test
    void testAllSucceeded() {
        List<TaskOutcome> outcomes = AgentIdentity.specialists().stream()
                .map(identity -> TaskOutcome.success(identity, identity.key() + " text"))
                .toList();

        AggregatedResults results = aggregator.aggregate(outcomes);

        assertEquals(BatchHealth.ALL_SUCCEEDED, results.batchHealth());
        assertTrue(results.failures().isEmpty());
        assertEquals(AgentIdentity.specialists(), new ArrayList<>(results.namedResults().keySet()));
        assertEquals("budget text", results.namedResults().get(AgentIdentity.BUDGET));
    }

    @Test
    void testFailureBecomesPlaceholderAndEveryIdentityIsKept() {
        TaskOutcome timeout = TaskOutcome.failure(AgentIdentity.PLAN, FailureReason.TIMEOUT, "No response within PT5M.");
        List<TaskOutcome> outcomes = List.of(
                TaskOutcome.success(AgentIdentity.BACKGROUND, "background text"),
                timeout,
                TaskOutcome.success(AgentIdentity.IMPACT, "impact text"));

        AggregatedResults results = aggregator.aggregate(outcomes);

        assertEquals(BatchHealth.PARTIALLY_FAILED, results.batchHealth());
        assertEquals(List.of(timeout), results.failures());
        assertEquals(3, results.namedResults().size());
        String placeholder = results.namedResults().get(AgentIdentity.PLAN);
        assertTrue(placeholder.contains("plan"));
        assertTrue(placeholder.contains("Timeout"));
        assertTrue(placeholder.contains("No response within PT5M."));
    }

    @Test
    void testAggregationIsRepeatable() {
        List<TaskOutcome> outcomes = List.of(
                TaskOutcome.success(AgentIdentity.MARKET, "market text"),
                TaskOutcome.failure(AgentIdentity.BUDGET, FailureReason.UPSTREAM_ERROR, null));

        assertEquals(aggregator.aggregate(outcomes), aggregator.aggregate(outcomes));
    }

    @Test
    void testEmptyInput() {
        AggregatedResults results = aggregator.aggregate(List.of());

        assertEquals(BatchHealth.ALL_SUCCEEDED, results.batchHealth());
        assertTrue(results.namedResults().isEmpty());
    }

    @Test
    void testResultIsUnmodifiable() {
        AggregatedResults results = aggregator.aggregate(List.of(TaskOutcome.success(AgentIdentity.MARKET, "x")));

        assertThrows(UnsupportedOperationException.class,
                () -> results.namedResults().put(AgentIdentity.PLAN, "y"));
    }
}
