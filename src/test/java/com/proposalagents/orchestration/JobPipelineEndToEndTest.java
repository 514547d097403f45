package com.proposalagents.orchestration;

import com.proposalagents.config.ProposalAgentsProperties;
import com.proposalagents.orchestration.api.PersistenceSink;
import com.proposalagents.orchestration.model.AgentIdentity;
import com.proposalagents.orchestration.model.FailureReason;
import com.proposalagents.orchestration.model.JobRequest;
import com.proposalagents.orchestration.model.JobResult;
import com.proposalagents.orchestration.model.JobStatus;
import com.proposalagents.orchestration.model.PipelineError;
import com.proposalagents.orchestration.model.PipelineStage;
import com.proposalagents.orchestration.model.SpecialistFailure;
import com.proposalagents.orchestration.service.FakeGenerationCapability;
import com.proposalagents.orchestration.service.FanOutCoordinator;
import com.proposalagents.orchestration.service.OrchestrationMetricsService;
import com.proposalagents.orchestration.service.OutcomeAggregator;
import com.proposalagents.orchestration.service.ProposalPromptService;
import com.proposalagents.orchestration.service.SpecialistInvoker;
import com.proposalagents.orchestration.service.SynthesisStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.proposalagents.orchestration.OrchestrationConstants.PURPOSE_SPECIALIST;
import static com.proposalagents.orchestration.OrchestrationConstants.PURPOSE_SYNTHESIS;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs whole jobs through the real coordinator, invoker, aggregator and synthesis stage.
 * Only the generation capability and the sink are replaced.
 */
class JobPipelineEndToEndTest {

    private static final String TOPIC = "Low-cost soil moisture sensing for smallholder farms";

    private final ProposalPromptService promptService = new ProposalPromptService();
    private final OrchestrationMetricsService metricsService = new OrchestrationMetricsService();
    private final ProposalAgentsProperties properties = new ProposalAgentsProperties();
    private final RecordingSink sink = new RecordingSink();

    private ExecutorService generationExecutor;
    private FakeGenerationCapability capability;
    private JobPipeline pipeline;

    @BeforeEach
    void setUp() {
        generationExecutor = Executors.newCachedThreadPool();
        capability = new FakeGenerationCapability(promptService, TOPIC);
        SpecialistInvoker invoker = new SpecialistInvoker(capability, promptService, metricsService, generationExecutor);
        FanOutCoordinator coordinator = new FanOutCoordinator(invoker, Executors::newFixedThreadPool, metricsService, properties);
        SynthesisStage synthesisStage = new SynthesisStage(invoker, promptService, properties);
        pipeline = new JobPipeline(coordinator, new OutcomeAggregator(), synthesisStage, sink,
                capability, metricsService, properties);
    }

    @AfterEach
    void tearDown() {
        capability.releaseAll();
        generationExecutor.shutdownNow();
    }

    @Test
    void testAllSpecialistsSucceed() {
        capability.on(AgentIdentity.SYNTHESIS, id -> "Complete proposal");

        JobResult result = pipeline.run(TOPIC);

        assertEquals(JobStatus.SUCCESS, result.status());
        assertEquals(List.of("Complete proposal"), sink.contents);
        assertEquals(7, capability.calls().size());
        assertTrue(capability.synthesisInstructions().get(0).contains("background section"));
        assertEquals(6, metricsService.generationRequestCount(PURPOSE_SPECIALIST));
        assertEquals(1, metricsService.generationRequestCount(PURPOSE_SYNTHESIS));
    }

    @Test
    void testSpecialistTimeoutGivesPartialSuccess() {
        properties.setTaskTimeout(Duration.ofMillis(500));
        properties.setSynthesisTimeout(Duration.ofSeconds(5));
        capability.blockUntilReleased(AgentIdentity.MARKET)
                .on(AgentIdentity.SYNTHESIS, id -> "Proposal with a gap");

        JobResult result = pipeline.run(TOPIC);

        assertEquals(JobStatus.PARTIAL_SUCCESS, result.status());
        assertNotNull(result.artifactPath());
        assertEquals(List.of(new SpecialistFailure("market", FailureReason.TIMEOUT, "No response within PT0.5S.")),
                result.specialistFailures());
        String synthesisInstruction = capability.synthesisInstructions().get(0);
        assertTrue(synthesisInstruction.contains("[Section unavailable: the market specialist failed (Timeout)."));
        assertTrue(synthesisInstruction.contains("technical section"));
        assertEquals(List.of("Proposal with a gap"), sink.contents);
    }

    @Test
    void testJobDeadlineCancelsPendingSpecialistsAndJobContinues() {
        capability.blockUntilReleased(AgentIdentity.TECHNICAL)
                .blockUntilReleased(AgentIdentity.IMPACT)
                .on(AgentIdentity.SYNTHESIS, id -> "Proposal without two sections");

        long started = System.nanoTime();
        JobResult result = pipeline.run(new JobRequest(TOPIC, Duration.ofSeconds(30), Duration.ofMillis(500)));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;

        assertTrue(elapsedMillis < 10_000, "deadline should end the fan-out, took " + elapsedMillis + " ms");
        assertEquals(JobStatus.PARTIAL_SUCCESS, result.status());
        assertEquals(List.of("technical", "impact"),
                result.specialistFailures().stream().map(SpecialistFailure::identity).toList());
        assertTrue(result.specialistFailures().stream().allMatch(failure -> failure.reason() == FailureReason.TIMEOUT));
        String synthesisInstruction = capability.synthesisInstructions().get(0);
        assertTrue(synthesisInstruction.contains("background section"));
        assertTrue(synthesisInstruction.contains("market section"));
        assertTrue(synthesisInstruction.contains("budget section"));
        assertTrue(synthesisInstruction.contains("plan section"));
        assertEquals(1, sink.contents.size());
    }

    @Test
    void testBlankTopicNeverReachesCapability() {
        JobResult result = pipeline.run(" \n ");

        assertEquals(JobStatus.ERROR, result.status());
        assertEquals(PipelineStage.START, result.failedStage());
        assertEquals(PipelineError.VALIDATION_FAILED, result.error());
        assertTrue(capability.calls().isEmpty());
        assertTrue(sink.contents.isEmpty());
    }

    @Test
    void testSynthesisFailureSavesNothing() {
        capability.on(AgentIdentity.SYNTHESIS, id -> {
            throw new IllegalStateException("503 Service Unavailable");
        });

        JobResult result = pipeline.run(TOPIC);

        assertEquals(JobStatus.ERROR, result.status());
        assertEquals(PipelineStage.SYNTHESIZE, result.failedStage());
        assertTrue(sink.contents.isEmpty());
    }

    private static class RecordingSink implements PersistenceSink {

        private final List<String> contents = new CopyOnWriteArrayList<>();

        @Override
        public Path save(String topic, String content) {
            contents.add(content);
            return Path.of("reports", "report-" + contents.size() + ".md");
        }
    }
}
