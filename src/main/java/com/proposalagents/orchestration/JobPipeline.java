package com.proposalagents.orchestration;

import static com.proposalagents.orchestration.OrchestrationConstants.MESSAGE_BLANK_TOPIC;
import static com.proposalagents.orchestration.OrchestrationConstants.MESSAGE_PARTIAL_SUCCESS;
import static com.proposalagents.orchestration.OrchestrationConstants.MESSAGE_PERSISTENCE_FAILED;
import static com.proposalagents.orchestration.OrchestrationConstants.MESSAGE_SCHEDULING_FAILED;
import static com.proposalagents.orchestration.OrchestrationConstants.MESSAGE_SUCCESS;
import static com.proposalagents.orchestration.OrchestrationConstants.MESSAGE_SYNTHESIS_FAILED;
import static com.proposalagents.orchestration.OrchestrationConstants.MESSAGE_TOPIC_TOO_LONG;

import com.proposalagents.config.ProposalAgentsProperties;
import com.proposalagents.exception.ReportStorageException;
import com.proposalagents.exception.SchedulingFailedException;
import com.proposalagents.orchestration.api.GenerationCapability;
import com.proposalagents.orchestration.api.PersistenceSink;
import com.proposalagents.orchestration.model.AgentIdentity;
import com.proposalagents.orchestration.model.AggregatedResults;
import com.proposalagents.orchestration.model.JobRequest;
import com.proposalagents.orchestration.model.JobResult;
import com.proposalagents.orchestration.model.JobState;
import com.proposalagents.orchestration.model.JobStatus;
import com.proposalagents.orchestration.model.PipelineError;
import com.proposalagents.orchestration.model.PipelineStage;
import com.proposalagents.orchestration.model.SpecialistFailure;
import com.proposalagents.orchestration.model.TaskOutcome;
import com.proposalagents.orchestration.service.FanOutCoordinator;
import com.proposalagents.orchestration.service.OrchestrationMetricsService;
import com.proposalagents.orchestration.service.OutcomeAggregator;
import com.proposalagents.orchestration.service.SynthesisStage;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Drives one proposal job through fan-out, aggregation, synthesis and persistence.
 *
 * <p>Specialist failures never end a job; they are carried into the synthesis input as
 * placeholders and downgrade the final status to {@link JobStatus#PARTIAL_SUCCESS}. A failed
 * synthesis, a failed save or a batch that could not be scheduled ends the job with
 * {@link JobStatus#ERROR}. Nothing is retried here.</p>
 */
@Service
@Slf4j
public class JobPipeline {

    public static final String MDC_JOB_ID = "jobId";

    private final FanOutCoordinator fanOutCoordinator;
    private final OutcomeAggregator outcomeAggregator;
    private final SynthesisStage synthesisStage;
    private final PersistenceSink persistenceSink;
    private final GenerationCapability generationCapability;
    private final OrchestrationMetricsService metricsService;
    private final ProposalAgentsProperties properties;

    public JobPipeline(FanOutCoordinator fanOutCoordinator,
                       OutcomeAggregator outcomeAggregator,
                       SynthesisStage synthesisStage,
                       PersistenceSink persistenceSink,
                       GenerationCapability generationCapability,
                       OrchestrationMetricsService metricsService,
                       ProposalAgentsProperties properties) {
        this.fanOutCoordinator = fanOutCoordinator;
        this.outcomeAggregator = outcomeAggregator;
        this.synthesisStage = synthesisStage;
        this.persistenceSink = persistenceSink;
        this.generationCapability = generationCapability;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    public JobResult run(String topic) {
        return run(JobRequest.of(topic));
    }

    public JobResult run(JobRequest request) {
        String jobId = UUID.randomUUID().toString();
        String topic = request.topic() != null ? request.topic().trim() : null;
        JobState state = new JobState(jobId, topic);
        String previousJobId = MDC.get(MDC_JOB_ID);
        MDC.put(MDC_JOB_ID, jobId);
        try {
            JobResult result = execute(state, request);
            metricsService.recordJob(result.status(), result.elapsed());
            metricsService.logSummary();
            return result;
        } finally {
            if (previousJobId != null) {
                MDC.put(MDC_JOB_ID, previousJobId);
            } else {
                MDC.remove(MDC_JOB_ID);
            }
        }
    }

    private JobResult execute(JobState state, JobRequest request) {
        String topic = state.getTopic();
        if (!StringUtils.hasText(topic)) {
            log.warn("Rejecting job: topic is blank.");
            return failed(state, PipelineError.VALIDATION_FAILED, MESSAGE_BLANK_TOPIC);
        }
        if (topic.length() > properties.getMaxTopicLength()) {
            log.warn("Rejecting job: topic has {} characters (max {}).", topic.length(), properties.getMaxTopicLength());
            return failed(state, PipelineError.VALIDATION_FAILED, MESSAGE_TOPIC_TOO_LONG.formatted(properties.getMaxTopicLength()));
        }
        log.info("Job started for topic: {}", abbreviate(topic));

        // FAN_OUT
        state.enter(PipelineStage.FAN_OUT);
        List<AgentIdentity> specialists = AgentIdentity.specialists();
        Duration taskTimeout = request.taskTimeout() != null ? request.taskTimeout() : properties.getTaskTimeout();
        Duration jobDeadline = request.jobDeadline() != null ? request.jobDeadline() : properties.getJobDeadline();
        long stageStarted = System.nanoTime();
        List<TaskOutcome> outcomes;
        try {
            outcomes = fanOutCoordinator.runAll(topic, specialists, taskTimeout, jobDeadline);
        } catch (SchedulingFailedException ex) {
            return failed(state, PipelineError.SCHEDULING_FAILED, MESSAGE_SCHEDULING_FAILED.formatted(ex.getMessage()));
        }
        state.recordOutcomes(outcomes, specialists.size());
        log.info("All specialist tasks finished in {} ms.", millisSince(stageStarted));

        // AGGREGATE
        state.enter(PipelineStage.AGGREGATE);
        AggregatedResults aggregated = outcomeAggregator.aggregate(outcomes);
        state.recordAggregate(aggregated);
        if (!aggregated.failures().isEmpty()) {
            log.warn("{} of {} specialists failed: {}", aggregated.failures().size(), specialists.size(),
                    describeFailures(state.specialistFailures()));
        }

        // SYNTHESIZE
        state.enter(PipelineStage.SYNTHESIZE);
        stageStarted = System.nanoTime();
        TaskOutcome synthesis = synthesisStage.synthesize(topic, aggregated.namedResults());
        state.recordSynthesis(synthesis);
        log.info("Synthesis finished in {} ms with {}.", millisSince(stageStarted), synthesis.kind());
        if (synthesis.failed()) {
            return failed(state, PipelineError.SYNTHESIS_FAILED,
                    MESSAGE_SYNTHESIS_FAILED.formatted(synthesis.failureReason().label(), synthesis.detail())
                            + failureSuffix(state));
        }

        // PERSIST
        state.enter(PipelineStage.PERSIST);
        stageStarted = System.nanoTime();
        Path artifact;
        try {
            artifact = persistenceSink.save(topic, synthesis.payload());
        } catch (ReportStorageException ex) {
            log.error("Report could not be saved.", ex);
            return failed(state, PipelineError.PERSISTENCE_FAILED, MESSAGE_PERSISTENCE_FAILED.formatted(ex.getMessage()));
        }
        state.recordArtifact(artifact);
        log.info("Report saved in {} ms.", millisSince(stageStarted));

        state.finish();
        String message = state.finalStatus() == JobStatus.SUCCESS
                ? MESSAGE_SUCCESS.formatted(generationCapability.describe(), artifact)
                : MESSAGE_PARTIAL_SUCCESS.formatted(state.specialistFailures().size(),
                        describeFailures(state.specialistFailures()), artifact);
        JobResult result = state.toResult(message);
        log.info("Job finished with {} in {} ms.", result.status(), result.elapsed().toMillis());
        return result;
    }

    private JobResult failed(JobState state, PipelineError error, String message) {
        state.fail(error);
        JobResult result = state.toResult(message);
        log.error("Job failed at stage {} ({}) after {} ms: {}", result.failedStage(), error,
                result.elapsed().toMillis(), message);
        return result;
    }

    private static String failureSuffix(JobState state) {
        List<SpecialistFailure> failures = state.specialistFailures();
        return failures.isEmpty() ? "" : " Specialist failures: " + describeFailures(failures) + ".";
    }

    static String describeFailures(List<SpecialistFailure> failures) {
        return failures.stream()
                .map(failure -> failure.identity() + ": " + failure.reason().label())
                .collect(Collectors.joining(", "));
    }

    private static long millisSince(long started) {
        return (System.nanoTime() - started) / 1_000_000L;
    }

    private static String abbreviate(String topic) {
        return topic.length() <= 80 ? topic : topic.substring(0, 77) + "...";
    }
}
