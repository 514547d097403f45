package com.proposalagents.orchestration.model;

import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of a single job. Stages only move forward; a failure jumps straight to
 * {@link PipelineStage#DONE} and remembers the stage it happened in.
 */
public class JobState {

    private final String jobId;
    private final String topic;
    private final long startedNanos;

    private PipelineStage stage = PipelineStage.START;
    private List<TaskOutcome> outcomes = List.of();
    private AggregatedResults aggregated;
    private TaskOutcome synthesisOutcome;
    private Path artifactPath;
    private PipelineStage failedStage;
    private PipelineError error;

    public JobState(String jobId, String topic) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.topic = topic;
        this.startedNanos = System.nanoTime();
    }

    public void enter(PipelineStage next) {
        Objects.requireNonNull(next, "next");
        if (next.ordinal() <= stage.ordinal()) {
            throw new IllegalStateException("Job " + jobId + " cannot move from " + stage + " to " + next);
        }
        stage = next;
    }

    public void recordOutcomes(List<TaskOutcome> outcomes, int expected) {
        requireStage(PipelineStage.FAN_OUT);
        List<TaskOutcome> copy = List.copyOf(outcomes);
        if (copy.size() != expected) {
            throw new IllegalStateException("Job " + jobId + " expected " + expected
                    + " specialist outcomes but received " + copy.size());
        }
        this.outcomes = copy;
    }

    public void recordAggregate(AggregatedResults aggregated) {
        requireStage(PipelineStage.AGGREGATE);
        this.aggregated = Objects.requireNonNull(aggregated, "aggregated");
    }

    public void recordSynthesis(TaskOutcome synthesisOutcome) {
        requireStage(PipelineStage.SYNTHESIZE);
        this.synthesisOutcome = Objects.requireNonNull(synthesisOutcome, "synthesisOutcome");
    }

    public void recordArtifact(Path artifactPath) {
        requireStage(PipelineStage.PERSIST);
        this.artifactPath = Objects.requireNonNull(artifactPath, "artifactPath");
    }

    public void fail(PipelineError error) {
        this.error = Objects.requireNonNull(error, "error");
        this.failedStage = stage;
        this.stage = PipelineStage.DONE;
    }

    public void finish() {
        if (stage != PipelineStage.DONE) {
            enter(PipelineStage.DONE);
        }
    }

    public JobStatus finalStatus() {
        if (error != null || synthesisOutcome == null || !synthesisOutcome.succeeded() || artifactPath == null) {
            return JobStatus.ERROR;
        }
        return batchHealth() == BatchHealth.ALL_SUCCEEDED ? JobStatus.SUCCESS : JobStatus.PARTIAL_SUCCESS;
    }

    public BatchHealth batchHealth() {
        return aggregated != null ? aggregated.batchHealth() : BatchHealth.ALL_SUCCEEDED;
    }

    public List<SpecialistFailure> specialistFailures() {
        return outcomes.stream()
                .filter(TaskOutcome::failed)
                .map(SpecialistFailure::from)
                .toList();
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    public JobResult toResult(String message) {
        return new JobResult(jobId, finalStatus(), message, artifactPath, topic, failedStage, error,
                specialistFailures(), elapsed());
    }

    private void requireStage(PipelineStage expected) {
        if (stage != expected) {
            throw new IllegalStateException("Job " + jobId + " is in " + stage + ", not " + expected);
        }
    }

    public String getJobId() {
        return jobId;
    }

    public String getTopic() {
        return topic;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public List<TaskOutcome> getOutcomes() {
        return outcomes;
    }

    @Nullable
    public AggregatedResults getAggregated() {
        return aggregated;
    }

    @Nullable
    public TaskOutcome getSynthesisOutcome() {
        return synthesisOutcome;
    }

    @Nullable
    public Path getArtifactPath() {
        return artifactPath;
    }

    @Nullable
    public PipelineStage getFailedStage() {
        return failedStage;
    }

    @Nullable
    public PipelineError getError() {
        return error;
    }
}
