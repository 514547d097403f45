package com.proposalagents.orchestration.service;

import com.proposalagents.config.ProposalAgentsProperties;
import com.proposalagents.exception.SchedulingFailedException;
import com.proposalagents.orchestration.model.AgentIdentity;
import com.proposalagents.orchestration.model.FailureReason;
import com.proposalagents.orchestration.model.TaskOutcome;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntFunction;

/**
 * Runs a batch of specialists on a pool of its own and waits for all of them.
 *
 * <p>Outcomes come back in the order of the requested identities, not in completion order.
 * A failing or slow specialist never affects its siblings. When a job deadline is given,
 * every specialist still running at the deadline is cancelled and reported as a timeout.</p>
 */
@Service
@Slf4j
public class FanOutCoordinator {

    private final SpecialistInvoker specialistInvoker;
    private final IntFunction<ExecutorService> executorFactory;
    private final OrchestrationMetricsService metricsService;
    private final ProposalAgentsProperties properties;

    public FanOutCoordinator(SpecialistInvoker specialistInvoker,
                             @Qualifier("fanOutExecutorFactory") IntFunction<ExecutorService> executorFactory,
                             OrchestrationMetricsService metricsService,
                             ProposalAgentsProperties properties) {
        this.specialistInvoker = specialistInvoker;
        this.executorFactory = executorFactory;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    public List<TaskOutcome> runAll(String topic, List<AgentIdentity> identities) {
        return runAll(topic, identities, properties.getTaskTimeout(), properties.getJobDeadline());
    }

    public List<TaskOutcome> runAll(String topic, List<AgentIdentity> identities,
                                    Duration taskTimeout, @Nullable Duration jobDeadline) {
        if (identities == null || identities.isEmpty()) {
            return List.of();
        }
        requireDistinct(identities);
        long started = System.nanoTime();
        log.info("Starting concurrent calls to {} specialists (taskTimeout={}, jobDeadline={}).",
                identities.size(), taskTimeout, jobDeadline != null ? jobDeadline : "none");

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        int poolSize = Math.max(1, Math.min(properties.getWorkerConcurrency(), identities.size()));
        ExecutorService workers = executorFactory.apply(poolSize);
        List<TaskOutcome> outcomes = new ArrayList<>(identities.size());
        try {
            List<Future<TaskOutcome>> futures = new ArrayList<>(identities.size());
            try {
                for (AgentIdentity identity : identities) {
                    futures.add(workers.submit(() -> runWithContext(mdc,
                            () -> specialistInvoker.invoke(identity, topic, taskTimeout))));
                }
            } catch (RejectedExecutionException ex) {
                futures.forEach(future -> future.cancel(true));
                log.error("Specialist batch could not be scheduled after {} of {} submissions.",
                        futures.size(), identities.size(), ex);
                throw new SchedulingFailedException("Worker pool rejected specialist tasks: " + ex.getMessage(), ex);
            }

            long deadlineNanos = jobDeadline != null ? started + jobDeadline.toNanos() : Long.MIN_VALUE;
            for (int i = 0; i < identities.size(); i++) {
                outcomes.add(await(identities.get(i), futures.get(i), deadlineNanos, jobDeadline));
            }
        } finally {
            workers.shutdownNow();
        }
        metricsService.recordFanOut(outcomes, Duration.ofNanos(System.nanoTime() - started));
        return List.copyOf(outcomes);
    }

    private TaskOutcome await(AgentIdentity identity, Future<TaskOutcome> future,
                              long deadlineNanos, @Nullable Duration jobDeadline) {
        try {
            if (jobDeadline == null) {
                return future.get();
            }
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("{} agent still pending when the job deadline of {} elapsed; cancelled.", identity.key(), jobDeadline);
            return TaskOutcome.failure(identity, FailureReason.TIMEOUT,
                    "Job deadline of " + jobDeadline + " elapsed before the specialist finished.");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return TaskOutcome.failure(identity, FailureReason.TIMEOUT, "Job was interrupted before the specialist finished.");
        } catch (CancellationException ex) {
            return TaskOutcome.failure(identity, FailureReason.TIMEOUT, "Specialist task was cancelled.");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.error("{} agent task failed outside the invoker.", identity.key(), cause);
            return TaskOutcome.failure(identity, FailureReason.UPSTREAM_ERROR, cause.getClass().getSimpleName()
                    + (cause.getMessage() != null ? " - " + cause.getMessage() : ""));
        }
    }

    private static void requireDistinct(List<AgentIdentity> identities) {
        Set<AgentIdentity> seen = EnumSet.noneOf(AgentIdentity.class);
        for (AgentIdentity identity : identities) {
            if (identity == null) {
                throw new IllegalArgumentException("Specialist identities must not contain null");
            }
            if (!identity.specialist()) {
                throw new IllegalArgumentException(identity.key() + " cannot run as a specialist");
            }
            if (!seen.add(identity)) {
                throw new IllegalArgumentException("Duplicate specialist identity: " + identity.key());
            }
        }
    }

    private static <T> T runWithContext(@Nullable Map<String, String> mdc, Callable<T> task) throws Exception {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdc != null) {
            MDC.setContextMap(mdc);
        } else {
            MDC.clear();
        }
        try {
            return task.call();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }
}
