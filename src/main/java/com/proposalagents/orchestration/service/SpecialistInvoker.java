package com.proposalagents.orchestration.service;

import static com.proposalagents.orchestration.OrchestrationConstants.PURPOSE_SPECIALIST;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.proposalagents.exception.GenerationTimeoutException;
import com.proposalagents.exception.MalformedGenerationResponseException;
import com.proposalagents.orchestration.api.GenerationCapability;
import com.proposalagents.orchestration.model.AgentIdentity;
import com.proposalagents.orchestration.model.FailureReason;
import com.proposalagents.orchestration.model.TaskOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one generation call and turns whatever happens into a {@link TaskOutcome}.
 * Nothing thrown by the capability escapes this class.
 */
@Service
@Slf4j
public class SpecialistInvoker {

    private final GenerationCapability generationCapability;
    private final ProposalPromptService promptService;
    private final OrchestrationMetricsService metricsService;
    private final ExecutorService generationExecutor;

    public SpecialistInvoker(GenerationCapability generationCapability,
                             ProposalPromptService promptService,
                             OrchestrationMetricsService metricsService,
                             @Qualifier("generationExecutor") ExecutorService generationExecutor) {
        this.generationCapability = generationCapability;
        this.promptService = promptService;
        this.metricsService = metricsService;
        this.generationExecutor = generationExecutor;
    }

    /**
     * @throws IllegalArgumentException if {@code identity} is not one of the six specialists
     */
    public TaskOutcome invoke(AgentIdentity identity, String topic, Duration timeout) {
        Objects.requireNonNull(identity, "identity");
        if (!identity.specialist()) {
            throw new IllegalArgumentException(identity + " is not a specialist identity");
        }
        String instruction = promptService.specialistInstruction(identity, topic);
        return invokeInstruction(identity, instruction, timeout, PURPOSE_SPECIALIST);
    }

    public TaskOutcome invokeInstruction(AgentIdentity identity, String instruction, Duration timeout, String purpose) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(timeout, "timeout");
        long started = System.nanoTime();
        log.info("{} agent starting generation call using {}.", identity.key(), generationCapability.describe());
        metricsService.recordGenerationRequest(purpose, identity.key());

        Future<String> call;
        try {
            call = generationExecutor.submit(() -> generationCapability.generate(instruction, timeout));
        } catch (RejectedExecutionException ex) {
            return failed(identity, FailureReason.UPSTREAM_ERROR, "Generation call could not be started: " + ex.getMessage(), started);
        }

        try {
            String text = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!StringUtils.hasText(text)) {
                return failed(identity, FailureReason.EMPTY_RESPONSE, "Response contained no text.", started);
            }
            String trimmed = text.trim();
            log.info("{} agent finished in {} ms ({} chars).", identity.key(), elapsedMillis(started), trimmed.length());
            return TaskOutcome.success(identity, trimmed);
        } catch (TimeoutException ex) {
            call.cancel(true);
            return failed(identity, FailureReason.TIMEOUT, "No response within " + timeout + ".", started);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return failed(identity, FailureReason.TIMEOUT, "Cancelled while waiting for a response.", started);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            return failed(identity, classify(cause), describe(cause), started);
        } catch (RuntimeException ex) {
            return failed(identity, classify(ex), describe(ex), started);
        }
    }

    static FailureReason classify(Throwable error) {
        if (causeChainContains(error, GenerationTimeoutException.class, TimeoutException.class,
                SocketTimeoutException.class, HttpTimeoutException.class)) {
            return FailureReason.TIMEOUT;
        }
        if (causeChainContains(error, MalformedGenerationResponseException.class,
                HttpMessageNotReadableException.class, JsonProcessingException.class)) {
            return FailureReason.MALFORMED_RESPONSE;
        }
        return FailureReason.UPSTREAM_ERROR;
    }

    @SafeVarargs
    private static boolean causeChainContains(Throwable error, Class<? extends Throwable>... types) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Throwable current = error;
        while (current != null && seen.put(current, Boolean.TRUE) == null) {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (StringUtils.hasText(message) ? " - " + message : "");
    }

    private TaskOutcome failed(AgentIdentity identity, FailureReason reason, String detail, long started) {
        log.warn("{} agent failed with {} after {} ms: {}", identity.key(), reason, elapsedMillis(started), detail);
        return TaskOutcome.failure(identity, reason, detail);
    }

    private static long elapsedMillis(long started) {
        return (System.nanoTime() - started) / 1_000_000L;
    }
}
