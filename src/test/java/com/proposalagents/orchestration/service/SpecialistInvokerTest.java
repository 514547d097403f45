package com.proposalagents.orchestration.service;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.proposalagents.exception.GenerationTimeoutException;
import com.proposalagents.exception.MalformedGenerationResponseException;
import com.proposalagents.orchestration.api.GenerationCapability;
import com.proposalagents.orchestration.model.AgentIdentity;
import com.proposalagents.orchestration.model.FailureReason;
import com.proposalagents.orchestration.model.OutcomeKind;
import com.proposalagents.orchestration.model.TaskOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SpecialistInvokerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private GenerationCapability capability;
    private ExecutorService generationExecutor;
    private SpecialistInvoker invoker;

    @BeforeEach
    void setUp() {
        capability = mock(GenerationCapability.class);
        when(capability.describe()).thenReturn("MOCK");
        generationExecutor = Executors.newCachedThreadPool();
        invoker = new SpecialistInvoker(capability, new ProposalPromptService(),
                new OrchestrationMetricsService(), generationExecutor);
    }

    @AfterEach
    void tearDown() {
        generationExecutor.shutdownNow();
    }

    @Test
    void testSuccessIsTrimmed() {
        when(capability.generate(anyString(), any())).thenReturn("  Market overview\n");

        TaskOutcome outcome = invoker.invoke(AgentIdentity.MARKET, "Drone-based wildfire detection", TIMEOUT);

        assertEquals(OutcomeKind.SUCCESS, outcome.kind());
        assertEquals(AgentIdentity.MARKET, outcome.identity());
        assertEquals("Market overview", outcome.payload());
    }

    @Test
    void testInstructionCarriesTopic() {
        when(capability.generate(anyString(), any())).thenReturn("ok");

        invoker.invoke(AgentIdentity.BUDGET, "Drone-based wildfire detection", TIMEOUT);

        verify(capability).generate(contains("Drone-based wildfire detection"), eq(TIMEOUT));
    }

    @Test
    void testBlankOrNullTextIsEmptyResponse() {
        when(capability.generate(anyString(), any())).thenReturn("  \n ", (String) null);

        assertEquals(FailureReason.EMPTY_RESPONSE, invoker.invoke(AgentIdentity.PLAN, "topic", TIMEOUT).failureReason());
        assertEquals(FailureReason.EMPTY_RESPONSE, invoker.invoke(AgentIdentity.PLAN, "topic", TIMEOUT).failureReason());
    }

    @Test
    void testSlowCapabilityTimesOut() {
        when(capability.generate(anyString(), any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return "too late";
        });

        long started = System.nanoTime();
        TaskOutcome outcome = invoker.invoke(AgentIdentity.TECHNICAL, "topic", Duration.ofMillis(200));

        assertEquals(FailureReason.TIMEOUT, outcome.failureReason());
        assertTrue((System.nanoTime() - started) / 1_000_000L < 4_000);
    }

    @Test
    void testTimedOutCallIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        AtomicBoolean ranToCompletion = new AtomicBoolean();
        when(capability.generate(anyString(), any())).thenAnswer(invocation -> {
            try {
                Thread.sleep(2_000);
                ranToCompletion.set(true);
                return "too late";
            } catch (InterruptedException ex) {
                interrupted.countDown();
                throw ex;
            }
        });

        TaskOutcome outcome = invoker.invoke(AgentIdentity.TECHNICAL, "topic", Duration.ofMillis(200));

        assertEquals(FailureReason.TIMEOUT, outcome.failureReason());
        assertTrue(interrupted.await(1, TimeUnit.SECONDS), "generation thread should be interrupted");
        assertFalse(ranToCompletion.get());
    }

    @Test
    void testCancelledWaitInterruptsCall() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(capability.generate(anyString(), any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
                return "too late";
            } catch (InterruptedException ex) {
                interrupted.countDown();
                throw ex;
            }
        });
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<TaskOutcome> waiting = caller.submit(() -> invoker.invoke(AgentIdentity.IMPACT, "topic", TIMEOUT));
            assertTrue(started.await(2, TimeUnit.SECONDS));

            caller.shutdownNow();

            assertEquals(FailureReason.TIMEOUT, waiting.get(2, TimeUnit.SECONDS).failureReason());
            assertTrue(interrupted.await(2, TimeUnit.SECONDS), "generation thread should be interrupted");
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void testCapabilityTimeoutExceptionIsTimeout() {
        when(capability.generate(anyString(), any())).thenThrow(new GenerationTimeoutException(TIMEOUT));

        assertEquals(FailureReason.TIMEOUT, invoker.invoke(AgentIdentity.IMPACT, "topic", TIMEOUT).failureReason());
    }

    @Test
    void testMalformedResponse() {
        when(capability.generate(anyString(), any()))
                .thenThrow(new MalformedGenerationResponseException("tool calls instead of text"));

        TaskOutcome outcome = invoker.invoke(AgentIdentity.BACKGROUND, "topic", TIMEOUT);

        assertEquals(FailureReason.MALFORMED_RESPONSE, outcome.failureReason());
        assertTrue(outcome.detail().contains("tool calls instead of text"));
    }

    @Test
    void testOtherErrorsAreUpstream() {
        when(capability.generate(anyString(), any())).thenThrow(new IllegalStateException("401 Unauthorized"));

        TaskOutcome outcome = invoker.invoke(AgentIdentity.BACKGROUND, "topic", TIMEOUT);

        assertEquals(FailureReason.UPSTREAM_ERROR, outcome.failureReason());
        assertEquals("IllegalStateException - 401 Unauthorized", outcome.detail());
    }

    @Test
    void testClassifyWalksCauseChain() {
        assertEquals(FailureReason.TIMEOUT,
                SpecialistInvoker.classify(new RuntimeException("I/O error", new SocketTimeoutException("Read timed out"))));
        assertEquals(FailureReason.MALFORMED_RESPONSE,
                SpecialistInvoker.classify(new RuntimeException(new JsonParseException((JsonParser) null, "Unexpected character"))));
        assertEquals(FailureReason.UPSTREAM_ERROR, SpecialistInvoker.classify(new RuntimeException("boom")));
    }

    @Test
    void testSynthesisIsNotASpecialist() {
        assertThrows(IllegalArgumentException.class,
                () -> invoker.invoke(AgentIdentity.SYNTHESIS, "topic", TIMEOUT));
        verifyNoInteractions(capability);
    }
}
