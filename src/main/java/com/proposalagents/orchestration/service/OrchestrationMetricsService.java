package com.proposalagents.orchestration.service;

import com.proposalagents.orchestration.model.FailureReason;
import com.proposalagents.orchestration.model.JobStatus;
import com.proposalagents.orchestration.model.TaskOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService {

    private final AtomicLong generationRequestCount = new AtomicLong();
    private final Map<String, AtomicLong> generationRequestsByPurpose = new ConcurrentHashMap<>();
    private final AtomicLong specialistTaskCount = new AtomicLong();
    private final Map<FailureReason, AtomicLong> failuresByReason = new EnumMap<>(FailureReason.class);
    private final Map<JobStatus, AtomicLong> jobsByStatus = new EnumMap<>(JobStatus.class);

    public OrchestrationMetricsService() {
        for (FailureReason reason : FailureReason.values()) {
            failuresByReason.put(reason, new AtomicLong());
        }
        for (JobStatus status : JobStatus.values()) {
            jobsByStatus.put(status, new AtomicLong());
        }
    }

    public void recordGenerationRequest(String purpose, String identity) {
        long count = generationRequestCount.incrementAndGet();
        long purposeCount = generationRequestsByPurpose.computeIfAbsent(purpose, key -> new AtomicLong()).incrementAndGet();
        log.info("Generation request #{} sent (purpose={} #{}, identity={}).", count, purpose, purposeCount, identity);
    }

    public void recordFanOut(List<TaskOutcome> outcomes, Duration elapsed) {
        long total = specialistTaskCount.addAndGet(outcomes.size());
        long failed = 0;
        for (TaskOutcome outcome : outcomes) {
            if (outcome.failed()) {
                failed++;
                failuresByReason.get(outcome.failureReason()).incrementAndGet();
            }
        }
        log.info("Fan-out of {} specialist tasks completed in {} ms with {} failure(s). Total specialist tasks={}.",
                outcomes.size(), elapsed.toMillis(), failed, total);
    }

    public void recordJob(JobStatus status, Duration elapsed) {
        long count = jobsByStatus.get(status).incrementAndGet();
        log.info("Job finished with status {} in {} ms. Jobs with this status={}.", status, elapsed.toMillis(), count);
    }

    public long generationRequestCount(String purpose) {
        AtomicLong counter = generationRequestsByPurpose.get(purpose);
        return counter != null ? counter.get() : 0L;
    }

    public long jobCount(JobStatus status) {
        return jobsByStatus.get(status).get();
    }

    public long failureCount(FailureReason reason) {
        return failuresByReason.get(reason).get();
    }

    public void logSummary() {
        log.info("Run stats: generationRequests={} {}, specialistTasks={}, jobs={}, specialistFailures={}.",
                generationRequestCount.get(), generationRequestsByPurpose, specialistTaskCount.get(),
                jobsByStatus, failuresByReason);
    }
}
