package com.proposalagents.api;

import com.proposalagents.orchestration.JobPipeline;
import com.proposalagents.orchestration.model.JobRequest;
import com.proposalagents.orchestration.model.JobResult;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
@RequestMapping("/api")
@Slf4j
public class ProposalController {

    private final JobPipeline jobPipeline;

    public ProposalController(JobPipeline jobPipeline) {
        this.jobPipeline = jobPipeline;
    }

    @PostMapping("/generate")
    public GenerateResponse generate(@Valid @RequestBody GenerateRequest request) {
        JobRequest jobRequest = new JobRequest(
                request.topic(),
                request.taskTimeoutSeconds() != null ? Duration.ofSeconds(request.taskTimeoutSeconds()) : null,
                request.jobDeadlineSeconds() != null ? Duration.ofSeconds(request.jobDeadlineSeconds()) : null
        );
        JobResult result = jobPipeline.run(jobRequest);
        log.info("Generate request completed with job status {}.", result.status().wireValue());
        return GenerateResponse.from(result);
    }
}
