package com.proposalagents.orchestration.service;

import static com.proposalagents.orchestration.OrchestrationConstants.PURPOSE_SYNTHESIS;

import com.proposalagents.config.ProposalAgentsProperties;
import com.proposalagents.orchestration.model.AgentIdentity;
import com.proposalagents.orchestration.model.TaskOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class SynthesisStage {

    private final SpecialistInvoker specialistInvoker;
    private final ProposalPromptService promptService;
    private final ProposalAgentsProperties properties;

    public TaskOutcome synthesize(String topic, Map<AgentIdentity, String> namedResults) {
        return synthesize(topic, namedResults, properties.getSynthesisTimeout());
    }

    public TaskOutcome synthesize(String topic, Map<AgentIdentity, String> namedResults, Duration timeout) {
        String instruction = promptService.synthesisInstruction(topic, namedResults);
        log.info("Synthesizing proposal from {} sections ({} chars of instruction).",
                namedResults != null ? namedResults.size() : 0, instruction.length());
        return specialistInvoker.invokeInstruction(AgentIdentity.SYNTHESIS, instruction, timeout, PURPOSE_SYNTHESIS);
    }
}
