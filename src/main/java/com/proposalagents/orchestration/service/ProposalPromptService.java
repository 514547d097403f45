package com.proposalagents.orchestration.service;

import static com.proposalagents.orchestration.OrchestrationConstants.*;

import com.proposalagents.orchestration.model.AgentIdentity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Map;

@Service
public class ProposalPromptService {

    public String specialistInstruction(AgentIdentity identity, String topic) {
        String template = switch (identity) {
            case BACKGROUND -> BACKGROUND_INSTRUCTION;
            case TECHNICAL -> TECHNICAL_INSTRUCTION;
            case MARKET -> MARKET_INSTRUCTION;
            case BUDGET -> BUDGET_INSTRUCTION;
            case PLAN -> PLAN_INSTRUCTION;
            case IMPACT -> IMPACT_INSTRUCTION;
            case SYNTHESIS -> throw new IllegalArgumentException("Synthesis is not a specialist identity");
        };
        return withTopic(template, topic);
    }

    /**
     * Sections are always emitted in specialist order, whatever the iteration order of {@code namedResults}.
     */
    public String synthesisInstruction(String topic, Map<AgentIdentity, String> namedResults) {
        StringBuilder sb = new StringBuilder(withTopic(SYNTHESIS_INSTRUCTION_HEADER, topic));
        int index = 1;
        for (AgentIdentity identity : AgentIdentity.specialists()) {
            String section = namedResults != null ? namedResults.get(identity) : null;
            String body = StringUtils.hasText(section) ? section : MISSING_SECTION_TEXT;
            sb.append(SYNTHESIS_SECTION_TEMPLATE.formatted(index++, identity.sectionTitle(), body));
        }
        sb.append(SYNTHESIS_INSTRUCTION_FOOTER);
        return sb.toString();
    }

    private static String withTopic(String template, String topic) {
        return template.replace(TOPIC_PLACEHOLDER, topic == null ? "" : topic.trim());
    }
}
