package com.proposalagents.orchestration.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum AgentIdentity {
    BACKGROUND("background", "Background Research", true),
    TECHNICAL("technical", "Technical Framework", true),
    MARKET("market", "Market & Competitor Analysis", true),
    BUDGET("budget", "Budget (Seed Format)", true),
    PLAN("plan", "Timeline, Milestones, KPIs, Risks", true),
    IMPACT("impact", "Impact & Significance", true),
    SYNTHESIS("synthesis", "Proposal Synthesis", false);

    private static final List<AgentIdentity> SPECIALISTS = Arrays.stream(values())
            .filter(AgentIdentity::specialist)
            .toList();

    private final String key;
    private final String sectionTitle;
    private final boolean specialist;

    AgentIdentity(String key, String sectionTitle, boolean specialist) {
        this.key = key;
        this.sectionTitle = sectionTitle;
        this.specialist = specialist;
    }

    public String key() {
        return key;
    }

    public String sectionTitle() {
        return sectionTitle;
    }

    public boolean specialist() {
        return specialist;
    }

    /**
     * The six specialists in report section order.
     */
    public static List<AgentIdentity> specialists() {
        return SPECIALISTS;
    }

    public static Optional<AgentIdentity> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(identity -> identity.key.equals(normalized))
                .findFirst();
    }
}
