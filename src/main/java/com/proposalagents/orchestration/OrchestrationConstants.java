package com.proposalagents.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Generation request purposes
    public static final String PURPOSE_SPECIALIST = "specialist";
    public static final String PURPOSE_SYNTHESIS = "synthesis";

    // Placeholders
    public static final String TOPIC_PLACEHOLDER = "{topic}";
    public static final String MISSING_SECTION_TEXT = "No content received.";
    public static final String FAILED_SECTION_TEMPLATE = "[Section unavailable: the %s specialist failed (%s). Detail: %s]";
    public static final String REPORT_HEADING_TEMPLATE = "# R&D Project Proposal: %s";
    public static final String UNTITLED_REPORT_TITLE = "Untitled_Project";

    // Pipeline messages
    public static final String MESSAGE_SUCCESS = "Proposal synthesized by %s and saved: %s";
    public static final String MESSAGE_PARTIAL_SUCCESS = "Proposal synthesized with gaps because %d specialist(s) failed (%s). Saved: %s";
    public static final String MESSAGE_BLANK_TOPIC = "Stage START failed: topic is required and must not be blank.";
    public static final String MESSAGE_TOPIC_TOO_LONG = "Stage START failed: topic exceeds %d characters.";
    public static final String MESSAGE_SCHEDULING_FAILED = "Stage FAN_OUT failed: specialist tasks could not be scheduled. Details: %s";
    public static final String MESSAGE_SYNTHESIS_FAILED = "Stage SYNTHESIZE failed: synthesis returned %s. Details: %s";
    public static final String MESSAGE_PERSISTENCE_FAILED = "Stage PERSIST failed: synthesis succeeded but the artifact could not be saved. Details: %s";

    // Specialist instructions, one per identity
    public static final String BACKGROUND_INSTRUCTION = """
            Conduct detailed background research for this project idea: "{topic}"
            Cover the problem statement, alignment with strategic goals (use placeholders such as
            [Relevant National Strategy] and [Your Institution Name]) and the market gap the project addresses.
            """;

    public static final String TECHNICAL_INSTRUCTION = """
            Describe the technical framework for a project built on this idea: "{topic}"
            Cover the core technology, the system architecture, the key innovations and the rationale
            for the chosen technology compared with alternatives.
            """;

    public static final String MARKET_INSTRUCTION = """
            Conduct a market and competitor analysis for this project idea: "{topic}"
            Cover target applications and industries, the competitive landscape and realistic
            commercialization paths such as revenue models and partners.
            """;

    public static final String BUDGET_INSTRUCTION = """
            Estimate a generic one-year seed budget for "{topic}" in the range of 50k to 100k USD.
            Break it down into staff, equipment and other operating expenses including a 10-15% contingency.
            Use placeholders such as [Stipend Rate] and present the result as a table.
            """;

    public static final String PLAN_INSTRUCTION = """
            Propose a generic one-year project plan for "{topic}" covering the seed phase.
            Include a quarterly timeline with milestones, example KPIs grouped by technology, knowledge,
            talent and collaboration, and a risk assessment with mitigations.
            """;

    public static final String IMPACT_INSTRUCTION = """
            Assess the broader impact and significance of "{topic}".
            Cover technological impact, societal relevance, institutional benefit (use the placeholder
            [Your Institution Name]) and ESG considerations. Use a formal tone.
            """;

    // Synthesis
    public static final String SYNTHESIS_INSTRUCTION_HEADER = """
            You are the Principal Investigator writing a generic one-year seed R&D project proposal.
            The core project idea is: "{topic}"
            You received draft sections from six specialist agents. Combine them into one formal, coherent
            proposal. Where a section is marked unavailable, note the gap instead of inventing content.

            Proposal structure:
            1. Title page placeholder: [Project Title Page: Title, PI, Institution, Date]
            2. Executive summary
            3. Project background
            4. Objectives
            5. Technical approach
            6. Market context and competitor analysis
            7. Project plan: timeline, example KPIs (state that specific KPIs are TBD), risks and mitigations
            8. Budget outline (state that figures are estimates only)
            9. Project team placeholder
            10. Impact and significance
            11. Transferable assets and future work
            12. Conclusion
            Keep the tone formal and realistic for seed funding. Use [...] placeholders for specifics.

            --- [BEGIN SPECIALIST INPUTS] ---
            """;

    public static final String SYNTHESIS_SECTION_TEMPLATE = """

            --- %d. %s ---
            %s
            """;

    public static final String SYNTHESIS_INSTRUCTION_FOOTER = """

            --- [END SPECIALIST INPUTS] ---

            Now write the complete proposal following the structure above.
            """;
}
