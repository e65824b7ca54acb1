package com.askus.backend.routing.triage;

import com.askus.backend.routing.model.AgentScoreAggregate;

import java.util.List;
import java.util.Locale;

final class TriagePrompts {

    static final String CLARIFY_SYSTEM = "You are a question clarification assistant. Output SHORT JSON only.";
    static final String ARBITRATE_SYSTEM = "You are a routing arbitrator. Output SHORT JSON only.";

    private static final int EXAMPLE_CHARS = 80;

    private TriagePrompts() {}

    static String clarification(String query, List<AgentScoreAggregate> candidates) {
        StringBuilder lines = new StringBuilder();
        for (int i = 0; i < candidates.size(); i++) {
            String id = candidates.get(i).agentId();
            if (i > 0) lines.append('\n');
            lines.append(i + 1).append(". ").append(id).append(": ").append(AgentCatalog.label(id));
        }

        return """
                User's question: "%s"

                The system found multiple possible interpretations:
                %s

                Generate a SHORT clarification question and 3-5 button options to help the user clarify their intent.

                CRITICAL RULES:
                1. Do NOT add words the user didn't say (e.g., don't add "borrow" if they said "computer problems")
                2. Keep the question SHORT (1 sentence max)
                3. Each option should be CLEAR and DISTINCT, and its value must be one of the agent ids above
                4. ALWAYS include "None of these (type more details)" with value "other" as the last option

                Output ONLY this JSON (no other text):
                {"question": "Short clarifying question?", "options": [{"label": "...", "value": "agent_id"}, {"label": "None of these (type more details)", "value": "other"}]}
                """.formatted(query, lines);
    }

    static String arbitration(String query, AgentScoreAggregate first, AgentScoreAggregate second) {
        return """
                User's question: "%s"

                Two possible interpretations:
                1. %s
                2. %s

                Which interpretation BEST matches the user's intent?

                CRITICAL RULES:
                1. Be DECISIVE and choose one of the two agent ids above
                2. Do NOT add words the user didn't say
                3. Consider the user's exact phrasing

                Output ONLY this JSON (no other text):
                {"chosen_agent": "agent_id", "confidence": 0.8, "reasoning": "Brief reason (1 sentence max)"}
                """.formatted(query, describe(first), describe(second));
    }

    private static String describe(AgentScoreAggregate c) {
        String example = c.bestExample() == null ? "" : c.bestExample();
        if (example.length() > EXAMPLE_CHARS) example = example.substring(0, EXAMPLE_CHARS);
        return String.format(Locale.ROOT, "%s (%.3f): %s%n   Example: %s",
                c.agentId(), c.meanScore(), AgentCatalog.label(c.agentId()), example);
    }
}
