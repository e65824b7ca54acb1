package com.askus.backend.routing.model;

/**
 * A single prototype hit. Score is a similarity in [0, 1].
 */
public record Candidate(
        String agentId,
        double score,
        String exampleText,
        String category,
        boolean actionBased,
        int priority
) {
    public Candidate {
        if (agentId == null || agentId.isBlank()) throw new IllegalArgumentException("agentId is required");
        score = Math.max(0.0, Math.min(1.0, score));
        exampleText = (exampleText == null) ? "" : exampleText;
        category = (category == null) ? "" : category;
    }

    public static Candidate of(String agentId, double score, String exampleText) {
        return new Candidate(agentId, score, exampleText, "", false, 5);
    }
}
