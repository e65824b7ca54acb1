package com.askus.backend.routing.model;

public record ArbiterDecision(
        Decision decision,
        String topAgent,
        double topScore,
        Double margin,
        ConfidenceLabel confidenceLabel,
        String secondAgent,
        Double secondScore,
        String reason
) {
    public enum Decision { DIRECT_ROUTE, ARBITRATE, CLARIFY }
}
