package com.askus.backend.routing.model;

import java.util.List;

/**
 * Final output of the router: either a route ({@code agentId} set) or a
 * clarification ({@code mode == CLARIFY}, {@code question} and {@code options} set).
 */
public record RouteResult(
        RouteMode mode,
        String agentId,
        ConfidenceLabel confidence,
        String reason,
        List<Candidate> topCandidates,
        String question,
        List<ClarificationOption> options
) {
    public RouteResult {
        topCandidates = (topCandidates == null) ? List.of() : List.copyOf(topCandidates);
        options = (options == null) ? List.of() : List.copyOf(options);
    }

    public static RouteResult route(RouteMode mode, String agentId, ConfidenceLabel confidence,
                                    String reason, List<Candidate> topCandidates) {
        if (mode == RouteMode.CLARIFY) throw new IllegalArgumentException("use clarify() for clarifications");
        return new RouteResult(mode, agentId, confidence, reason, topCandidates, null, null);
    }

    public static RouteResult clarify(String question, List<ClarificationOption> options) {
        return new RouteResult(RouteMode.CLARIFY, null, ConfidenceLabel.LOW, null, List.of(), question, options);
    }

    public boolean isClarification() {
        return mode == RouteMode.CLARIFY;
    }
}
