package com.askus.backend.routing.model;

/**
 * Mean score of every hit for one agent among the top-K candidates.
 * {@code bestExample} is the text of that agent's strongest hit.
 */
public record AgentScoreAggregate(String agentId, double meanScore, int hitCount, String bestExample) {
}
