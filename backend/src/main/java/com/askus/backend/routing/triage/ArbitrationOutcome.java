package com.askus.backend.routing.triage;

public record ArbitrationOutcome(String agentId, double confidence, String reasoning, boolean fromModel) {
}
