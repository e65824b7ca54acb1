package com.askus.backend.routing.model;

import java.util.Set;

public record GateDecision(
        boolean matched,
        String agentId,
        ConfidenceLabel confidence,
        boolean forceArbitration,
        Set<String> blockedAgents,
        String rule,
        String reason
) {
    public GateDecision {
        blockedAgents = (blockedAgents == null) ? Set.of() : Set.copyOf(blockedAgents);
    }

    public static GateDecision noMatch() {
        return new GateDecision(false, null, ConfidenceLabel.LOW, false, Set.of(), null, "no pattern matched");
    }

    public static GateDecision route(String agentId, String rule, String reason) {
        return new GateDecision(true, agentId, ConfidenceLabel.HIGH, false, Set.of(), rule, reason);
    }

    public static GateDecision forceArbitration(Set<String> blocked, String rule, String reason) {
        return new GateDecision(true, null, ConfidenceLabel.LOW, true, blocked, rule, reason);
    }

    /** True when the gate alone decided the route. */
    public boolean isFastPath() {
        return matched && !forceArbitration && agentId != null;
    }
}
