package com.askus.backend.routing.pipeline;

import com.askus.backend.routing.model.AgentScoreAggregate;
import com.askus.backend.routing.model.ArbiterDecision;
import com.askus.backend.routing.model.Candidate;
import com.askus.backend.routing.model.GateDecision;
import com.askus.backend.routing.model.Query;
import com.askus.backend.routing.triage.ArbitrationOutcome;
import com.askus.backend.routing.triage.Clarification;

import java.util.List;

/**
 * Mutable per-request state threaded through the stages. Never shared
 * between requests.
 */
final class RoutingContext {

    final Query query;

    boolean hintAccepted;
    GateDecision gate;
    List<Candidate> candidates = List.of();
    List<AgentScoreAggregate> ranked = List.of();
    ArbiterDecision arbiter;
    ArbitrationOutcome arbitration;
    Clarification clarification;

    RoutingContext(Query query) {
        this.query = query;
    }

    boolean wantsClarification() {
        return arbiter != null && arbiter.decision() == ArbiterDecision.Decision.CLARIFY;
    }
}
