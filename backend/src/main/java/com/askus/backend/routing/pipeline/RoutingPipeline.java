package com.askus.backend.routing.pipeline;

import com.askus.backend.routing.arbiter.ConfidenceArbiter;
import com.askus.backend.routing.gate.PatternGate;
import com.askus.backend.routing.model.AgentScoreAggregate;
import com.askus.backend.routing.model.ArbiterDecision;
import com.askus.backend.routing.model.Candidate;
import com.askus.backend.routing.model.ConfidenceLabel;
import com.askus.backend.routing.model.GateDecision;
import com.askus.backend.routing.model.Query;
import com.askus.backend.routing.model.RouteMode;
import com.askus.backend.routing.model.RouteResult;
import com.askus.backend.routing.search.PrototypeSearch;
import com.askus.backend.routing.triage.ArbitrationStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Routes one query through hint check, pattern gate, prototype search,
 * confidence arbiter and model arbitration, stopping as soon as a stage has
 * decided. Always returns a result; failures below degrade to the default agent.
 */
public class RoutingPipeline {

    private static final Logger log = LoggerFactory.getLogger(RoutingPipeline.class);

    static final double MEDIUM_ARBITRATION_CONFIDENCE = 0.7;

    private final PatternGate gate;
    private final PrototypeSearch search;
    private final ConfidenceArbiter arbiter;
    private final ArbitrationStage arbitration;
    private final int topK;
    private final int candidatesInResult;
    private final String defaultAgent;

    public RoutingPipeline(PatternGate gate,
                           PrototypeSearch search,
                           ConfidenceArbiter arbiter,
                           ArbitrationStage arbitration,
                           int topK,
                           int candidatesInResult,
                           String defaultAgent) {
        this.gate = gate;
        this.search = search;
        this.arbiter = arbiter;
        this.arbitration = arbitration;
        this.topK = topK;
        this.candidatesInResult = candidatesInResult;
        this.defaultAgent = defaultAgent;
    }

    public RouteResult route(String text, String resumeHint) {
        return route(new Query(text, resumeHint));
    }

    public RouteResult route(Query query) {
        RoutingContext ctx = new RoutingContext(query);
        try {
            RouterState state = RouterState.CHECK_HINT;
            while (state != RouterState.FINALIZE) {
                RouterState next = step(state, ctx);
                log.debug("{} -> {}", state, next);
                state = next;
            }
            RouteResult result = finalizeResult(ctx);
            log.info("routed to {} ({}, {})",
                    result.isClarification() ? "clarification" : result.agentId(),
                    result.confidence(), result.mode());
            return result;
        } catch (RuntimeException e) {
            log.error("routing failed, using default agent {}", defaultAgent, e);
            return RouteResult.route(RouteMode.SIMILARITY, defaultAgent, ConfidenceLabel.LOW,
                    "Fallback to general search", List.of());
        }
    }

    private RouterState step(RouterState state, RoutingContext ctx) {
        switch (state) {
            case CHECK_HINT:
                if (ctx.query.hasUsableHint()) {
                    ctx.hintAccepted = true;
                    return RouterState.FINALIZE;
                }
                return RouterState.PATTERN_GATE;

            case PATTERN_GATE:
                ctx.gate = gate.check(ctx.query.text());
                if (ctx.gate.forceArbitration()) return RouterState.ARBITRATION;
                if (ctx.gate.isFastPath()) return RouterState.FINALIZE;
                return RouterState.PROTOTYPE_SEARCH;

            case PROTOTYPE_SEARCH:
                ctx.candidates = search.search(ctx.query.text(), topK, ctx.gate.blockedAgents());
                return RouterState.CONFIDENCE_ARBITER;

            case CONFIDENCE_ARBITER:
                ctx.ranked = ConfidenceArbiter.aggregate(ctx.candidates);
                ctx.arbiter = arbiter.decideAggregated(ctx.ranked);
                return ctx.arbiter.decision() == ArbiterDecision.Decision.DIRECT_ROUTE
                        ? RouterState.FINALIZE
                        : RouterState.ARBITRATION;

            case ARBITRATION:
                if (ctx.wantsClarification()) {
                    ctx.clarification = arbitration.clarify(ctx.query.text(), ctx.ranked);
                } else {
                    ctx.arbitration = arbitration.arbitrate(ctx.query.text(), ctx.ranked);
                }
                return RouterState.FINALIZE;

            default:
                throw new IllegalStateException("no transition from " + state);
        }
    }

    private RouteResult finalizeResult(RoutingContext ctx) {
        if (ctx.hintAccepted) {
            return RouteResult.route(RouteMode.PATTERN, ctx.query.resumeHint(), ConfidenceLabel.HIGH,
                    "user clarification", List.of());
        }

        if (ctx.clarification != null) {
            return RouteResult.clarify(ctx.clarification.question(), ctx.clarification.options());
        }

        List<Candidate> top = topCandidates(ctx.ranked);

        GateDecision g = ctx.gate;
        if (g != null && g.isFastPath()) {
            return RouteResult.route(RouteMode.PATTERN, g.agentId(), g.confidence(), g.reason(), List.of());
        }

        if (ctx.arbitration != null) {
            ConfidenceLabel label = ctx.arbitration.confidence() >= MEDIUM_ARBITRATION_CONFIDENCE
                    ? ConfidenceLabel.MEDIUM
                    : ConfidenceLabel.LOW;
            return RouteResult.route(RouteMode.LLM_ARBITRATION, ctx.arbitration.agentId(), label,
                    ctx.arbitration.reasoning(), top);
        }

        ArbiterDecision a = ctx.arbiter;
        if (a != null && a.decision() == ArbiterDecision.Decision.DIRECT_ROUTE && a.topAgent() != null) {
            return RouteResult.route(RouteMode.SIMILARITY, a.topAgent(), a.confidenceLabel(), a.reason(), top);
        }

        return RouteResult.route(RouteMode.SIMILARITY, defaultAgent, ConfidenceLabel.LOW,
                "Fallback to general search", top);
    }

    private List<Candidate> topCandidates(List<AgentScoreAggregate> ranked) {
        return ranked.stream()
                .limit(candidatesInResult)
                .map(a -> Candidate.of(a.agentId(), a.meanScore(), a.bestExample()))
                .toList();
    }
}
