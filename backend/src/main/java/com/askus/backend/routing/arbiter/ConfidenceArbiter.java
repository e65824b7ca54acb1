package com.askus.backend.routing.arbiter;

import com.askus.backend.routing.model.AgentScoreAggregate;
import com.askus.backend.routing.model.ArbiterDecision;
import com.askus.backend.routing.model.ArbiterDecision.Decision;
import com.askus.backend.routing.model.Candidate;
import com.askus.backend.routing.model.ConfidenceLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Margin analysis over aggregated prototype scores.
 * <p>
 * Pure: the decision depends only on the candidates and the thresholds.
 * A tiny margin is checked before the score bands, so two near-equal agents
 * always lead to a clarification.
 */
public class ConfidenceArbiter {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceArbiter.class);

    // Scores and margins are sums of doubles; 0.70 - 0.55 must still count as 0.15.
    private static final double EPSILON = 1e-9;

    private static final Comparator<AgentScoreAggregate> BY_SCORE_DESC =
            Comparator.comparingDouble(AgentScoreAggregate::meanScore).reversed()
                    .thenComparing(AgentScoreAggregate::agentId);

    private final ArbiterThresholds thresholds;

    public ConfidenceArbiter(ArbiterThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    /**
     * Groups candidates by agent and averages their scores, best agent first.
     * Averaging keeps an agent with many weak hits from outranking one strong hit.
     */
    public static List<AgentScoreAggregate> aggregate(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) return List.of();

        Map<String, List<Candidate>> byAgent = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            if (c == null) continue;
            byAgent.computeIfAbsent(c.agentId(), k -> new ArrayList<>()).add(c);
        }

        List<AgentScoreAggregate> out = new ArrayList<>(byAgent.size());
        for (var e : byAgent.entrySet()) {
            List<Candidate> hits = e.getValue();
            double sum = 0.0;
            Candidate best = hits.get(0);
            for (Candidate c : hits) {
                sum += c.score();
                if (c.score() > best.score()) best = c;
            }
            out.add(new AgentScoreAggregate(e.getKey(), sum / hits.size(), hits.size(), best.exampleText()));
        }
        out.sort(BY_SCORE_DESC);
        return List.copyOf(out);
    }

    public ArbiterDecision decide(List<Candidate> candidates) {
        return decideAggregated(aggregate(candidates));
    }

    public ArbiterDecision decideAggregated(List<AgentScoreAggregate> ranked) {
        if (ranked == null || ranked.isEmpty()) {
            log.info("[arbiter] no candidates");
            return new ArbiterDecision(Decision.ARBITRATE, null, 0.0, null, ConfidenceLabel.LOW,
                    null, null, "No candidates found");
        }

        AgentScoreAggregate top = ranked.get(0);
        double topScore = top.meanScore();

        if (ranked.size() == 1) {
            ArbiterDecision single;
            if (atLeast(topScore, thresholds.directScore())) {
                single = new ArbiterDecision(Decision.DIRECT_ROUTE, top.agentId(), topScore, null, ConfidenceLabel.HIGH,
                        null, null, "Single candidate with high score (" + fmt(topScore) + ")");
            } else if (atLeast(topScore, thresholds.lowConfScore())) {
                single = new ArbiterDecision(Decision.DIRECT_ROUTE, top.agentId(), topScore, null, ConfidenceLabel.MEDIUM,
                        null, null, "Single candidate with medium score (" + fmt(topScore) + ")");
            } else {
                single = new ArbiterDecision(Decision.ARBITRATE, top.agentId(), topScore, null, ConfidenceLabel.LOW,
                        null, null, "Single candidate with low score (" + fmt(topScore) + ")");
            }
            log.info("[arbiter] {} ({}) - {}", single.decision(), single.confidenceLabel(), single.reason());
            return single;
        }

        AgentScoreAggregate second = ranked.get(1);
        double secondScore = second.meanScore();
        double margin = topScore - secondScore;

        log.debug("[arbiter] top1={} ({}) top2={} ({}) margin={}",
                top.agentId(), fmt(topScore), second.agentId(), fmt(secondScore), fmt(margin));

        Decision decision;
        ConfidenceLabel label;
        String reason;

        if (!atLeast(margin, thresholds.clarifyMargin())) {
            decision = Decision.CLARIFY;
            label = ConfidenceLabel.LOW;
            reason = "Very close scores (" + fmt(topScore) + " vs " + fmt(secondScore) + "), margin too small (" + fmt(margin) + ")";
        } else if (atLeast(topScore, thresholds.directScore()) && atLeast(margin, thresholds.directMargin())) {
            decision = Decision.DIRECT_ROUTE;
            label = ConfidenceLabel.HIGH;
            reason = "High score (" + fmt(topScore) + ") with good margin (" + fmt(margin) + ")";
        } else if (atLeast(topScore, thresholds.lowConfScore()) && atLeast(margin, thresholds.lowConfMargin())) {
            decision = Decision.DIRECT_ROUTE;
            label = ConfidenceLabel.MEDIUM;
            reason = "Medium score (" + fmt(topScore) + ") with acceptable margin (" + fmt(margin) + ")";
        } else {
            decision = Decision.ARBITRATE;
            label = ConfidenceLabel.LOW;
            reason = "Low score (" + fmt(topScore) + ") or small margin (" + fmt(margin) + ")";
        }

        log.info("[arbiter] {} ({}) - {}", decision, label, reason);
        return new ArbiterDecision(decision, top.agentId(), topScore, margin, label,
                second.agentId(), secondScore, reason);
    }

    static boolean atLeast(double value, double threshold) {
        return value >= threshold - EPSILON;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }
}
