package com.askus.backend.routing.triage;

import com.askus.backend.llm.LlmClient;
import com.askus.backend.routing.model.AgentScoreAggregate;
import com.askus.backend.routing.model.ClarificationOption;
import com.askus.backend.util.BoundedCalls;
import com.askus.backend.util.ExternalCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves ambiguous queries with a single model call: either a clarifying
 * question for the user, or a choice between the two best candidates. Every
 * failure path has a deterministic answer; the model is never retried.
 */
public class ArbitrationStage {

    private static final Logger log = LoggerFactory.getLogger(ArbitrationStage.class);

    static final String FALLBACK_QUESTION = "What are you looking for?";
    static final double SINGLE_CANDIDATE_CONFIDENCE = 0.7;
    static final double NO_CANDIDATE_CONFIDENCE = 0.5;
    static final double FALLBACK_CONFIDENCE = 0.7;

    private static final int CLARIFY_CANDIDATES = 3;

    private final LlmClient llm;
    private final TriageReplyParser parser;
    private final BoundedCalls calls;
    private final Duration llmTimeout;
    private final String defaultAgent;

    public ArbitrationStage(LlmClient llm, TriageReplyParser parser, BoundedCalls calls,
                            Duration llmTimeout, String defaultAgent) {
        this.llm = llm;
        this.parser = parser;
        this.calls = calls;
        this.llmTimeout = llmTimeout;
        this.defaultAgent = defaultAgent;
    }

    public Clarification clarify(String query, List<AgentScoreAggregate> ranked) {
        List<AgentScoreAggregate> top = ranked.stream().limit(CLARIFY_CANDIDATES).toList();

        Optional<TriageReplyParser.ClarificationReply> reply = ask(
                TriagePrompts.CLARIFY_SYSTEM, TriagePrompts.clarification(query, top))
                .flatMap(parser::parseClarification);

        if (reply.isEmpty()) {
            return fallbackClarification(top);
        }

        List<ClarificationOption> options = toOptions(reply.get().options(), top);
        if (options.isEmpty()) {
            log.warn("clarification reply named none of the candidates {}", agentIds(top));
            return fallbackClarification(top);
        }

        String question = reply.get().question();
        if (question == null || question.isBlank()) question = FALLBACK_QUESTION;

        options.add(ClarificationOption.other());
        log.info("clarification from model with {} options", options.size());
        return new Clarification(question.trim(), options, true);
    }

    public ArbitrationOutcome arbitrate(String query, List<AgentScoreAggregate> ranked) {
        if (ranked.isEmpty()) {
            return new ArbitrationOutcome(defaultAgent, NO_CANDIDATE_CONFIDENCE,
                    "No candidates found, defaulting to general search", false);
        }
        AgentScoreAggregate first = ranked.get(0);
        if (ranked.size() == 1) {
            return new ArbitrationOutcome(first.agentId(), SINGLE_CANDIDATE_CONFIDENCE,
                    "Only one candidate available", false);
        }
        AgentScoreAggregate second = ranked.get(1);

        Optional<TriageReplyParser.ArbitrationReply> reply = ask(
                TriagePrompts.ARBITRATE_SYSTEM, TriagePrompts.arbitration(query, first, second))
                .flatMap(parser::parseArbitration);

        if (reply.isEmpty()) {
            return fallbackArbitration(first);
        }

        String chosen = reply.get().chosenAgent();
        if (chosen == null || !(chosen.equals(first.agentId()) || chosen.equals(second.agentId()))) {
            log.warn("arbitration chose '{}', expected {} or {}", chosen, first.agentId(), second.agentId());
            return fallbackArbitration(first);
        }

        Double raw = reply.get().confidence();
        double confidence = (raw == null || raw.isNaN()) ? FALLBACK_CONFIDENCE : Math.max(0.0, Math.min(1.0, raw));
        String reasoning = reply.get().reasoning();
        if (reasoning == null || reasoning.isBlank()) reasoning = "LLM arbitration";

        log.info("arbitration chose {} ({})", chosen, confidence);
        return new ArbitrationOutcome(chosen, confidence, reasoning.trim(), true);
    }

    private Optional<String> ask(String system, String user) {
        try {
            return Optional.ofNullable(calls.call("llm", llmTimeout, () -> llm.complete(system, user)));
        } catch (ExternalCallException e) {
            log.warn("model call degraded: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static List<ClarificationOption> toOptions(List<TriageReplyParser.OptionReply> replies,
                                                       List<AgentScoreAggregate> top) {
        Set<String> allowed = Set.copyOf(agentIds(top));
        Map<String, ClarificationOption> byAgent = new LinkedHashMap<>();

        if (replies != null) {
            for (TriageReplyParser.OptionReply o : replies) {
                if (o == null || o.value() == null) continue;
                String value = o.value().trim();
                if (!allowed.contains(value) || byAgent.containsKey(value)) continue;
                String label = (o.label() == null || o.label().isBlank()) ? AgentCatalog.label(value) : o.label().trim();
                byAgent.put(value, new ClarificationOption(label, value, blankToNull(o.description())));
            }
        }

        if (byAgent.isEmpty()) return new ArrayList<>();

        // Candidates the model left out still get a button.
        for (AgentScoreAggregate c : top) {
            byAgent.putIfAbsent(c.agentId(), new ClarificationOption(AgentCatalog.label(c.agentId()), c.agentId()));
        }
        return new ArrayList<>(byAgent.values());
    }

    private static Clarification fallbackClarification(List<AgentScoreAggregate> top) {
        List<ClarificationOption> options = new ArrayList<>();
        for (AgentScoreAggregate c : top) {
            options.add(new ClarificationOption(AgentCatalog.label(c.agentId()), c.agentId()));
        }
        options.add(ClarificationOption.other());
        return new Clarification(FALLBACK_QUESTION, options, false);
    }

    private static ArbitrationOutcome fallbackArbitration(AgentScoreAggregate first) {
        return new ArbitrationOutcome(first.agentId(), FALLBACK_CONFIDENCE,
                "arbitration error, defaulted to top candidate", false);
    }

    private static List<String> agentIds(List<AgentScoreAggregate> top) {
        return top.stream().map(AgentScoreAggregate::agentId).toList();
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
