package com.askus.backend.routing.gate;

import com.askus.backend.routing.model.ConfidenceLabel;
import com.askus.backend.routing.model.GateDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * Deterministic triage that runs before any network call.
 * <p>
 * Rule families are evaluated in a fixed order and the first match wins:
 * out-of-scope topics, entry-ambiguous phrasing, the equipment checkout
 * guardrail, then the fast-path patterns. Stateless and thread-safe.
 */
public class PatternGate {

    private static final Logger log = LoggerFactory.getLogger(PatternGate.class);

    public GateDecision check(String text) {
        String q = (text == null) ? "" : text.toLowerCase(Locale.ROOT).replace('\u2019', '\'').trim();
        if (q.isEmpty()) return GateDecision.noMatch();

        for (PatternRule rule : GateRules.OUT_OF_SCOPE) {
            if (rule.test(q)) {
                log.info("[gate] out of scope ({})", rule.name());
                return new GateDecision(true, GateRules.OUT_OF_SCOPE_AGENT, ConfidenceLabel.HIGH, false,
                        Set.of(), rule.name(), "Out-of-scope: " + rule.name());
            }
        }

        boolean hasAction = GateRules.CHECKOUT_ACTION.test(q);

        if (GateRules.ENTRY_AMBIGUOUS.test(q) && !hasAction) {
            log.info("[gate] entry-ambiguous phrasing, forcing arbitration");
            return GateDecision.forceArbitration(Set.of(), GateRules.ENTRY_AMBIGUOUS.name(),
                    "Entry-ambiguous phrase without clear action");
        }

        if (GateRules.EQUIPMENT_MENTION.test(q) && GateRules.PROBLEM_LANGUAGE.test(q) && !hasAction) {
            log.info("[gate] equipment guardrail, blocking {}", GateRules.EQUIPMENT_CHECKOUT_AGENT);
            return GateDecision.forceArbitration(Set.of(GateRules.EQUIPMENT_CHECKOUT_AGENT), "equipment-guardrail",
                    "Equipment mentioned with problem language but no checkout action");
        }

        for (GateRules.FastPath fp : GateRules.FAST_PATHS) {
            if (fp.rule().test(q)) {
                log.info("[gate] fast path {} -> {}", fp.rule().name(), fp.agentId());
                return GateDecision.route(fp.agentId(), fp.rule().name(), fp.reason());
            }
        }

        log.debug("[gate] no match");
        return GateDecision.noMatch();
    }
}
