package com.askus.backend.routing.gate;

import com.askus.backend.routing.model.ConfidenceLabel;
import com.askus.backend.routing.model.GateDecision;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PatternGateTest {

    private final PatternGate gate = new PatternGate();

    @Test
    void hoursQuestion_takesFastPath() {
        GateDecision d = gate.check("What time does King Library close?");

        assertTrue(d.isFastPath());
        assertEquals(GateRules.HOURS_AGENT, d.agentId());
        assertEquals(ConfidenceLabel.HIGH, d.confidence());
        assertEquals("fast-path.hours", d.rule());
    }

    @Test
    void brokenLaptop_blocksCheckoutAndForcesArbitration() {
        GateDecision d = gate.check("my laptop isn't working");

        assertTrue(d.matched());
        assertTrue(d.forceArbitration());
        assertFalse(d.isFastPath());
        assertNull(d.agentId());
        assertEquals(Set.of(GateRules.EQUIPMENT_CHECKOUT_AGENT), d.blockedAgents());
        assertEquals(ConfidenceLabel.LOW, d.confidence());
    }

    @Test
    void curlyApostrophe_isNormalised() {
        GateDecision d = gate.check("My laptop isn’t working");

        assertEquals(Set.of(GateRules.EQUIPMENT_CHECKOUT_AGENT), d.blockedAgents());
    }

    @Test
    void equipmentProblemWithCheckoutVerb_isNotGuarded() {
        GateDecision d = gate.check("my charger isn't working, can I borrow one?");

        assertFalse(d.forceArbitration());
        assertTrue(d.blockedAgents().isEmpty());
    }

    @Test
    void homework_isOutOfScope() {
        GateDecision d = gate.check("Can you help me with my homework?");

        assertTrue(d.isFastPath());
        assertEquals(GateRules.OUT_OF_SCOPE_AGENT, d.agentId());
        assertEquals(ConfidenceLabel.HIGH, d.confidence());
        assertEquals("out-of-scope.homework", d.rule());
    }

    @Test
    void universityAdministration_isOutOfScope() {
        GateDecision d = gate.check("How do I apply for financial aid?");

        assertEquals(GateRules.OUT_OF_SCOPE_AGENT, d.agentId());
        assertEquals("out-of-scope.general-university", d.rule());
    }

    @Test
    void outOfScope_winsOverFastPath() {
        // mentions library hours but is a wifi complaint first
        GateDecision d = gate.check("the wifi is down in the library, what are the library hours");

        assertEquals(GateRules.OUT_OF_SCOPE_AGENT, d.agentId());
    }

    @Test
    void entryAmbiguousPhrase_forcesArbitrationWithoutBlocking() {
        GateDecision d = gate.check("I need help with a computer");

        assertTrue(d.forceArbitration());
        assertTrue(d.blockedAgents().isEmpty());
        assertEquals("entry-ambiguous", d.rule());
    }

    @Test
    void entryAmbiguousPhraseWithAction_fallsThrough() {
        GateDecision d = gate.check("I need help to borrow a camera");

        assertFalse(d.forceArbitration());
    }

    @Test
    void subjectLibrarian_takesFastPath() {
        GateDecision d = gate.check("Who is the biology librarian?");

        assertEquals(GateRules.SUBJECT_LIBRARIAN_AGENT, d.agentId());
        assertEquals(ConfidenceLabel.HIGH, d.confidence());
    }

    @Test
    void ticketRequest_takesFastPath() {
        GateDecision d = gate.check("How do I submit a ticket?");

        assertEquals(GateRules.TICKET_AGENT, d.agentId());
    }

    @Test
    void humanRequest_takesFastPath() {
        GateDecision d = gate.check("Can I talk to a librarian please");

        assertEquals(GateRules.HUMAN_HANDOFF_AGENT, d.agentId());
    }

    @Test
    void ordinaryQuestion_doesNotMatch() {
        GateDecision d = gate.check("I want to borrow a laptop");

        assertFalse(d.matched());
        assertFalse(d.forceArbitration());
        assertTrue(d.blockedAgents().isEmpty());
    }

    @Test
    void blankAndNull_doNotMatch() {
        assertFalse(gate.check("").matched());
        assertFalse(gate.check("   ").matched());
        assertFalse(gate.check(null).matched());
    }

    @Test
    void check_isIdempotent() {
        String[] inputs = {
                "What time does King Library close?",
                "my laptop isn't working",
                "I need help with a computer",
                "Who is the biology librarian?",
                "where can I print"
        };
        for (String q : inputs) {
            assertEquals(gate.check(q), gate.check(q), q);
        }
    }

    @Test
    void anyWord_matchesWholeWordsAndPhrases() {
        PatternRule rule = PatternRule.anyWord("t", "check out", "get");

        assertTrue(rule.test("can i check   out a camera"));
        assertTrue(rule.test("how do i get one"));
        assertFalse(rule.test("forget it"));
        assertFalse(rule.test(null));
        assertEquals("t", rule.name());
    }
}
