package com.askus.backend.routing.triage;

import com.askus.backend.llm.LlmClient;
import com.askus.backend.routing.model.AgentScoreAggregate;
import com.askus.backend.routing.model.ClarificationOption;
import com.askus.backend.support.RoutingFakes;
import com.askus.backend.support.RoutingFakes.FailingLlm;
import com.askus.backend.support.RoutingFakes.ScriptedLlm;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ArbitrationStageTest {

    private static final List<AgentScoreAggregate> TWO = List.of(
            new AgentScoreAggregate("libcal_hours", 0.52, 1, "reserve a study room"),
            new AgentScoreAggregate("google_site", 0.50, 2, "computer help"));

    private static final List<AgentScoreAggregate> THREE = List.of(
            new AgentScoreAggregate("libcal_hours", 0.52, 1, "reserve a study room"),
            new AgentScoreAggregate("google_site", 0.50, 2, "computer help"),
            new AgentScoreAggregate("libguide", 0.49, 1, "course guides"));

    // ---- clarify ----

    @Test
    void clarify_usesModelOptionsAndAppendsOther() {
        ScriptedLlm llm = new ScriptedLlm("""
                {"question": "Are you booking a room or asking about computers?",
                 "options": [{"label": "Book a study room", "value": "libcal_hours"},
                             {"label": "Computer help", "value": "google_site", "description": "Printing, wifi, software"}]}
                """);

        Clarification c = stage(llm).clarify("I need a room or a computer", TWO);

        assertTrue(c.fromModel());
        assertEquals("Are you booking a room or asking about computers?", c.question());
        assertEquals(List.of("libcal_hours", "google_site", "other"), values(c));
        assertEquals("Book a study room", c.options().get(0).label());
        assertEquals("Printing, wifi, software", c.options().get(1).description());
        assertEquals(ClarificationOption.OTHER_LABEL, c.options().get(2).label());
        assertEquals(1, llm.calls.get());
    }

    @Test
    void clarify_dropsUnknownAndDuplicateValues_keepsOtherLast() {
        ScriptedLlm llm = new ScriptedLlm("""
                {"question": "Which one?",
                 "options": [{"label": "Something else", "value": "other"},
                             {"label": "Rooms", "value": "libcal_hours"},
                             {"label": "Rooms again", "value": "libcal_hours"},
                             {"label": "Made up", "value": "parking_agent"}]}
                """);

        Clarification c = stage(llm).clarify("room", THREE);

        assertEquals(List.of("libcal_hours", "google_site", "libguide", "other"), values(c));
        assertEquals("Rooms", c.options().get(0).label());
        assertEquals(AgentCatalog.label("google_site"), c.options().get(1).label());
        assertEquals(1, c.options().stream().filter(ClarificationOption::isOther).count());
    }

    @Test
    void clarify_malformedReply_fallsBackToCatalogLabels() {
        ScriptedLlm llm = new ScriptedLlm("Sorry, I can't help with that.");

        Clarification c = stage(llm).clarify("hmm", TWO);

        assertFalse(c.fromModel());
        assertEquals(ArbitrationStage.FALLBACK_QUESTION, c.question());
        assertEquals(List.of("libcal_hours", "google_site", "other"), values(c));
        assertEquals("Library hours or room reservations", c.options().get(0).label());
        assertEquals(1, llm.calls.get());
    }

    @Test
    void clarify_noUsableOptions_fallsBack() {
        ScriptedLlm llm = new ScriptedLlm("{\"question\": \"Which?\", \"options\": [{\"label\": \"x\", \"value\": \"nope\"}]}");

        Clarification c = stage(llm).clarify("hmm", TWO);

        assertFalse(c.fromModel());
        assertEquals(List.of("libcal_hours", "google_site", "other"), values(c));
    }

    @Test
    void clarify_modelFailure_fallsBackWithoutRetry() {
        FailingLlm llm = new FailingLlm();

        Clarification c = stage(llm).clarify("hmm", THREE);

        assertEquals(4, c.options().size());
        assertTrue(c.options().get(3).isOther());
        assertEquals(1, llm.calls.get());
    }

    @Test
    void clarify_blankQuestion_usesDefault() {
        ScriptedLlm llm = new ScriptedLlm("{\"question\": \"\", \"options\": [{\"value\": \"libcal_hours\"}]}");

        Clarification c = stage(llm).clarify("hmm", TWO);

        assertEquals(ArbitrationStage.FALLBACK_QUESTION, c.question());
        assertEquals(AgentCatalog.label("libcal_hours"), c.options().get(0).label());
        assertNull(c.options().get(0).description());
    }

    // ---- arbitrate ----

    @Test
    void arbitrate_noCandidates_usesDefaultAgentWithoutCall() {
        ScriptedLlm llm = new ScriptedLlm();

        ArbitrationOutcome o = stage(llm).arbitrate("my laptop isn't working", List.of());

        assertEquals(RoutingFakes.DEFAULT_AGENT, o.agentId());
        assertEquals(0.5, o.confidence(), 1e-9);
        assertEquals(0, llm.calls.get());
    }

    @Test
    void arbitrate_singleCandidate_choosesItWithoutCall() {
        ScriptedLlm llm = new ScriptedLlm();

        ArbitrationOutcome o = stage(llm).arbitrate("guides", List.of(THREE.get(2)));

        assertEquals("libguide", o.agentId());
        assertEquals(0.7, o.confidence(), 1e-9);
        assertEquals(0, llm.calls.get());
    }

    @Test
    void arbitrate_usesModelChoice() {
        ScriptedLlm llm = new ScriptedLlm("""
                ```json
                {"chosen_agent": "google_site", "confidence": 0.85, "reasoning": "Asks about computers."}
                ```
                """);

        ArbitrationOutcome o = stage(llm).arbitrate("computer question", TWO);

        assertTrue(o.fromModel());
        assertEquals("google_site", o.agentId());
        assertEquals(0.85, o.confidence(), 1e-9);
        assertEquals("Asks about computers.", o.reasoning());
        assertTrue(llm.prompts.get(0).contains("libcal_hours (0.520)"));
        assertTrue(llm.prompts.get(0).contains("google_site (0.500)"));
    }

    @Test
    void arbitrate_clampsConfidenceAndDefaultsMissingOne() {
        ArbitrationOutcome high = stage(new ScriptedLlm("{\"chosen_agent\":\"libcal_hours\",\"confidence\":3}"))
                .arbitrate("q", TWO);
        ArbitrationOutcome missing = stage(new ScriptedLlm("{\"chosen_agent\":\"libcal_hours\"}"))
                .arbitrate("q", TWO);

        assertEquals(1.0, high.confidence(), 1e-9);
        assertEquals(0.7, missing.confidence(), 1e-9);
        assertEquals("LLM arbitration", missing.reasoning());
    }

    @Test
    void arbitrate_choiceOutsideCandidates_fallsBackToTop() {
        ScriptedLlm llm = new ScriptedLlm("{\"chosen_agent\":\"libguide\",\"confidence\":0.9}");

        ArbitrationOutcome o = stage(llm).arbitrate("q", TWO);

        assertFalse(o.fromModel());
        assertEquals("libcal_hours", o.agentId());
        assertEquals(0.7, o.confidence(), 1e-9);
        assertTrue(o.reasoning().startsWith("arbitration error"));
    }

    @Test
    void arbitrate_timeout_fallsBackToTop() {
        LlmClient slow = new LlmClient() {
            @Override
            public String complete(String systemPrompt, String userPrompt) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "{\"chosen_agent\":\"google_site\"}";
            }

            @Override
            public String providerName() {
                return "slow";
            }
        };
        ArbitrationStage stage = new ArbitrationStage(slow, new TriageReplyParser(), RoutingFakes.boundedCalls(),
                Duration.ofMillis(100), RoutingFakes.DEFAULT_AGENT);

        ArbitrationOutcome o = stage.arbitrate("q", TWO);

        assertEquals("libcal_hours", o.agentId());
        assertTrue(o.reasoning().startsWith("arbitration error"));
    }

    @Test
    void arbitrate_modelFailure_callsOnce() {
        FailingLlm llm = new FailingLlm();

        ArbitrationOutcome o = stage(llm).arbitrate("q", THREE);

        assertEquals("libcal_hours", o.agentId());
        assertEquals(1, llm.calls.get());
    }

    private static ArbitrationStage stage(LlmClient llm) {
        return new ArbitrationStage(llm, new TriageReplyParser(), RoutingFakes.boundedCalls(),
                Duration.ofSeconds(2), RoutingFakes.DEFAULT_AGENT);
    }

    private static List<String> values(Clarification c) {
        return c.options().stream().map(ClarificationOption::value).toList();
    }
}
