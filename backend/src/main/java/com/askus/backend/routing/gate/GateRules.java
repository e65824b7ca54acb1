package com.askus.backend.routing.gate;

import java.util.List;

/**
 * Rule library for {@link PatternGate}. Patterns are written against
 * lower-cased text.
 */
public final class GateRules {

    private GateRules() {}

    public static final String OUT_OF_SCOPE_AGENT = "out_of_scope";
    public static final String EQUIPMENT_CHECKOUT_AGENT = "equipment_checkout";
    public static final String HOURS_AGENT = "libcal_hours";
    public static final String SUBJECT_LIBRARIAN_AGENT = "subject_librarian";
    public static final String TICKET_AGENT = "ticket_request";
    public static final String HUMAN_HANDOFF_AGENT = "libchat_handoff";

    // ---- out of scope ----

    public static final PatternRule OUT_OF_SCOPE_HOMEWORK = PatternRule.of("out-of-scope.homework",
            "\\b(what'?s|what\\s*is)\\s*the\\s*answer\\s*to\\b.*\\b(question|problem|homework)\\b",
            "\\b(answer|solve|solution)\\s*(to|for)?\\s*(question|problem)\\s*\\d+\\b",
            "\\bhelp\\s*(me)?\\s*(with|on)?\\s*(my)?\\s*homework\\b");

    public static final PatternRule OUT_OF_SCOPE_TECH_SUPPORT = PatternRule.of("out-of-scope.tech-support",
            "\\b(wifi|internet|canvas|email|login|password)\\b.*\\b(issue|problem|broken|not\\s*working|fix|down)\\b",
            "\\b(my|a)\\s*(computer|laptop|phone|device)\\b.*\\b(broken|not\\s*working|crashed|frozen|slow|virus|issue|problem)\\b",
            "\\b(fix|repair|troubleshoot)\\s*(my|a)?\\s*(computer|laptop|phone|device)\\b");

    public static final PatternRule OUT_OF_SCOPE_UNIVERSITY = PatternRule.of("out-of-scope.general-university",
            "\\b(admissions?|tuition|financial\\s*aid|housing|dorm|dining|parking)\\b",
            "\\b(register|enroll|drop)\\s+(for|in)?\\s*(class|course)\\b",
            "\\bcampus\\s+(life|events?|activities)\\b");

    public static final List<PatternRule> OUT_OF_SCOPE = List.of(
            OUT_OF_SCOPE_HOMEWORK, OUT_OF_SCOPE_TECH_SUPPORT, OUT_OF_SCOPE_UNIVERSITY);

    // ---- ambiguity and guardrail vocabulary ----

    public static final PatternRule ENTRY_AMBIGUOUS = PatternRule.of("entry-ambiguous",
            "\\bwho\\s+(can|could|should|do)\\s+i\\s+(talk|speak|contact)\\b",
            "\\bwho\\s+do\\s+i\\s+contact\\b",
            "\\bneed\\s+help\\b",
            "\\b(have\\s+a\\s+)?(problem|issue)\\b",
            "\\b(not\\s+working|doesn'?t\\s+work|won'?t\\s+work)\\b",
            "\\bcan\\s+someone\\s+help\\b",
            "\\bi\\s+need\\s+assistance\\b");

    public static final PatternRule CHECKOUT_ACTION = PatternRule.anyWord("checkout-action",
            "borrow", "borrowing", "checkout", "check out", "checking out", "rent", "renting", "rental",
            "loan", "loaner", "reserve", "reserving", "get", "obtain", "pick up", "availability", "available");

    public static final PatternRule EQUIPMENT_MENTION = PatternRule.anyWord("equipment-mention",
            "computer", "computers", "laptop", "laptops", "chromebook", "chromebooks", "pc", "macbook",
            "charger", "chargers", "adapter", "adapters", "camera", "cameras", "equipment", "device",
            "devices", "ipad", "ipads", "tablet", "tablets", "calculator", "calculators",
            "headphone", "headphones", "tripod", "tripods");

    public static final PatternRule PROBLEM_LANGUAGE = PatternRule.of("problem-language",
            "\\b(problem|problems|issue|issues|help|broken|fix|crashed)\\b",
            "\\b(not|isn'?t|is\\s+not|aren'?t|stopped)\\s+working\\b",
            "\\b(doesn'?t|does\\s+not|won'?t|will\\s+not)\\s+(work|turn\\s+on|charge|start)\\b");

    // ---- fast path ----

    private static final String LOCATIONS =
            "(library|king|art|rentschler|wertz|makerspace|maker\\s*space|special\\s*collections?|havighurst|hamilton|middletown|gardner)";

    public static final PatternRule FAST_PATH_HOURS = PatternRule.of("fast-path.hours",
            "\\b" + LOCATIONS + "\\s+(hours?|open|close|closing|opening)\\b",
            "\\b(hours?|open|close|closing|opening)\\b.*\\b" + LOCATIONS + "\\b",
            "\\bwhat\\s+time\\s+does\\s+.+\\s+(open|close)\\b",
            "\\blibrary\\s+schedule\\b",
            "\\bmakerspace\\b.*\\b(hours?|open|close|when|schedule)\\b",
            "\\b(hours?|open|close|when|schedule)\\b.*\\bmakerspace\\b");

    public static final PatternRule FAST_PATH_SUBJECT_LIBRARIAN = PatternRule.of("fast-path.subject-librarian",
            "\\b(subject|liaison)\\s+librarian\\b",
            "\\blibrarian\\s+for\\s+\\w+\\b",
            "\\bwho\\s+is\\s+the\\s+\\w+\\s+librarian\\b");

    public static final PatternRule FAST_PATH_TICKET = PatternRule.of("fast-path.ticket",
            "\\b(put|submit|create|open|file|leave|send)\\s+(in\\s+|a\\s+)?ticket\\b",
            "\\bticket\\s+(in|for)\\s+(help|support)\\b",
            "\\bhow\\s+(do|can)\\s+i\\s+(submit|put|create|open|file|leave|send)\\s+(a\\s+)?ticket\\b");

    public static final PatternRule FAST_PATH_HUMAN = PatternRule.of("fast-path.human",
            "\\btalk\\s+to\\s+(a\\s+)?(librarian|human|person|staff)\\b",
            "\\bspeak\\s+(with|to)\\s+(a\\s+)?(librarian|human|person)\\b",
            "\\bconnect\\s+me\\s+(to|with)\\s+(a\\s+)?(librarian|human)\\b",
            "\\bhuman\\s+help\\b");

    /** Fast-path rules in evaluation order, paired with the agent each one routes to. */
    public static final List<FastPath> FAST_PATHS = List.of(
            new FastPath(FAST_PATH_HOURS, HOURS_AGENT, "Clear hours query pattern"),
            new FastPath(FAST_PATH_SUBJECT_LIBRARIAN, SUBJECT_LIBRARIAN_AGENT, "Clear subject librarian query"),
            new FastPath(FAST_PATH_TICKET, TICKET_AGENT, "Explicit ticket submission request"),
            new FastPath(FAST_PATH_HUMAN, HUMAN_HANDOFF_AGENT, "Explicit human help request"));

    public record FastPath(PatternRule rule, String agentId, String reason) {}
}
