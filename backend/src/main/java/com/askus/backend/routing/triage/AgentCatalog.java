package com.askus.backend.routing.triage;

import java.util.Map;

/**
 * User-facing labels for the downstream agents, used in prompts and in
 * clarification buttons.
 */
public final class AgentCatalog {

    private static final Map<String, String> LABELS = Map.of(
            "equipment_checkout", "Borrow equipment (laptops, chargers, cameras, etc.)",
            "libcal_hours", "Library hours or room reservations",
            "subject_librarian", "Find a subject librarian or research guide",
            "libguide", "Course guides or research resources",
            "google_site", "Library policies, services, or website info",
            "libchat_handoff", "Talk to a librarian",
            "ticket_request", "Submit a help request or report a problem",
            "out_of_scope", "This is not a library question"
    );

    private AgentCatalog() {}

    public static String label(String agentId) {
        if (agentId == null) return "";
        return LABELS.getOrDefault(agentId, agentId);
    }
}
