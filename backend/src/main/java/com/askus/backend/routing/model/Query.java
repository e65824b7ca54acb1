package com.askus.backend.routing.model;

/**
 * One incoming question. {@code resumeHint} is the agent id the user picked
 * from an earlier clarification, or null.
 */
public record Query(String text, String resumeHint) {

    public static final String OTHER = "other";

    public Query {
        text = (text == null) ? "" : text.trim();
        resumeHint = (resumeHint == null || resumeHint.isBlank()) ? null : resumeHint.trim();
    }

    public boolean hasUsableHint() {
        return resumeHint != null && !OTHER.equalsIgnoreCase(resumeHint);
    }
}
