package com.askus.backend.routing.triage;

import com.askus.backend.routing.model.ClarificationOption;

import java.util.List;

/**
 * A clarifying question with its button options. {@code fromModel} is false
 * when the options were built from candidate labels.
 */
public record Clarification(String question, List<ClarificationOption> options, boolean fromModel) {
    public Clarification {
        options = List.copyOf(options);
    }
}
