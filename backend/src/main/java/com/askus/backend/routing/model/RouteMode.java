package com.askus.backend.routing.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which stage produced a {@link RouteResult}.
 */
public enum RouteMode {
    PATTERN("pattern"),
    SIMILARITY("similarity"),
    LLM_ARBITRATION("llm-arbitration"),
    CLARIFY("clarify");

    private final String wireName;

    RouteMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
