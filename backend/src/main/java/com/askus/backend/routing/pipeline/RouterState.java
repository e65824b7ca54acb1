package com.askus.backend.routing.pipeline;

/**
 * Stages of one routing pass. {@link #CHECK_HINT} is the entry state and
 * {@link #FINALIZE} the only terminal one.
 */
public enum RouterState {
    CHECK_HINT,
    PATTERN_GATE,
    PROTOTYPE_SEARCH,
    CONFIDENCE_ARBITER,
    ARBITRATION,
    FINALIZE
}
