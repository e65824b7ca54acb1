package com.askus.backend.prototype;

/**
 * A stored prototype with its similarity to the query, in [0, 1].
 */
public record PrototypeHit(PrototypeRecord record, double score) {
}
