package com.askus.backend.prototype;

/**
 * One curated example phrase stored for an agent.
 */
public record PrototypeRecord(String agentId, String exampleText, String category, boolean actionBased, int priority) {
}
