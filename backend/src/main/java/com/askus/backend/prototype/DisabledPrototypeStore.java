package com.askus.backend.prototype;

import java.util.List;

/**
 * Used when no vector store is configured. Every search is empty, so routing
 * relies on the pattern gate and the default agent.
 */
public class DisabledPrototypeStore implements PrototypeStore {

    @Override
    public List<PrototypeHit> nearestNeighbors(float[] vector, int limit) {
        return List.of();
    }

    @Override
    public boolean collectionExists() {
        return false;
    }
}
