package com.askus.backend.prototype;

import java.util.List;

public interface PrototypeStore {

    /**
     * Nearest stored prototypes to {@code vector}, best first.
     *
     * @throws com.askus.backend.util.ExternalCallException when the store cannot be queried
     */
    List<PrototypeHit> nearestNeighbors(float[] vector, int limit);

    boolean collectionExists();
}
