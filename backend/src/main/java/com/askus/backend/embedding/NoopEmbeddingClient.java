package com.askus.backend.embedding;

public class NoopEmbeddingClient implements EmbeddingClient {

    private static final float[] EMPTY = new float[0];

    @Override
    public float[] embed(String text) {
        return EMPTY;
    }

    @Override
    public String providerName() {
        return "noop";
    }
}
