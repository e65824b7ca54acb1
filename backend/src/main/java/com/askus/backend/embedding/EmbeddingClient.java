package com.askus.backend.embedding;

public interface EmbeddingClient {

    /**
     * Embeds one text. An empty array means "no embedding available".
     *
     * @throws com.askus.backend.util.ExternalCallException when the service cannot be reached
     */
    float[] embed(String text);

    String providerName();
}
