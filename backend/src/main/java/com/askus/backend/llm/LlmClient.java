package com.askus.backend.llm;

/**
 * Text completion service used by the arbitration stage.
 */
public interface LlmClient {

    /**
     * @return the raw completion text, possibly empty
     * @throws com.askus.backend.util.ExternalCallException when the service cannot be reached
     */
    String complete(String systemPrompt, String userPrompt);

    String providerName();
}
