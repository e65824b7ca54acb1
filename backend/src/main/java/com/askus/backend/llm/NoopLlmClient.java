package com.askus.backend.llm;

public class NoopLlmClient implements LlmClient {

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        return ""; // empty reply, callers fall back deterministically
    }

    @Override
    public String providerName() {
        return "noop";
    }
}
