package com.askus.backend.llm;

import com.askus.backend.util.ExternalCallException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions client (OpenRouter by default).
 */
public class OpenRouterLlmClient implements LlmClient {

    private final RestClient rest;
    private final AskUsLlmProperties.OpenRouter props;

    public OpenRouterLlmClient(AskUsLlmProperties props, RestClient.Builder builder) {
        this.props = props.getOpenrouter();

        this.rest = builder
                .baseUrl(this.props.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + nullToEmpty(this.props.getApiKey()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("HTTP-Referer", nullToEmpty(this.props.getAppUrl()))
                .defaultHeader("X-Title", nullToEmpty(this.props.getAppName()))
                .build();
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        return callChatCompletion(
                props.getModel(),
                List.of(
                        msg("system", systemPrompt),
                        msg("user", userPrompt)
                ),
                props.getMaxTokens(),
                props.getTemperature()
        );
    }

    @Override
    public String providerName() {
        return "openrouter";
    }

    // ---- Chat completion caller ----

    private String callChatCompletion(String model,
                                      List<Map<String, String>> messages,
                                      int maxTokens,
                                      Double temperature) {

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("max_tokens", maxTokens);
        if (temperature != null) body.put("temperature", temperature);

        ChatCompletionResponse res;
        try {
            res = rest.post()
                    .uri("/chat/completions")
                    .body(body)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (RestClientException e) {
            throw new ExternalCallException("llm", "chat completion failed: " + e.getMessage(), e);
        }

        if (res == null || res.choices == null || res.choices.isEmpty()
                || res.choices.get(0).message == null
                || res.choices.get(0).message.content == null) {
            return "";
        }

        return res.choices.get(0).message.content.trim();
    }

    private static Map<String, String> msg(String role, String content) {
        return Map.of("role", role, "content", nullToEmpty(content));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public static class ChatCompletionResponse {
        public List<Choice> choices;

        public static class Choice {
            public Message message;
        }

        public static class Message {
            public String role;
            public String content;
        }
    }
}
