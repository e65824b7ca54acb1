package com.askus.backend.embedding;

import com.askus.backend.util.ExternalCallException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.Map;

/**
 * Client for an OpenAI-compatible {@code /embeddings} endpoint.
 */
public class OpenAiEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingClient.class);

    private final RestClient rest;
    private final AskUsEmbeddingProperties props;

    public OpenAiEmbeddingClient(AskUsEmbeddingProperties props, RestClient.Builder builder) {
        this.props = props;
        this.rest = builder
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (props.getApiKey() == null ? "" : props.getApiKey()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public float[] embed(String text) {
        JsonNode response;
        try {
            response = rest.post()
                    .uri("/embeddings")
                    .body(buildRequestBody(text))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new ExternalCallException("embedding", "request failed: " + e.getMessage(), e);
        }
        return extractVector(response);
    }

    @Override
    public String providerName() {
        return "openai";
    }

    private Map<String, Object> buildRequestBody(String text) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("input", text == null ? "" : text);
        body.put("encoding_format", "float");
        if (props.getDimensions() > 0) {
            body.put("dimensions", props.getDimensions());
        }
        return body;
    }

    static float[] extractVector(JsonNode response) {
        JsonNode data = (response == null) ? null : response.get("data");
        if (data == null || !data.isArray() || data.isEmpty()) {
            throw new ExternalCallException("embedding", "response has no data array");
        }

        JsonNode embedding = data.get(0).get("embedding");
        if (embedding == null || !embedding.isArray()) {
            throw new ExternalCallException("embedding", "response has no embedding");
        }

        float[] vector = new float[embedding.size()];
        for (int i = 0; i < embedding.size(); i++) {
            vector[i] = (float) embedding.get(i).asDouble();
        }
        log.debug("embedded query into {} dimensions", vector.length);
        return vector;
    }
}
