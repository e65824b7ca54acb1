package com.askus.backend.prototype;

import com.askus.backend.auth.AccessTokenProvider;
import com.askus.backend.util.ExternalCallException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Prototype store backed by a Weaviate collection, queried over the REST
 * GraphQL endpoint with caller-supplied vectors (no server-side vectorizer).
 */
public class WeaviatePrototypeStore implements PrototypeStore {

    private static final Logger log = LoggerFactory.getLogger(WeaviatePrototypeStore.class);

    static final String FIELDS = "agent_id prototype_text category is_action_based priority _additional { distance certainty }";
    private static final int DEFAULT_PRIORITY = 5;

    private final RestClient rest;
    private final String collection;
    private final AccessTokenProvider tokens;

    public WeaviatePrototypeStore(AskUsWeaviateProperties props, AccessTokenProvider tokens, RestClient.Builder builder) {
        this.collection = props.getCollection();
        this.tokens = tokens;
        this.rest = builder
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public List<PrototypeHit> nearestNeighbors(float[] vector, int limit) {
        if (vector == null || vector.length == 0 || limit < 1) return List.of();

        JsonNode response;
        try {
            response = rest.post()
                    .uri("/v1/graphql")
                    .headers(this::authorize)
                    .body(Map.of("query", nearVectorQuery(collection, vector, limit)))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException.Unauthorized e) {
            throw rejected(e);
        } catch (RestClientException e) {
            throw new ExternalCallException("vector-store", "graphql request failed: " + e.getMessage(), e);
        }
        return parseHits(response, collection);
    }

    @Override
    public boolean collectionExists() {
        try {
            rest.get()
                    .uri("/v1/schema/{collection}", collection)
                    .headers(this::authorize)
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            return false;
        } catch (HttpClientErrorException.Unauthorized e) {
            throw rejected(e);
        } catch (RestClientException e) {
            throw new ExternalCallException("vector-store", "schema lookup failed: " + e.getMessage(), e);
        }
    }

    // The next call fetches a fresh token instead of replaying the rejected one.
    private ExternalCallException rejected(HttpClientErrorException e) {
        tokens.invalidate();
        return new ExternalCallException("vector-store", "credential rejected (401)", e);
    }

    private void authorize(HttpHeaders headers) {
        tokens.bearerToken().ifPresent(headers::setBearerAuth);
    }

    static String nearVectorQuery(String collection, float[] vector, int limit) {
        StringBuilder sb = new StringBuilder(vector.length * 12 + 200);
        sb.append("{ Get { ").append(collection)
                .append("(nearVector: { vector: [");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(vector[i]);
        }
        sb.append("] }, limit: ").append(limit).append(") { ")
                .append(FIELDS)
                .append(" } } }");
        return sb.toString();
    }

    static List<PrototypeHit> parseHits(JsonNode response, String collection) {
        if (response == null) {
            throw new ExternalCallException("vector-store", "empty graphql response");
        }

        JsonNode errors = response.get("errors");
        if (errors != null && errors.isArray() && !errors.isEmpty()) {
            String first = errors.get(0).path("message").asText("unknown error");
            throw new ExternalCallException("vector-store", "graphql error: " + first);
        }

        JsonNode objects = response.path("data").path("Get").path(collection);
        if (!objects.isArray()) return List.of();

        List<PrototypeHit> hits = new ArrayList<>(objects.size());
        for (JsonNode obj : objects) {
            String agentId = obj.path("agent_id").asText("");
            if (agentId.isBlank()) {
                log.debug("skipping prototype without agent_id");
                continue;
            }
            PrototypeRecord record = new PrototypeRecord(
                    agentId,
                    obj.path("prototype_text").asText(""),
                    obj.path("category").asText(""),
                    obj.path("is_action_based").asBoolean(false),
                    obj.path("priority").asInt(DEFAULT_PRIORITY));
            hits.add(new PrototypeHit(record, similarity(obj.path("_additional"))));
        }
        return hits;
    }

    // Cosine distance lies in [0, 2]; anything past 1 counts as no similarity.
    static double similarity(JsonNode additional) {
        JsonNode distance = additional.get("distance");
        if (distance != null && distance.isNumber()) {
            return 1.0 - Math.min(Math.max(distance.asDouble(), 0.0), 1.0);
        }
        JsonNode certainty = additional.get("certainty");
        if (certainty != null && certainty.isNumber()) {
            return Math.max(0.0, Math.min(1.0, certainty.asDouble()));
        }
        return 0.0;
    }
}
