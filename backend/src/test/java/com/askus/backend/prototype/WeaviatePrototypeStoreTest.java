package com.askus.backend.prototype;

import com.askus.backend.auth.AccessTokenProvider;
import com.askus.backend.util.ExternalCallException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

public class WeaviatePrototypeStoreTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void parseHits_convertsDistanceToSimilarity() throws Exception {
        JsonNode response = om.readTree("""
                {"data":{"Get":{"AgentPrototypes":[
                  {"agent_id":"equipment_checkout","prototype_text":"borrow a laptop","category":"equipment",
                   "is_action_based":true,"priority":1,"_additional":{"distance":0.25}},
                  {"agent_id":"google_site","prototype_text":"library policies","category":"general",
                   "is_action_based":false,"_additional":{"distance":1.4}},
                  {"agent_id":"libguide","prototype_text":"course guide","_additional":{"certainty":0.81}}
                ]}}}
                """);

        List<PrototypeHit> hits = WeaviatePrototypeStore.parseHits(response, "AgentPrototypes");

        assertEquals(3, hits.size());
        assertEquals("equipment_checkout", hits.get(0).record().agentId());
        assertEquals(0.75, hits.get(0).score(), 1e-9);
        assertTrue(hits.get(0).record().actionBased());
        assertEquals(1, hits.get(0).record().priority());

        assertEquals(0.0, hits.get(1).score(), 1e-9);
        assertEquals(5, hits.get(1).record().priority());

        assertEquals(0.81, hits.get(2).score(), 1e-9);
    }

    @Test
    void parseHits_skipsObjectsWithoutAgent() throws Exception {
        JsonNode response = om.readTree("""
                {"data":{"Get":{"AgentPrototypes":[{"prototype_text":"orphan","_additional":{"distance":0.1}}]}}}
                """);

        assertTrue(WeaviatePrototypeStore.parseHits(response, "AgentPrototypes").isEmpty());
    }

    @Test
    void parseHits_raisesOnGraphqlErrors() throws Exception {
        JsonNode response = om.readTree("""
                {"errors":[{"message":"Cannot query field \\"AgentPrototypes\\" on type \\"GetObjectsObj\\"."}]}
                """);

        ExternalCallException e = assertThrows(ExternalCallException.class,
                () -> WeaviatePrototypeStore.parseHits(response, "AgentPrototypes"));
        assertEquals("vector-store", e.service());
    }

    @Test
    void nearVectorQuery_embedsVectorAndLimit() {
        String q = WeaviatePrototypeStore.nearVectorQuery("AgentPrototypes", new float[]{0.5f, -1.0f}, 10);

        assertTrue(q.contains("AgentPrototypes(nearVector: { vector: [0.5,-1.0] }, limit: 10)"), q);
        assertTrue(q.contains("agent_id prototype_text"));
        assertFalse(q.contains("\n"));
    }

    @Test
    void disabledStore_isEmpty() {
        DisabledPrototypeStore store = new DisabledPrototypeStore();

        assertTrue(store.nearestNeighbors(new float[]{1f}, 5).isEmpty());
        assertFalse(store.collectionExists());
    }

    @Test
    void unauthorizedSearch_dropsCachedToken() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        RecordingTokens tokens = new RecordingTokens();
        WeaviatePrototypeStore store = new WeaviatePrototypeStore(properties(), tokens, builder);

        server.expect(requestTo("http://weaviate.test/v1/graphql"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer t1"))
                .andRespond(withUnauthorizedRequest());

        ExternalCallException e = assertThrows(ExternalCallException.class,
                () -> store.nearestNeighbors(new float[]{0.1f}, 3));

        assertEquals("vector-store", e.service());
        assertEquals(1, tokens.invalidations);
        server.verify();
    }

    @Test
    void unauthorizedSchemaLookup_dropsCachedToken() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        RecordingTokens tokens = new RecordingTokens();
        WeaviatePrototypeStore store = new WeaviatePrototypeStore(properties(), tokens, builder);

        server.expect(requestTo("http://weaviate.test/v1/schema/AgentPrototypes"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withUnauthorizedRequest());

        assertThrows(ExternalCallException.class, store::collectionExists);
        assertEquals(1, tokens.invalidations);
    }

    @Test
    void schemaLookup_keepsTokenOnSuccess() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        RecordingTokens tokens = new RecordingTokens();
        WeaviatePrototypeStore store = new WeaviatePrototypeStore(properties(), tokens, builder);

        server.expect(requestTo("http://weaviate.test/v1/schema/AgentPrototypes"))
                .andRespond(withSuccess());

        assertTrue(store.collectionExists());
        assertEquals(0, tokens.invalidations);
    }

    private static AskUsWeaviateProperties properties() {
        AskUsWeaviateProperties props = new AskUsWeaviateProperties();
        props.setBaseUrl("http://weaviate.test");
        props.setCollection("AgentPrototypes");
        return props;
    }

    static final class RecordingTokens implements AccessTokenProvider {
        int invalidations;

        @Override
        public Optional<String> bearerToken() {
            return Optional.of("t" + (invalidations + 1));
        }

        @Override
        public void invalidate() {
            invalidations++;
        }
    }
}
