package com.askus.backend;

import com.askus.backend.embedding.EmbeddingClient;
import com.askus.backend.llm.LlmClient;
import com.askus.backend.prototype.AskUsWeaviateProperties;
import com.askus.backend.prototype.PrototypeStore;
import com.askus.backend.routing.RoutingProperties;
import com.askus.backend.util.ExternalCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

/**
 * Logs the wiring at start-up and refuses to start when the prototype
 * collection is required but missing.
 */
@Component
public class RouterStartupCheck {

    private static final Logger log = LoggerFactory.getLogger(RouterStartupCheck.class);

    @Bean
    ApplicationRunner routerStartup(RoutingProperties routing,
                                    AskUsWeaviateProperties weaviate,
                                    PrototypeStore store,
                                    LlmClient llm,
                                    EmbeddingClient embeddings) {
        return args -> {
            log.info("llm provider       = {}", llm.providerName());
            log.info("embedding provider = {}", embeddings.providerName());
            log.info("vector store       = {}", weaviate.isEnabled()
                    ? weaviate.getBaseUrl() + " / " + weaviate.getCollection()
                    : "disabled");
            log.info("thresholds         = {}", routing.toArbiterThresholds());

            if (weaviate.isEnabled() && weaviate.isRequireCollectionAtStartup()) {
                verifyCollection(store, weaviate.getCollection());
            }
        };
    }

    static void verifyCollection(PrototypeStore store, String collection) {
        boolean exists;
        try {
            exists = store.collectionExists();
        } catch (ExternalCallException e) {
            throw new IllegalStateException("vector store unreachable at start-up: " + e.getMessage(), e);
        }
        if (!exists) {
            throw new IllegalStateException("prototype collection '" + collection + "' does not exist");
        }
    }
}
