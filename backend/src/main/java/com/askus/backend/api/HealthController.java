package com.askus.backend.api;

import com.askus.backend.embedding.EmbeddingClient;
import com.askus.backend.llm.LlmClient;
import com.askus.backend.prototype.PrototypeStore;
import com.askus.backend.util.ExternalCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final PrototypeStore store;
    private final LlmClient llm;
    private final EmbeddingClient embeddings;

    public HealthController(PrototypeStore store, LlmClient llm, EmbeddingClient embeddings) {
        this.store = store;
        this.llm = llm;
        this.embeddings = embeddings;
    }

    @GetMapping("/healthz")
    public Map<String, Object> health() {
        boolean vectorStore;
        try {
            vectorStore = store.collectionExists();
        } catch (ExternalCallException e) {
            log.warn("health check: {}", e.getMessage());
            vectorStore = false;
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", true);
        out.put("vectorStore", vectorStore);
        out.put("llmProvider", llm.providerName());
        out.put("embeddingProvider", embeddings.providerName());
        return out;
    }
}
