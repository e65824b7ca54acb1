package com.askus.backend.routing.search;

import com.askus.backend.embedding.EmbeddingClient;
import com.askus.backend.prototype.PrototypeHit;
import com.askus.backend.prototype.PrototypeStore;
import com.askus.backend.routing.model.Candidate;
import com.askus.backend.util.BoundedCalls;
import com.askus.backend.util.ExternalCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Embeds a query and returns its nearest agent prototypes. Any failure of the
 * embedding model or the store yields an empty list.
 */
public class PrototypeSearch {

    private static final Logger log = LoggerFactory.getLogger(PrototypeSearch.class);

    private final EmbeddingClient embeddings;
    private final PrototypeStore store;
    private final BoundedCalls calls;
    private final Duration embeddingTimeout;
    private final Duration searchTimeout;

    public PrototypeSearch(EmbeddingClient embeddings,
                           PrototypeStore store,
                           BoundedCalls calls,
                           Duration embeddingTimeout,
                           Duration searchTimeout) {
        this.embeddings = embeddings;
        this.store = store;
        this.calls = calls;
        this.embeddingTimeout = embeddingTimeout;
        this.searchTimeout = searchTimeout;
    }

    public List<Candidate> search(String text, int topK, Set<String> blockedAgents) {
        if (text == null || text.isBlank() || topK < 1) return List.of();
        Set<String> blocked = (blockedAgents == null) ? Set.of() : blockedAgents;

        try {
            float[] vector = calls.call("embedding", embeddingTimeout, () -> embeddings.embed(text));
            if (vector == null || vector.length == 0) {
                log.debug("no query vector from {}, skipping prototype search", embeddings.providerName());
                return List.of();
            }

            // Oversample so that dropping blocked agents still leaves topK hits.
            List<PrototypeHit> hits = calls.call("vector-store", searchTimeout,
                    () -> store.nearestNeighbors(vector, topK * 2));

            List<Candidate> out = new ArrayList<>(topK);
            for (PrototypeHit hit : hits) {
                if (blocked.contains(hit.record().agentId())) continue;
                out.add(toCandidate(hit));
                if (out.size() >= topK) break;
            }

            log.info("prototype search: {} hits, {} kept (blocked={})", hits.size(), out.size(), blocked);
            return out;
        } catch (ExternalCallException e) {
            log.warn("prototype search degraded: {}", e.getMessage());
            return List.of();
        }
    }

    private static Candidate toCandidate(PrototypeHit hit) {
        return new Candidate(
                hit.record().agentId(),
                hit.score(),
                hit.record().exampleText(),
                hit.record().category(),
                hit.record().actionBased(),
                hit.record().priority());
    }
}
