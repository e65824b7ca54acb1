package com.askus.backend.routing;

import com.askus.backend.embedding.EmbeddingClient;
import com.askus.backend.llm.LlmClient;
import com.askus.backend.prototype.PrototypeStore;
import com.askus.backend.routing.arbiter.ConfidenceArbiter;
import com.askus.backend.routing.gate.PatternGate;
import com.askus.backend.routing.pipeline.RoutingPipeline;
import com.askus.backend.routing.search.PrototypeSearch;
import com.askus.backend.routing.triage.ArbitrationStage;
import com.askus.backend.routing.triage.TriageReplyParser;
import com.askus.backend.util.BoundedCalls;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RoutingConfig {

    @Bean
    public PatternGate patternGate() {
        return new PatternGate();
    }

    @Bean
    public ConfidenceArbiter confidenceArbiter(RoutingProperties props) {
        return new ConfidenceArbiter(props.toArbiterThresholds());
    }

    @Bean
    public PrototypeSearch prototypeSearch(EmbeddingClient embeddings,
                                           PrototypeStore store,
                                           BoundedCalls calls,
                                           RoutingProperties props) {
        return new PrototypeSearch(embeddings, store, calls,
                props.getTimeouts().getEmbedding(),
                props.getTimeouts().getVectorSearch());
    }

    @Bean
    public ArbitrationStage arbitrationStage(LlmClient llm,
                                             ObjectMapper mapper,
                                             BoundedCalls calls,
                                             RoutingProperties props) {
        return new ArbitrationStage(llm, new TriageReplyParser(mapper), calls,
                props.getTimeouts().getLlm(), props.getDefaultAgent());
    }

    @Bean
    public RoutingPipeline routingPipeline(PatternGate gate,
                                           PrototypeSearch search,
                                           ConfidenceArbiter arbiter,
                                           ArbitrationStage arbitration,
                                           RoutingProperties props) {
        return new RoutingPipeline(gate, search, arbiter, arbitration,
                props.getTopK(), props.getCandidatesInResult(), props.getDefaultAgent());
    }
}
