package com.askus.backend.embedding;

import com.askus.backend.config.HttpTimeouts;
import com.askus.backend.routing.RoutingProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class EmbeddingConfig {

    @Bean
    @ConditionalOnProperty(name = "askus.embedding.provider", havingValue = "openai")
    public EmbeddingClient openAiEmbeddingClient(AskUsEmbeddingProperties props,
                                                 RoutingProperties routing,
                                                 RestClient.Builder builder) {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            throw new IllegalStateException("askus.embedding.api-key is required when provider=openai");
        }
        return new OpenAiEmbeddingClient(props, builder.requestFactory(
                HttpTimeouts.requestFactory(routing.getTimeouts().getEmbedding())));
    }

    @Bean
    @ConditionalOnMissingBean(EmbeddingClient.class)
    public EmbeddingClient noopEmbeddingClient() {
        return new NoopEmbeddingClient();
    }
}
