package com.askus.backend.llm;

import com.askus.backend.config.HttpTimeouts;
import com.askus.backend.routing.RoutingProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class LlmConfig {

    @Bean
    @ConditionalOnProperty(name = "askus.llm.provider", havingValue = "openrouter")
    public LlmClient openRouterLlmClient(AskUsLlmProperties props,
                                         RoutingProperties routing,
                                         RestClient.Builder builder) {
        if (props.getOpenrouter().getApiKey() == null || props.getOpenrouter().getApiKey().isBlank()) {
            throw new IllegalStateException("askus.llm.openrouter.api-key is required when provider=openrouter");
        }
        return new OpenRouterLlmClient(props, builder.requestFactory(
                HttpTimeouts.requestFactory(routing.getTimeouts().getLlm())));
    }

    @Bean
    @ConditionalOnMissingBean(LlmClient.class)
    public LlmClient noopLlmClient() {
        return new NoopLlmClient();
    }
}
