package com.askus.backend.prototype;

import com.askus.backend.auth.AccessTokenProvider;
import com.askus.backend.auth.ClientCredentialsTokenProvider;
import com.askus.backend.auth.RestTokenFetcher;
import com.askus.backend.config.HttpTimeouts;
import com.askus.backend.routing.RoutingProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Configuration
public class WeaviateConfig {

    @Bean
    @ConditionalOnProperty(name = "askus.weaviate.enabled", havingValue = "true")
    public PrototypeStore weaviatePrototypeStore(AskUsWeaviateProperties props,
                                                 RoutingProperties routing,
                                                 RestClient.Builder builder) {
        RestClient.Builder timed = builder.requestFactory(
                HttpTimeouts.requestFactory(routing.getTimeouts().getVectorSearch()));
        return new WeaviatePrototypeStore(props, tokenProvider(props, timed.clone()), timed);
    }

    @Bean
    @ConditionalOnMissingBean(PrototypeStore.class)
    public PrototypeStore disabledPrototypeStore() {
        return new DisabledPrototypeStore();
    }

    // OAuth client credentials win over a static API key when both are set.
    private static AccessTokenProvider tokenProvider(AskUsWeaviateProperties props, RestClient.Builder builder) {
        AskUsWeaviateProperties.OAuth oauth = props.getOauth();
        if (oauth.isConfigured()) {
            RestTokenFetcher fetcher = new RestTokenFetcher(builder.build(),
                    oauth.getTokenUrl(), oauth.getClientId(), oauth.getClientSecret(), oauth.getScope());
            return new ClientCredentialsTokenProvider(fetcher, oauth.getRefreshSkew(), Clock.systemUTC());
        }
        return AccessTokenProvider.fixed(props.getApiKey());
    }
}
