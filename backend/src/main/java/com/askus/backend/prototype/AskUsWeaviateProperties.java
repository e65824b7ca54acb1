package com.askus.backend.prototype;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "askus.weaviate")
public class AskUsWeaviateProperties {

    private boolean enabled = false;
    private String baseUrl = "http://localhost:8080";
    private String collection = "AgentPrototypes";
    private String apiKey;
    private boolean requireCollectionAtStartup = true;
    private OAuth oauth = new OAuth();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getCollection() { return collection; }
    public void setCollection(String collection) { this.collection = collection; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public boolean isRequireCollectionAtStartup() { return requireCollectionAtStartup; }
    public void setRequireCollectionAtStartup(boolean requireCollectionAtStartup) {
        this.requireCollectionAtStartup = requireCollectionAtStartup;
    }

    public OAuth getOauth() { return oauth; }
    public void setOauth(OAuth oauth) { this.oauth = oauth; }

    public static class OAuth {
        private String tokenUrl;
        private String clientId;
        private String clientSecret;
        private String scope;
        private Duration refreshSkew = Duration.ofMinutes(5);

        public boolean isConfigured() {
            return tokenUrl != null && !tokenUrl.isBlank()
                    && clientId != null && !clientId.isBlank();
        }

        public String getTokenUrl() { return tokenUrl; }
        public void setTokenUrl(String tokenUrl) { this.tokenUrl = tokenUrl; }

        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }

        public String getClientSecret() { return clientSecret; }
        public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }

        public String getScope() { return scope; }
        public void setScope(String scope) { this.scope = scope; }

        public Duration getRefreshSkew() { return refreshSkew; }
        public void setRefreshSkew(Duration refreshSkew) { this.refreshSkew = refreshSkew; }
    }
}
