package com.askus.backend.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "askus.embedding")
public class AskUsEmbeddingProperties {

    private String provider = "noop";
    private String apiKey;
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "text-embedding-3-large";
    /** 0 keeps the model's native dimension. */
    private int dimensions = 0;

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public int getDimensions() { return dimensions; }
    public void setDimensions(int dimensions) { this.dimensions = dimensions; }
}
