package com.askus.backend.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "askus.llm")
public class AskUsLlmProperties {

    private String provider = "noop";
    private OpenRouter openrouter = new OpenRouter();

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public OpenRouter getOpenrouter() { return openrouter; }
    public void setOpenrouter(OpenRouter openrouter) { this.openrouter = openrouter; }

    public static class OpenRouter {
        private String apiKey;
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String model = "openai/o4-mini";
        private String appUrl;
        private String appName;
        private int maxTokens = 300;
        /** Null leaves the provider default; reasoning models reject the parameter. */
        private Double temperature;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getAppUrl() { return appUrl; }
        public void setAppUrl(String appUrl) { this.appUrl = appUrl; }

        public String getAppName() { return appName; }
        public void setAppName(String appName) { this.appName = appName; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }
    }
}
