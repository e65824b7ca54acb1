package com.askus.backend.routing;

import com.askus.backend.routing.arbiter.ArbiterThresholds;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "askus.routing")
public class RoutingProperties {

    private int topK = 5;
    private String defaultAgent = "google_site";
    private int candidatesInResult = 3;
    private Thresholds thresholds = new Thresholds();
    private Timeouts timeouts = new Timeouts();
    private Executor executor = new Executor();

    public int getTopK() { return topK; }
    public void setTopK(int topK) { this.topK = topK; }

    public String getDefaultAgent() { return defaultAgent; }
    public void setDefaultAgent(String defaultAgent) { this.defaultAgent = defaultAgent; }

    public int getCandidatesInResult() { return candidatesInResult; }
    public void setCandidatesInResult(int candidatesInResult) { this.candidatesInResult = candidatesInResult; }

    public Thresholds getThresholds() { return thresholds; }
    public void setThresholds(Thresholds thresholds) { this.thresholds = thresholds; }

    public Timeouts getTimeouts() { return timeouts; }
    public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }

    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    /**
     * Rejects inconsistent settings when the context starts.
     */
    @PostConstruct
    public void validate() {
        if (topK < 1) throw new IllegalStateException("askus.routing.top-k must be >= 1, was " + topK);
        if (candidatesInResult < 1) {
            throw new IllegalStateException("askus.routing.candidates-in-result must be >= 1");
        }
        if (defaultAgent == null || defaultAgent.isBlank()) {
            throw new IllegalStateException("askus.routing.default-agent is required");
        }
        requirePositive("embedding", timeouts.getEmbedding());
        requirePositive("vector-search", timeouts.getVectorSearch());
        requirePositive("llm", timeouts.getLlm());
        if (executor.getCorePoolSize() < 1 || executor.getMaxPoolSize() < executor.getCorePoolSize()) {
            throw new IllegalStateException("askus.routing.executor pool sizes are inconsistent");
        }
        try {
            toArbiterThresholds();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("askus.routing.thresholds: " + e.getMessage(), e);
        }
    }

    public ArbiterThresholds toArbiterThresholds() {
        return new ArbiterThresholds(
                thresholds.getDirectScore(),
                thresholds.getDirectMargin(),
                thresholds.getLowConfScore(),
                thresholds.getLowConfMargin(),
                thresholds.getClarifyMargin());
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalStateException("askus.routing.timeouts." + name + " must be positive");
        }
    }

    public static class Thresholds {
        private double directScore = 0.65;
        private double directMargin = 0.15;
        private double lowConfScore = 0.50;
        private double lowConfMargin = 0.08;
        private double clarifyMargin = 0.03;

        public double getDirectScore() { return directScore; }
        public void setDirectScore(double directScore) { this.directScore = directScore; }

        public double getDirectMargin() { return directMargin; }
        public void setDirectMargin(double directMargin) { this.directMargin = directMargin; }

        public double getLowConfScore() { return lowConfScore; }
        public void setLowConfScore(double lowConfScore) { this.lowConfScore = lowConfScore; }

        public double getLowConfMargin() { return lowConfMargin; }
        public void setLowConfMargin(double lowConfMargin) { this.lowConfMargin = lowConfMargin; }

        public double getClarifyMargin() { return clarifyMargin; }
        public void setClarifyMargin(double clarifyMargin) { this.clarifyMargin = clarifyMargin; }
    }

    public static class Timeouts {
        private Duration embedding = Duration.ofSeconds(5);
        private Duration vectorSearch = Duration.ofSeconds(5);
        private Duration llm = Duration.ofSeconds(15);

        public Duration getEmbedding() { return embedding; }
        public void setEmbedding(Duration embedding) { this.embedding = embedding; }

        public Duration getVectorSearch() { return vectorSearch; }
        public void setVectorSearch(Duration vectorSearch) { this.vectorSearch = vectorSearch; }

        public Duration getLlm() { return llm; }
        public void setLlm(Duration llm) { this.llm = llm; }
    }

    public static class Executor {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 200;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }

        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }
}
