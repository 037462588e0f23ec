package io.github.vishalmysore.evolution.config;

import io.github.vishalmysore.evolution.scoring.ScoringWeights;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration of an evolution run. Build it directly or load it
 * with {@link EvolutionConfigLoader}; call {@link #validate()} before use.
 */
@Value
@Builder(toBuilder = true)
public class EvolutionConfig {

    public enum CausalityMode {
        LOOKUP,
        REASONING
    }

    @Builder.Default
    double minScore = 0.2;

    @Builder.Default
    int maxWindowDays = 365;

    @Builder.Default
    ScoringWeights weights = ScoringWeights.uniform();

    // TCDI coefficient K and decay rate alpha
    @Builder.Default
    double temporalK = 1.0;

    @Builder.Default
    double temporalAlpha = 0.1;

    @Builder.Default
    double missingSentimentScore = 0.5;

    @Builder.Default
    int workerPoolSize = Runtime.getRuntime().availableProcessors();

    // Target number of candidate pairs per scheduled chunk
    @Builder.Default
    int chunkSize = 2048;

    // 0 disables the global timeout
    @Builder.Default
    long timeoutMs = 0L;

    @Builder.Default
    long maxCandidatePairs = 50_000_000L;

    @Builder.Default
    int embeddingFailureLimit = 5;

    @Builder.Default
    String causalityTable = "causality-table.json";

    @Builder.Default
    String topicSimilarityTable = "topic-similarity.json";

    @Builder.Default
    CausalityMode causalityMode = CausalityMode.LOOKUP;

    String embeddingBaseUrl;
    String embeddingApiKey;
    String embeddingModel;
    String reasoningModel;

    /**
     * Pool size actually used: the configured size capped by the core count.
     */
    public int effectiveWorkerCount() {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), workerPoolSize));
    }

    public boolean hasEmbeddingCredentials() {
        return embeddingApiKey != null && !embeddingApiKey.isBlank()
                && embeddingBaseUrl != null && !embeddingBaseUrl.isBlank();
    }

    public EvolutionConfig validate() {
        if (Double.isNaN(minScore) || minScore < 0.0 || minScore > 1.0)
            throw new EvolutionConfigurationException("minScore must be in [0,1], got " + minScore);
        if (maxWindowDays < 0)
            throw new EvolutionConfigurationException("maxWindowDays must be >= 0, got " + maxWindowDays);
        if (weights == null)
            throw new EvolutionConfigurationException("weights must be set");
        if (Double.isNaN(temporalK) || temporalK <= 0.0 || temporalK > 1.0)
            throw new EvolutionConfigurationException("temporal K must be in (0,1], got " + temporalK);
        if (Double.isNaN(temporalAlpha) || temporalAlpha <= 0.0)
            throw new EvolutionConfigurationException("temporal alpha must be > 0, got " + temporalAlpha);
        if (Double.isNaN(missingSentimentScore) || missingSentimentScore < 0.0 || missingSentimentScore > 1.0)
            throw new EvolutionConfigurationException("missingSentimentScore must be in [0,1], got " + missingSentimentScore);
        if (workerPoolSize < 1)
            throw new EvolutionConfigurationException("workerPoolSize must be >= 1, got " + workerPoolSize);
        if (chunkSize < 1)
            throw new EvolutionConfigurationException("chunkSize must be >= 1, got " + chunkSize);
        if (timeoutMs < 0)
            throw new EvolutionConfigurationException("timeoutMs must be >= 0, got " + timeoutMs);
        if (maxCandidatePairs < 1)
            throw new EvolutionConfigurationException("maxCandidatePairs must be >= 1, got " + maxCandidatePairs);
        if (embeddingFailureLimit < 1)
            throw new EvolutionConfigurationException("embeddingFailureLimit must be >= 1, got " + embeddingFailureLimit);
        if (causalityMode == null)
            throw new EvolutionConfigurationException("causalityMode must be set");
        return this;
    }
}
