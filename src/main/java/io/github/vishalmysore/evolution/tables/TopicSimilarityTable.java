package io.github.vishalmysore.evolution.tables;

import io.github.vishalmysore.evolution.config.EvolutionConfigurationException;
import io.github.vishalmysore.evolution.domain.TopicCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Symmetric category similarity matrix with a unit diagonal. Pairs that are
 * not listed fall back to {@code defaultSimilarity}.
 */
public final class TopicSimilarityTable {

    private final Map<TopicCategory, Map<TopicCategory, Double>> similarities;
    private final double defaultSimilarity;

    private TopicSimilarityTable(Map<TopicCategory, Map<TopicCategory, Double>> similarities,
            double defaultSimilarity) {
        this.similarities = similarities;
        this.defaultSimilarity = defaultSimilarity;
    }

    public double similarity(TopicCategory a, TopicCategory b) {
        if (a == null || b == null)
            return 0.0;
        if (a == b)
            return 1.0;
        Map<TopicCategory, Double> row = similarities.get(a);
        if (row == null)
            return defaultSimilarity;
        return row.getOrDefault(b, defaultSimilarity);
    }

    public double getDefaultSimilarity() {
        return defaultSimilarity;
    }

    public static TopicSimilarityTable empty() {
        return new TopicSimilarityTable(Collections.emptyMap(), 0.0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<TopicCategory, Map<TopicCategory, Double>> similarities = new EnumMap<>(TopicCategory.class);
        private double defaultSimilarity = 0.0;

        /**
         * Registers a similarity in both directions.
         */
        public Builder pair(TopicCategory a, TopicCategory b, double similarity) {
            if (a == null || b == null)
                throw new EvolutionConfigurationException("Topic similarity entry needs both categories");
            checkRange(similarity, a + " ~ " + b);
            if (a == b && similarity != 1.0)
                throw new EvolutionConfigurationException("Topic similarity diagonal must be 1.0 for " + a);
            Double existing = lookup(b, a);
            if (existing != null && existing != similarity)
                throw new EvolutionConfigurationException(
                        "Topic similarity for " + a + " ~ " + b + " conflicts with an earlier entry");
            similarities.computeIfAbsent(a, k -> new EnumMap<>(TopicCategory.class)).put(b, similarity);
            similarities.computeIfAbsent(b, k -> new EnumMap<>(TopicCategory.class)).put(a, similarity);
            return this;
        }

        public Builder defaultSimilarity(double value) {
            checkRange(value, "default");
            this.defaultSimilarity = value;
            return this;
        }

        public TopicSimilarityTable build() {
            Map<TopicCategory, Map<TopicCategory, Double>> frozen = new EnumMap<>(TopicCategory.class);
            similarities.forEach((k, row) -> frozen.put(k, Collections.unmodifiableMap(new EnumMap<>(row))));
            return new TopicSimilarityTable(Collections.unmodifiableMap(frozen), defaultSimilarity);
        }

        private Double lookup(TopicCategory a, TopicCategory b) {
            Map<TopicCategory, Double> row = similarities.get(a);
            return row == null ? null : row.get(b);
        }

        private static void checkRange(double value, String what) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0)
                throw new EvolutionConfigurationException("Topic similarity for " + what + " must be in [0,1], got " + value);
        }
    }
}
