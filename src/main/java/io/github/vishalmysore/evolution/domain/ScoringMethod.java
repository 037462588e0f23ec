package io.github.vishalmysore.evolution.domain;

import java.util.Optional;

/**
 * The six evolution scoring methods. Declaration order is the order in which
 * component scores are summed into the composite, which keeps floating point
 * results identical across runs.
 */
public enum ScoringMethod {
    TEMPORAL("temporal"), // TCDI exponential decay
    ENTITY_OVERLAP("entity_overlap"), // Jaccard over entity ids
    SEMANTIC("semantic"), // cosine over description embeddings
    TOPIC("topic"), // category similarity, skipped when a category is missing
    CAUSALITY("causality"), // directed event-type strength
    EMOTIONAL("emotional"); // EVI sentiment consistency

    private final String key;

    ScoringMethod(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<ScoringMethod> fromKey(String key) {
        if (key == null)
            return Optional.empty();
        String trimmed = key.trim();
        for (ScoringMethod method : values()) {
            if (method.key.equalsIgnoreCase(trimmed) || method.name().equalsIgnoreCase(trimmed))
                return Optional.of(method);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return key;
    }
}
