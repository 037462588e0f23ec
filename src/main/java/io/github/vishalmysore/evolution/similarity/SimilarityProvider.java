package io.github.vishalmysore.evolution.similarity;

/**
 * Strategy interface for text similarity without embeddings. The semantic
 * scorer uses it when an event has no cached embedding.
 */
public interface SimilarityProvider {

    /**
     * Compute similarity between two text strings.
     *
     * @return a score between 0.0 (no similarity) and 1.0 (identical)
     */
    double computeSimilarity(String textA, String textB);

    /**
     * Descriptive name of this provider (for logging/reporting).
     */
    String getName();
}
