package io.github.vishalmysore.evolution.similarity;

/**
 * Vector similarity helpers for dense embeddings.
 */
public final class VectorSimilarity {

    private VectorSimilarity() {
    }

    /**
     * Cosine similarity: dot(A, B) / (||A|| * ||B||). Zero for mismatched
     * dimensions or zero vectors.
     */
    public static double cosine(double[] a, double[] b) {
        if (a.length != b.length)
            return 0.0;

        double dot = 0.0, normA = 0.0, normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        double denom = Math.sqrt(normA) * Math.sqrt(normB);
        return denom == 0.0 ? 0.0 : dot / denom;
    }

    /**
     * Cosine rescaled from [-1, 1] to [0, 1] via (cos + 1) / 2, clamped against
     * rounding drift.
     */
    public static double normalizedCosine(double[] a, double[] b) {
        double scaled = (cosine(a, b) + 1.0) / 2.0;
        return Math.max(0.0, Math.min(1.0, scaled));
    }
}
