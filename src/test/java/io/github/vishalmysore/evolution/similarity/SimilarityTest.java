package io.github.vishalmysore.evolution.similarity;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityTest {

    private static final double EPS = 1e-9;

    @Test
    void jaccardBoundaries() {
        assertEquals(0.0, JaccardSimilarityProvider.jaccard(Set.of(), Set.of()), EPS);
        assertEquals(0.0, JaccardSimilarityProvider.jaccard(Set.of("a"), Set.of()), EPS);
        assertEquals(1.0, JaccardSimilarityProvider.jaccard(Set.of("a", "b"), Set.of("b", "a")), EPS);
        assertEquals(0.0, JaccardSimilarityProvider.jaccard(Set.of("a"), Set.of("b")), EPS);
    }

    @Test
    void tokenizationIgnoresCaseAndPunctuation() {
        assertEquals(Set.of("lehman", "s", "q2", "loss"), JaccardSimilarityProvider.tokenize("Lehman's Q2 loss!"));
        assertEquals(1.0, new JaccardSimilarityProvider().computeSimilarity("Chapter 11", "chapter, 11"), EPS);
        assertEquals(0.0, new JaccardSimilarityProvider().computeSimilarity(null, "x"), EPS);
    }

    @Test
    void cosineRescaledToUnitInterval() {
        assertEquals(1.0, VectorSimilarity.normalizedCosine(new double[] { 1, 2 }, new double[] { 2, 4 }), EPS);
        assertEquals(0.5, VectorSimilarity.normalizedCosine(new double[] { 1, 0 }, new double[] { 0, 1 }), EPS);
        assertEquals(0.0, VectorSimilarity.normalizedCosine(new double[] { 1, 0 }, new double[] { -1, 0 }), EPS);
        assertEquals(0.0, VectorSimilarity.cosine(new double[] { 0, 0 }, new double[] { 1, 1 }), EPS);
        assertEquals(0.0, VectorSimilarity.cosine(new double[] { 1 }, new double[] { 1, 1 }), EPS);
    }
}
