package io.github.vishalmysore.evolution.similarity;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Zero-dependency similarity provider using the Jaccard coefficient over
 * normalized description tokens. Captures lexical overlap only, NOT semantic
 * relatedness.
 *
 * "Lehman files for bankruptcy" vs "Lehman bankruptcy filing" → 0.4
 *
 * Used as the fallback when no embedding is available.
 */
public class JaccardSimilarityProvider implements SimilarityProvider {

    @Override
    public double computeSimilarity(String textA, String textB) {
        if (textA == null || textB == null)
            return 0.0;
        return jaccard(tokenize(textA), tokenize(textB));
    }

    /**
     * Lower-cased tokens split on anything that is not a letter or digit.
     */
    public static Set<String> tokenize(String text) {
        if (text == null)
            return new HashSet<>();
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toCollection(HashSet::new));
    }

    /**
     * |A ∩ B| / |A ∪ B|, defined as 0 when both sets are empty.
     */
    public static double jaccard(Set<?> setA, Set<?> setB) {
        if (setA.isEmpty() && setB.isEmpty())
            return 0.0;

        Set<Object> intersection = new HashSet<>(setA);
        intersection.retainAll(setB);

        Set<Object> union = new HashSet<>(setA);
        union.addAll(setB);

        return union.isEmpty() ? 0.0 : (double) intersection.size() / union.size();
    }

    @Override
    public String getName() {
        return "Jaccard (lexical overlap)";
    }
}
