package io.github.vishalmysore.evolution.scoring.causality;

import lombok.Value;

/**
 * Causal strength in [0,1] with an optional explanation. {@code fallback} is
 * set when a strategy could not use its primary source.
 */
@Value
public class CausalAssessment {
    double score;
    String explanation;
    boolean fallback;

    public static CausalAssessment of(double score) {
        return new CausalAssessment(score, null, false);
    }
}
