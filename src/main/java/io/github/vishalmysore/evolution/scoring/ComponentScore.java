package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.ScoringMethod;
import lombok.Value;

/**
 * One method's score for one event pair. {@code degraded} marks a score that
 * came from a fallback rather than the primary method.
 */
@Value
public class ComponentScore {
    ScoringMethod method;
    double score;
    boolean degraded;
    String explanation;

    public static ComponentScore of(ScoringMethod method, double score) {
        return new ComponentScore(method, score, false, null);
    }

    public static ComponentScore fallback(ScoringMethod method, double score) {
        return new ComponentScore(method, score, true, null);
    }
}
