package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.ScoringMethod;
import lombok.Value;

import java.util.Map;

/**
 * Component scores and composite for one ordered candidate pair, before the
 * threshold is applied.
 */
@Value
public class PairScore {
    Event from;
    Event to;
    Map<ScoringMethod, Double> componentScores;
    double compositeScore;
    boolean degraded;
    String explanation;
}
