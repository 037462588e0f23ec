package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.ScoringMethod;

import java.util.Optional;

/**
 * A single evolution scoring method. Implementations are pure with respect to
 * their inputs and must be safe to call from several workers at once.
 */
public interface ComponentScorer {

    ScoringMethod method();

    /**
     * Scores a pair whose {@code from} event is not later than {@code to}.
     *
     * @return a score in [0,1], or empty when the method does not apply to the
     *         pair and must be left out of the composite
     */
    Optional<ComponentScore> score(Event from, Event to, ScoringContext context);
}
