package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.ScoringMethod;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Emotional consistency from the Emotional Volatility Index:
 * {@code EVI(s1, s2) = 1 - |s1 - s2| / 2} for sentiments in [-1, 1].
 *
 * An event's own sentiment wins over the cached collaborator value. If either
 * side is still unknown the configured {@code missingSentimentScore} is used
 * and the score is marked degraded.
 */
public class EmotionalConsistencyScorer implements ComponentScorer {

    @Override
    public ScoringMethod method() {
        return ScoringMethod.EMOTIONAL;
    }

    @Override
    public Optional<ComponentScore> score(Event from, Event to, ScoringContext context) {
        OptionalDouble s1 = sentimentOf(from, context);
        OptionalDouble s2 = sentimentOf(to, context);
        if (s1.isEmpty() || s2.isEmpty())
            return Optional.of(ComponentScore.fallback(method(), context.getConfig().getMissingSentimentScore()));
        return Optional.of(ComponentScore.of(method(), evi(s1.getAsDouble(), s2.getAsDouble())));
    }

    public static double evi(double s1, double s2) {
        double score = 1.0 - Math.abs(s1 - s2) / 2.0;
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static OptionalDouble sentimentOf(Event event, ScoringContext context) {
        if (event.hasSentiment())
            return OptionalDouble.of(event.getSentiment());
        return context.getEmbeddingCache().sentiment(event.getId());
    }
}
