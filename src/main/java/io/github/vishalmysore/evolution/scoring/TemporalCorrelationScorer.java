package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.ScoringMethod;

import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Temporal Correlation Decay Index: {@code TCDI(dT) = K * e^(-alpha * dT)}
 * where dT is the day gap. dT = 0 yields K; the score falls toward 0 as the gap
 * grows. Pairs beyond the time window never reach this scorer.
 */
public class TemporalCorrelationScorer implements ComponentScorer {

    @Override
    public ScoringMethod method() {
        return ScoringMethod.TEMPORAL;
    }

    @Override
    public Optional<ComponentScore> score(Event from, Event to, ScoringContext context) {
        long deltaDays = Math.abs(ChronoUnit.DAYS.between(from.getDate(), to.getDate()));
        double score = tcdi(deltaDays, context.getConfig().getTemporalK(), context.getConfig().getTemporalAlpha());
        return Optional.of(ComponentScore.of(method(), score));
    }

    public static double tcdi(long deltaDays, double k, double alpha) {
        double score = k * Math.exp(-alpha * deltaDays);
        return Math.max(0.0, Math.min(1.0, score));
    }
}
