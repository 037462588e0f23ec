package io.github.vishalmysore.evolution.engine;

import io.github.vishalmysore.evolution.domain.EvolutionLink;
import io.github.vishalmysore.evolution.scoring.PairScore;

import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * The single gate between scored pairs and emitted links: a link exists iff the
 * composite reaches {@code minScore} and the pair lies inside the window.
 */
public class LinkMaterializer {

    private final double minScore;
    private final int maxWindowDays;

    public LinkMaterializer(double minScore, int maxWindowDays) {
        this.minScore = minScore;
        this.maxWindowDays = maxWindowDays;
    }

    public Optional<EvolutionLink> materialize(PairScore pair) {
        long dayGap = ChronoUnit.DAYS.between(pair.getFrom().getDate(), pair.getTo().getDate());
        if (pair.getCompositeScore() < minScore || dayGap > maxWindowDays)
            return Optional.empty();

        return Optional.of(EvolutionLink.builder()
                .fromEventId(pair.getFrom().getId())
                .toEventId(pair.getTo().getId())
                .fromDate(pair.getFrom().getDate())
                .toDate(pair.getTo().getDate())
                .fromType(pair.getFrom().getType())
                .toType(pair.getTo().getType())
                .dayGap(dayGap)
                .componentScores(pair.getComponentScores())
                .compositeScore(pair.getCompositeScore())
                .degraded(pair.isDegraded())
                .explanation(pair.getExplanation())
                .build());
    }
}
