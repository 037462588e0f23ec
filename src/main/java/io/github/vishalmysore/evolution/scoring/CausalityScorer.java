package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.ScoringMethod;
import io.github.vishalmysore.evolution.scoring.causality.CausalAssessment;

import java.util.Optional;

/**
 * Directed causal strength from the earlier event's type to the later one's,
 * delegated to the context's {@link io.github.vishalmysore.evolution.scoring.causality.CausalityStrategy}.
 * Unknown type pairs score 0.
 */
public class CausalityScorer implements ComponentScorer {

    @Override
    public ScoringMethod method() {
        return ScoringMethod.CAUSALITY;
    }

    @Override
    public Optional<ComponentScore> score(Event from, Event to, ScoringContext context) {
        CausalAssessment assessment = context.getCausalityStrategy().assess(
                from.getType(), to.getType(), from.descriptionOrEmpty(), to.descriptionOrEmpty());
        double score = Math.max(0.0, Math.min(1.0, assessment.getScore()));
        return Optional.of(new ComponentScore(method(), score, assessment.isFallback(), assessment.getExplanation()));
    }
}
