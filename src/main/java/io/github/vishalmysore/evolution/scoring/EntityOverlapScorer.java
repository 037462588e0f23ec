package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.ScoringMethod;
import io.github.vishalmysore.evolution.similarity.JaccardSimilarityProvider;

import java.util.Optional;

/**
 * Jaccard similarity of the two events' entity id sets. Two empty sets score 0:
 * an empty comparison carries no evidence of a relation.
 */
public class EntityOverlapScorer implements ComponentScorer {

    @Override
    public ScoringMethod method() {
        return ScoringMethod.ENTITY_OVERLAP;
    }

    @Override
    public Optional<ComponentScore> score(Event from, Event to, ScoringContext context) {
        return Optional.of(ComponentScore.of(method(),
                JaccardSimilarityProvider.jaccard(from.getEntities(), to.getEntities())));
    }
}
