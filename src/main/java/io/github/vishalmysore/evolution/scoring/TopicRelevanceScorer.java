package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.ScoringMethod;

import java.util.Optional;

/**
 * Category similarity from the topic table: 1.0 for identical categories, the
 * table value otherwise. Skipped (not scored) when either event is
 * unclassified, so the composite renormalizes over the remaining methods.
 */
public class TopicRelevanceScorer implements ComponentScorer {

    @Override
    public ScoringMethod method() {
        return ScoringMethod.TOPIC;
    }

    @Override
    public Optional<ComponentScore> score(Event from, Event to, ScoringContext context) {
        if (!from.hasCategory() || !to.hasCategory())
            return Optional.empty();
        if (from.getCategory() == to.getCategory())
            return Optional.of(ComponentScore.of(method(), 1.0));
        return Optional.of(ComponentScore.of(method(),
                context.getTopicTable().similarity(from.getCategory(), to.getCategory())));
    }
}
