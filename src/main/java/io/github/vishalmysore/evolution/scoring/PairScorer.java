package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.ScoringMethod;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Runs every enabled component scorer on a pair and reduces the results with
 * the {@link CompositeAggregator}. Scorers whose method has no weight are not
 * invoked.
 */
public class PairScorer {
    private static final Logger log = Logger.getLogger(PairScorer.class.getName());

    private final List<ComponentScorer> scorers;
    private final CompositeAggregator aggregator;
    private final ScoringContext context;

    public PairScorer(List<ComponentScorer> scorers, ScoringContext context) {
        ScoringWeights weights = context.getConfig().getWeights();
        this.scorers = Collections.unmodifiableList(scorers.stream()
                .filter(s -> weights.isEnabled(s.method()))
                .sorted(Comparator.comparing(ComponentScorer::method))
                .collect(Collectors.toList()));
        this.aggregator = new CompositeAggregator(weights);
        this.context = context;

        for (ScoringMethod method : weights.enabledMethods()) {
            if (this.scorers.stream().noneMatch(s -> s.method() == method))
                log.warning("Weight configured for " + method + " but no scorer is registered for it");
        }
    }

    /**
     * The six standard scorers.
     */
    public static List<ComponentScorer> defaultScorers() {
        List<ComponentScorer> scorers = new ArrayList<>();
        scorers.add(new TemporalCorrelationScorer());
        scorers.add(new EntityOverlapScorer());
        scorers.add(new SemanticSimilarityScorer());
        scorers.add(new TopicRelevanceScorer());
        scorers.add(new CausalityScorer());
        scorers.add(new EmotionalConsistencyScorer());
        return scorers;
    }

    public PairScore score(Event from, Event to) {
        List<ComponentScore> components = new ArrayList<>(scorers.size());
        for (ComponentScorer scorer : scorers) {
            Optional<ComponentScore> result = scorer.score(from, to, context);
            result.ifPresent(components::add);
        }
        return aggregator.aggregate(from, to, components);
    }

    public List<ComponentScorer> getScorers() {
        return scorers;
    }

    public ScoringContext getContext() {
        return context;
    }
}
