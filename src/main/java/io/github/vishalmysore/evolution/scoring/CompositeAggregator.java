package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.ScoringMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted mean over the methods actually computed for a pair:
 * {@code sum(w_m * s_m) / sum(w_m)}. Skipped methods drop out of numerator and
 * denominator alike. Summation runs in {@link ScoringMethod} declaration order
 * so the result does not depend on which worker produced it.
 */
public class CompositeAggregator {

    private final ScoringWeights weights;

    public CompositeAggregator(ScoringWeights weights) {
        this.weights = weights;
    }

    public PairScore aggregate(Event from, Event to, List<ComponentScore> components) {
        Map<ScoringMethod, ComponentScore> byMethod = new EnumMap<>(ScoringMethod.class);
        for (ComponentScore component : components) {
            double value = component.getScore();
            if (Double.isNaN(value) || value < 0.0 || value > 1.0)
                throw new IllegalStateException("Component " + component.getMethod() + " out of range for "
                        + from.getId() + " -> " + to.getId() + ": " + value);
            byMethod.put(component.getMethod(), component);
        }

        Map<ScoringMethod, Double> scores = new EnumMap<>(ScoringMethod.class);
        double weighted = 0.0;
        double totalWeight = 0.0;
        boolean degraded = false;
        String explanation = null;
        for (Map.Entry<ScoringMethod, ComponentScore> entry : byMethod.entrySet()) {
            ComponentScore component = entry.getValue();
            double weight = weights.weight(entry.getKey());
            scores.put(entry.getKey(), component.getScore());
            weighted += weight * component.getScore();
            totalWeight += weight;
            degraded |= component.isDegraded();
            if (component.getExplanation() != null)
                explanation = component.getExplanation();
        }

        double composite = totalWeight > 0.0 ? weighted / totalWeight : 0.0;
        composite = Math.max(0.0, Math.min(1.0, composite));
        return new PairScore(from, to, Collections.unmodifiableMap(scores), composite, degraded, explanation);
    }
}
