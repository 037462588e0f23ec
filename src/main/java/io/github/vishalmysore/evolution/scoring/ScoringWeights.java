package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.config.EvolutionConfigurationException;
import io.github.vishalmysore.evolution.domain.ScoringMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Non-negative weight per scoring method. Methods without a weight are not
 * computed at all. Weights need not sum to one: the composite renormalizes over
 * the methods that produced a score.
 */
public final class ScoringWeights {

    private final Map<ScoringMethod, Double> weights;

    private ScoringWeights(Map<ScoringMethod, Double> weights) {
        this.weights = weights;
    }

    public static ScoringWeights uniform() {
        Map<ScoringMethod, Double> all = new EnumMap<>(ScoringMethod.class);
        for (ScoringMethod method : ScoringMethod.values())
            all.put(method, 1.0);
        return new ScoringWeights(Collections.unmodifiableMap(all));
    }

    public static ScoringWeights of(Map<ScoringMethod, Double> weights) {
        if (weights == null || weights.isEmpty())
            throw new EvolutionConfigurationException("At least one scoring method needs a weight");
        Map<ScoringMethod, Double> copy = new EnumMap<>(ScoringMethod.class);
        weights.forEach((method, weight) -> {
            if (method == null)
                throw new EvolutionConfigurationException("Weight given for a null scoring method");
            if (weight == null || weight.isNaN() || weight.isInfinite() || weight < 0.0)
                throw new EvolutionConfigurationException("Weight for " + method + " must be a non-negative number, got " + weight);
            copy.put(method, weight);
        });
        return new ScoringWeights(Collections.unmodifiableMap(copy));
    }

    /**
     * Weights for exactly the given methods, each 1.0.
     */
    public static ScoringWeights equal(ScoringMethod... methods) {
        Map<ScoringMethod, Double> map = new EnumMap<>(ScoringMethod.class);
        for (ScoringMethod method : methods)
            map.put(method, 1.0);
        return of(map);
    }

    public boolean isEnabled(ScoringMethod method) {
        return weights.containsKey(method);
    }

    public double weight(ScoringMethod method) {
        return weights.getOrDefault(method, 0.0);
    }

    public Set<ScoringMethod> enabledMethods() {
        return weights.keySet();
    }

    public Map<ScoringMethod, Double> asMap() {
        return weights;
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
