package io.github.vishalmysore.evolution.tables;

import io.github.vishalmysore.evolution.config.EvolutionConfigurationException;
import io.github.vishalmysore.evolution.domain.EventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Directed lookup from (cause type, effect type) to a causal strength in
 * [0, 1]. Missing entries score 0. Instances are immutable and safe to share
 * between scoring workers.
 */
public final class CausalityTable {

    private final Map<EventType, Map<EventType, Double>> strengths;

    private CausalityTable(Map<EventType, Map<EventType, Double>> strengths) {
        this.strengths = strengths;
    }

    public double strength(EventType from, EventType to) {
        if (from == null || to == null)
            return 0.0;
        Map<EventType, Double> row = strengths.get(from);
        if (row == null)
            return 0.0;
        return row.getOrDefault(to, 0.0);
    }

    public boolean contains(EventType from, EventType to) {
        Map<EventType, Double> row = strengths.get(from);
        return row != null && row.containsKey(to);
    }

    public int size() {
        return strengths.values().stream().mapToInt(Map::size).sum();
    }

    public static CausalityTable empty() {
        return new CausalityTable(Collections.emptyMap());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<EventType, Map<EventType, Double>> strengths = new EnumMap<>(EventType.class);
        private double indirectStrength = 0.0;

        public Builder entry(EventType from, EventType to, double strength) {
            if (from == null || to == null)
                throw new EvolutionConfigurationException("Causality entry needs both event types");
            if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0)
                throw new EvolutionConfigurationException(
                        "Causality strength for " + from + " -> " + to + " must be in [0,1], got " + strength);
            strengths.computeIfAbsent(from, k -> new EnumMap<>(EventType.class)).put(to, strength);
            return this;
        }

        /**
         * Adds A -> C at the given strength for every two-hop chain A -> B -> C
         * whose A -> C pair is not listed explicitly. Zero disables derivation.
         */
        public Builder indirectStrength(double strength) {
            if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0)
                throw new EvolutionConfigurationException("Indirect causality strength must be in [0,1], got " + strength);
            this.indirectStrength = strength;
            return this;
        }

        public CausalityTable build() {
            Map<EventType, Map<EventType, Double>> copy = new EnumMap<>(EventType.class);
            strengths.forEach((from, row) -> copy.put(from, new EnumMap<>(row)));

            if (indirectStrength > 0.0) {
                List<EventType[]> derived = new ArrayList<>();
                for (Map.Entry<EventType, Map<EventType, Double>> first : strengths.entrySet()) {
                    for (EventType middle : first.getValue().keySet()) {
                        Map<EventType, Double> second = strengths.get(middle);
                        if (second == null)
                            continue;
                        for (EventType last : second.keySet()) {
                            if (!first.getValue().containsKey(last))
                                derived.add(new EventType[] { first.getKey(), last });
                        }
                    }
                }
                for (EventType[] pair : derived) {
                    copy.computeIfAbsent(pair[0], k -> new EnumMap<>(EventType.class))
                            .putIfAbsent(pair[1], indirectStrength);
                }
            }

            Map<EventType, Map<EventType, Double>> frozen = new EnumMap<>(EventType.class);
            copy.forEach((from, row) -> frozen.put(from, Collections.unmodifiableMap(row)));
            return new CausalityTable(Collections.unmodifiableMap(frozen));
        }
    }
}
