package io.github.vishalmysore.evolution.scoring.causality;

import io.github.vishalmysore.evolution.domain.EventType;
import io.github.vishalmysore.evolution.tables.CausalityTable;

/**
 * Deterministic table lookup; the event texts are ignored and table misses
 * score 0.
 */
public class LookupCausalityStrategy implements CausalityStrategy {

    private final CausalityTable table;

    public LookupCausalityStrategy(CausalityTable table) {
        this.table = table;
    }

    @Override
    public CausalAssessment assess(EventType fromType, EventType toType, String fromText, String toText) {
        return CausalAssessment.of(table.strength(fromType, toType));
    }

    @Override
    public String getName() {
        return "Lookup (" + table.size() + " type pairs)";
    }
}
