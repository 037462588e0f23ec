package io.github.vishalmysore.evolution.scoring.causality;

import io.github.vishalmysore.evolution.domain.EventType;

/**
 * Source of directed causal strength between an earlier and a later event.
 * Strategies are interchangeable; the causality scorer does not know which
 * one is active.
 */
public interface CausalityStrategy {

    CausalAssessment assess(EventType fromType, EventType toType, String fromText, String toText);

    /**
     * Causal strength in [0,1].
     */
    default double score(EventType fromType, EventType toType, String fromText, String toText) {
        return assess(fromType, toType, fromText, toText).getScore();
    }

    String getName();
}
