package io.github.vishalmysore.evolution.scoring.causality;

import io.github.vishalmysore.evolution.domain.EventType;

/**
 * External reasoning collaborator (typically an LLM) that judges whether an
 * earlier event caused a later one. Implementations throw on any failure.
 */
public interface ReasoningClient {

    CausalAssessment assessCausality(EventType fromType, EventType toType, String fromText, String toText);

    String getName();
}
