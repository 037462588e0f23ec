package io.github.vishalmysore.evolution.engine;

import io.github.vishalmysore.evolution.domain.Entity;
import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.EvolutionLink;
import io.github.vishalmysore.evolution.domain.RunSummary;
import lombok.Value;

import java.util.List;

/**
 * Output of one evolution run: the materialized links sorted by
 * (from date, from id, to date, to id), the run summary, and the validated
 * inputs the links refer to.
 */
@Value
public class EvolutionResult {
    List<EvolutionLink> links;
    RunSummary summary;
    List<Event> events;
    List<Entity> entities;
}
