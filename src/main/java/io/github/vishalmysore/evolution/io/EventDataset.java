package io.github.vishalmysore.evolution.io;

import io.github.vishalmysore.evolution.domain.Entity;
import io.github.vishalmysore.evolution.domain.Event;
import lombok.Value;

import java.util.List;

/**
 * Events and entities read from one dataset document, plus the number of
 * event records that were rejected while reading.
 */
@Value
public class EventDataset {
    List<Event> events;
    List<Entity> entities;
    int rejectedEvents;
}
