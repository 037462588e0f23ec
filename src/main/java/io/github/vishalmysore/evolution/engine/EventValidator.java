package io.github.vishalmysore.evolution.engine;

import io.github.vishalmysore.evolution.domain.Entity;
import io.github.vishalmysore.evolution.domain.Event;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Filters run input. Events without id, date or type, and repeated ids, are
 * excluded from every pair and logged; the run continues without them. An
 * out of range sentiment is dropped and treated as unknown.
 */
public class EventValidator {
    private static final Logger log = Logger.getLogger(EventValidator.class.getName());

    @Value
    public static class Result {
        List<Event> validEvents;
        int excluded;
    }

    public Result validate(Collection<Event> events, Collection<Entity> entities) {
        Set<String> knownEntities = new HashSet<>();
        if (entities != null) {
            for (Entity entity : entities) {
                if (entity != null && entity.getId() != null)
                    knownEntities.add(entity.getId());
            }
        }

        List<Event> valid = new ArrayList<>(events.size());
        Set<String> seenIds = new HashSet<>();
        int excluded = 0;
        int unknownEntityRefs = 0;

        for (Event event : events) {
            String problem = problemWith(event);
            if (problem == null && !seenIds.add(event.getId()))
                problem = "duplicate id";
            if (problem != null) {
                excluded++;
                log.warning("Excluding event " + (event != null ? event.getId() : null) + ": " + problem);
                continue;
            }

            Event accepted = event;
            Double sentiment = event.getSentiment();
            if (sentiment != null && (sentiment.isNaN() || sentiment < -1.0 || sentiment > 1.0)) {
                log.warning("Event " + event.getId() + " has sentiment " + sentiment + " outside [-1,1]; treating as unknown");
                accepted = event.toBuilder().sentiment(null).build();
            }
            if (!knownEntities.isEmpty()) {
                for (String entityId : accepted.getEntities()) {
                    if (!knownEntities.contains(entityId))
                        unknownEntityRefs++;
                }
            }
            valid.add(accepted);
        }

        if (unknownEntityRefs > 0)
            log.info(unknownEntityRefs + " entity references point at entities outside the entity list");
        if (excluded > 0)
            log.warning("Excluded " + excluded + " of " + events.size() + " events from evolution scoring");
        return new Result(Collections.unmodifiableList(valid), excluded);
    }

    private static String problemWith(Event event) {
        if (event == null)
            return "null record";
        if (event.getId() == null || event.getId().isBlank())
            return "missing id";
        if (event.getDate() == null)
            return "missing date";
        if (event.getType() == null)
            return "missing type";
        return null;
    }
}
