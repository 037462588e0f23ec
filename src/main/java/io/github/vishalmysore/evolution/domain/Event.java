package io.github.vishalmysore.evolution.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A dated financial event. Events are read-only inputs to an evolution run;
 * {@code sentiment} and {@code category} may be absent.
 */
@Value
@Builder(toBuilder = true)
public class Event {
    String id;
    LocalDate date;
    EventType type;
    String description;

    // Ids of the entities mentioned by this event
    @Singular
    Set<String> entities;

    // In [-1, 1], null when unknown
    Double sentiment;

    // Null when unclassified
    TopicCategory category;

    public boolean hasSentiment() {
        return sentiment != null;
    }

    public boolean hasCategory() {
        return category != null;
    }

    public String descriptionOrEmpty() {
        return description != null ? description : "";
    }

    /**
     * Converts this event to a JSON-LD node for knowledge graph export.
     */
    public Map<String, Object> toJsonLd() {
        Map<String, Object> jsonLd = new LinkedHashMap<>();
        jsonLd.put("@type", "fe:Event");
        jsonLd.put("@id", "urn:feekg:event:" + id);
        jsonLd.put("fe:eventType", type != null ? type.getCode() : null);
        jsonLd.put("startDate", date != null ? date.toString() : null);
        jsonLd.put("description", description != null && description.length() > 200
                ? description.substring(0, 200) + "..."
                : description);
        if (!entities.isEmpty()) {
            jsonLd.put("fe:involves", entities.stream()
                    .map(e -> Map.of("@id", "urn:feekg:entity:" + e))
                    .toArray());
        }
        if (sentiment != null) {
            jsonLd.put("fe:sentiment", sentiment);
        }
        if (category != null) {
            jsonLd.put("fe:topic", category.getCode());
        }
        return jsonLd;
    }
}
