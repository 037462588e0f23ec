package io.github.vishalmysore.evolution.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vishalmysore.evolution.config.EvolutionConfigurationException;
import io.github.vishalmysore.evolution.domain.Entity;
import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.EventType;
import io.github.vishalmysore.evolution.domain.TopicCategory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reads an already structured {@code {"events": [...], "entities": [...]}}
 * document.
 *
 * Event records accept {@code id} or {@code eventId}, an ISO date (an RDF
 * datatype suffix such as {@code ^^xsd:date} is stripped), a type code from
 * {@link EventType}, and entity ids from {@code entities} as well as the
 * optional {@code actor} and {@code target} fields. Records with a missing id,
 * an unparseable date or an unknown type are logged and skipped.
 */
public class EventDatasetReader {
    private static final Logger log = Logger.getLogger(EventDatasetReader.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper();

    public EventDataset read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new EvolutionConfigurationException("Cannot read dataset " + path, e);
        }
    }

    public EventDataset readResource(String resource) {
        try (InputStream in = EventDatasetReader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new EvolutionConfigurationException("Dataset resource not found: " + resource);
            return read(in, resource);
        } catch (IOException e) {
            throw new EvolutionConfigurationException("Cannot read dataset resource " + resource, e);
        }
    }

    public EventDataset read(InputStream in, String source) {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new EvolutionConfigurationException("Dataset " + source + " is not valid JSON", e);
        }
        if (root == null || !root.isObject())
            throw new EvolutionConfigurationException("Dataset " + source + " must be a JSON object");

        List<Event> events = new ArrayList<>();
        int rejected = 0;
        for (JsonNode node : root.path("events")) {
            Optional<Event> event = toEvent(node);
            if (event.isPresent())
                events.add(event.get());
            else
                rejected++;
        }

        List<Entity> entities = new ArrayList<>();
        for (JsonNode node : root.path("entities")) {
            String id = firstText(node, "id", "entityId");
            if (id == null) {
                log.warning("Skipping entity without id in " + source);
                continue;
            }
            entities.add(Entity.builder()
                    .id(id)
                    .name(firstText(node, "name", "label"))
                    .type(firstText(node, "type", "entityType"))
                    .build());
        }

        log.info("Loaded " + events.size() + " events and " + entities.size() + " entities from " + source
                + (rejected > 0 ? " (" + rejected + " event records rejected)" : ""));
        return new EventDataset(Collections.unmodifiableList(events), Collections.unmodifiableList(entities),
                rejected);
    }

    private Optional<Event> toEvent(JsonNode node) {
        String id = firstText(node, "id", "eventId");
        if (id == null) {
            log.warning("Skipping event record without id");
            return Optional.empty();
        }
        LocalDate date = parseDate(firstText(node, "date"));
        if (date == null) {
            log.warning("Skipping event " + id + ": missing or unparseable date " + node.path("date"));
            return Optional.empty();
        }
        Optional<EventType> type = EventType.fromCode(firstText(node, "type", "eventType"));
        if (type.isEmpty()) {
            log.warning("Skipping event " + id + ": unknown type " + node.path("type"));
            return Optional.empty();
        }

        Event.EventBuilder builder = Event.builder()
                .id(id)
                .date(date)
                .type(type.get())
                .description(firstText(node, "description", "label"));

        for (JsonNode entity : node.path("entities")) {
            if (entity.isTextual() && !entity.asText().isBlank())
                builder.entity(entity.asText());
        }
        String actor = firstText(node, "actor");
        if (actor != null)
            builder.entity(actor);
        String target = firstText(node, "target");
        if (target != null)
            builder.entity(target);

        JsonNode sentiment = node.path("sentiment");
        if (sentiment.isNumber())
            builder.sentiment(sentiment.asDouble());

        String category = firstText(node, "category", "topic");
        if (category != null) {
            Optional<TopicCategory> topic = TopicCategory.fromCode(category);
            if (topic.isPresent())
                builder.category(topic.get());
            else
                log.warning("Event " + id + " has unknown category " + category + "; leaving it unclassified");
        }
        return Optional.of(builder.build());
    }

    static LocalDate parseDate(String raw) {
        if (raw == null || raw.equals("unknown"))
            return null;
        String text = raw;
        int annotation = text.indexOf("^^");
        if (annotation >= 0)
            text = text.substring(0, annotation);
        text = text.replace("\"", "").trim();
        if (text.length() > 10 && text.charAt(10) == 'T')
            text = text.substring(0, 10);
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank())
                return value.asText();
        }
        return null;
    }
}
