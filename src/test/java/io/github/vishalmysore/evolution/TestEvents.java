package io.github.vishalmysore.evolution;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.EventType;
import io.github.vishalmysore.evolution.domain.TopicCategory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Event fixtures shared by the tests.
 */
public final class TestEvents {

    private TestEvents() {
    }

    public static Event event(String id, String date, EventType type, String... entities) {
        return Event.builder()
                .id(id)
                .date(LocalDate.parse(date))
                .type(type)
                .description(type.getCode().replace('_', ' ') + " " + id)
                .entities(List.of(entities))
                .build();
    }

    public static Event described(String id, String date, EventType type, String description, Double sentiment,
            TopicCategory category, String... entities) {
        return Event.builder()
                .id(id)
                .date(LocalDate.parse(date))
                .type(type)
                .description(description)
                .entities(List.of(entities))
                .sentiment(sentiment)
                .category(category)
                .build();
    }

    /**
     * Reproducible pseudo-random events spread over {@code spanDays}.
     */
    public static List<Event> random(int count, int spanDays, long seed) {
        Random random = new Random(seed);
        EventType[] types = EventType.values();
        TopicCategory[] categories = TopicCategory.values();
        String[] entityPool = { "ent_lehman", "ent_aig", "ent_fed", "ent_treasury", "ent_bear", "ent_merrill" };
        String[] words = { "liquidity", "credit", "default", "bank", "market", "crash", "rescue", "loss", "fund" };
        LocalDate start = LocalDate.of(2008, 1, 1);

        List<Event> events = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Event.EventBuilder builder = Event.builder()
                    .id(String.format("evt_%04d", i))
                    .date(start.plusDays(random.nextInt(spanDays)))
                    .type(types[random.nextInt(types.length)])
                    .description(words[random.nextInt(words.length)] + " " + words[random.nextInt(words.length)]
                            + " " + words[random.nextInt(words.length)]);
            int entityCount = random.nextInt(3);
            for (int e = 0; e < entityCount; e++)
                builder.entity(entityPool[random.nextInt(entityPool.length)]);
            if (random.nextBoolean())
                builder.sentiment(random.nextDouble() * 2.0 - 1.0);
            if (random.nextInt(4) > 0)
                builder.category(categories[random.nextInt(categories.length)]);
            events.add(builder.build());
        }
        return events;
    }
}
