package io.github.vishalmysore.evolution.embedding;

import io.github.vishalmysore.evolution.domain.Event;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/**
 * Per-event embeddings and sentiments, fetched in one single-threaded pass
 * before pairwise scoring starts and read-only afterwards.
 *
 * Each event is looked up at most once; identical descriptions share one
 * collaborator call. Failed lookups, and vectors that are empty or hold NaN or
 * infinite components, leave the event absent from the cache so
 * scorers fall back. After {@code failureLimit} consecutive failures of one
 * capability the collaborator is treated as unavailable for that capability and
 * no further calls are made.
 */
public final class EmbeddingCache {
    private static final Logger log = Logger.getLogger(EmbeddingCache.class.getName());

    private final Map<String, double[]> embeddings;
    private final Map<String, Double> sentiments;
    private final int embeddingCalls;
    private final int sentimentCalls;
    private final int failures;

    private EmbeddingCache(Map<String, double[]> embeddings, Map<String, Double> sentiments,
            int embeddingCalls, int sentimentCalls, int failures) {
        this.embeddings = embeddings;
        this.sentiments = sentiments;
        this.embeddingCalls = embeddingCalls;
        this.sentimentCalls = sentimentCalls;
        this.failures = failures;
    }

    public static EmbeddingCache empty() {
        return new EmbeddingCache(Collections.emptyMap(), Collections.emptyMap(), 0, 0, 0);
    }

    /**
     * Fetches what the given events need. Sentiment is only requested for events
     * that do not carry their own.
     */
    public static EmbeddingCache populate(Collection<Event> events, EmbeddingClient client,
            boolean fetchEmbeddings, boolean fetchSentiments, int failureLimit) {
        if (client == null || events.isEmpty() || (!fetchEmbeddings && !fetchSentiments))
            return empty();

        log.info("Populating embedding cache for " + events.size() + " events via " + client.getName());
        long start = System.currentTimeMillis();

        Map<String, double[]> embeddings = new HashMap<>();
        Map<String, Double> sentiments = new HashMap<>();
        Map<String, double[]> embeddingsByText = new HashMap<>();
        Map<String, Double> sentimentsByText = new HashMap<>();
        int embeddingCalls = 0;
        int sentimentCalls = 0;
        int failures = 0;
        int embeddingFailureStreak = 0;
        int sentimentFailureStreak = 0;

        for (Event event : events) {
            String text = event.descriptionOrEmpty();
            if (text.isBlank())
                continue;

            if (fetchEmbeddings && embeddingFailureStreak < failureLimit && !embeddings.containsKey(event.getId())) {
                double[] vector = embeddingsByText.get(text);
                if (vector == null) {
                    embeddingCalls++;
                    try {
                        vector = requireUsable(client.embed(text));
                        embeddingsByText.put(text, vector);
                        embeddingFailureStreak = 0;
                    } catch (RuntimeException e) {
                        failures++;
                        embeddingFailureStreak++;
                        log.warning("Embedding failed for event " + event.getId() + ": " + e.getMessage());
                        if (embeddingFailureStreak >= failureLimit)
                            log.warning("Embedding collaborator unavailable after " + failureLimit
                                    + " consecutive failures; semantic scores will use lexical fallback");
                    }
                }
                if (vector != null)
                    embeddings.put(event.getId(), vector);
            }

            if (fetchSentiments && !event.hasSentiment() && sentimentFailureStreak < failureLimit
                    && !sentiments.containsKey(event.getId())) {
                Double value = sentimentsByText.get(text);
                if (value == null) {
                    sentimentCalls++;
                    try {
                        value = clampSentiment(client.sentiment(text));
                        sentimentsByText.put(text, value);
                        sentimentFailureStreak = 0;
                    } catch (RuntimeException e) {
                        failures++;
                        sentimentFailureStreak++;
                        log.warning("Sentiment failed for event " + event.getId() + ": " + e.getMessage());
                        if (sentimentFailureStreak >= failureLimit)
                            log.warning("Sentiment collaborator unavailable after " + failureLimit
                                    + " consecutive failures; emotional scores will use the missing-sentiment default");
                    }
                }
                if (value != null)
                    sentiments.put(event.getId(), value);
            }
        }

        log.info("Embedding cache ready: " + embeddings.size() + " embeddings, " + sentiments.size()
                + " sentiments, " + failures + " failures in " + (System.currentTimeMillis() - start) + " ms");
        return new EmbeddingCache(Collections.unmodifiableMap(embeddings), Collections.unmodifiableMap(sentiments),
                embeddingCalls, sentimentCalls, failures);
    }

    private static double[] requireUsable(double[] vector) {
        if (vector == null || vector.length == 0)
            throw new EmbeddingUnavailableException("Empty embedding");
        for (double component : vector) {
            if (!Double.isFinite(component))
                throw new EmbeddingUnavailableException("Embedding has non-finite component " + component);
        }
        return vector;
    }

    private static double clampSentiment(double value) {
        if (Double.isNaN(value))
            throw new EmbeddingUnavailableException("Sentiment is NaN");
        return Math.max(-1.0, Math.min(1.0, value));
    }

    /**
     * Returns the cached vector or null when the event has none.
     */
    public double[] embedding(String eventId) {
        return embeddings.get(eventId);
    }

    public OptionalDouble sentiment(String eventId) {
        Double value = sentiments.get(eventId);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public int getEmbeddingCount() {
        return embeddings.size();
    }

    public int getSentimentCount() {
        return sentiments.size();
    }

    public int getEmbeddingCalls() {
        return embeddingCalls;
    }

    public int getSentimentCalls() {
        return sentimentCalls;
    }

    public int getFailures() {
        return failures;
    }
}
