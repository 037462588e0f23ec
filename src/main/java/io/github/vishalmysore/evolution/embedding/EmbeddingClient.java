package io.github.vishalmysore.evolution.embedding;

/**
 * External text embedding and sentiment collaborator. Calls are best-effort:
 * implementations throw {@link EmbeddingUnavailableException} when the service
 * fails, times out or rate-limits, and callers degrade instead of aborting.
 */
public interface EmbeddingClient {

    /**
     * Dense vector for the given text.
     */
    double[] embed(String text);

    /**
     * Sentiment of the given text in [-1, 1].
     */
    double sentiment(String text);

    /**
     * Descriptive name of this client (for logging/reporting).
     */
    String getName();
}
