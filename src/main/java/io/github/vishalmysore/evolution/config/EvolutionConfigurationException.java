package io.github.vishalmysore.evolution.config;

/**
 * Raised when configuration or lookup table data is invalid. Reported to the
 * caller before any scoring starts.
 */
public class EvolutionConfigurationException extends RuntimeException {

    public EvolutionConfigurationException(String message) {
        super(message);
    }

    public EvolutionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
