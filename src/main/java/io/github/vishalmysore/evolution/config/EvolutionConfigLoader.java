package io.github.vishalmysore.evolution.config;

import io.github.vishalmysore.evolution.domain.ScoringMethod;
import io.github.vishalmysore.evolution.scoring.ScoringWeights;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Reads {@code evolution.properties} from the classpath, optionally layers a
 * properties file from disk on top, and binds the result into a validated
 * {@link EvolutionConfig}. Keys that are absent keep the builder defaults.
 */
public class EvolutionConfigLoader {
    private static final Logger log = Logger.getLogger(EvolutionConfigLoader.class.getName());

    public static final String DEFAULT_RESOURCE = "evolution.properties";
    private static final String WEIGHT_PREFIX = "evolution.weights.";

    public EvolutionConfig load() {
        return fromProperties(loadResource(DEFAULT_RESOURCE));
    }

    /**
     * Classpath defaults overridden by the given file.
     */
    public EvolutionConfig load(Path overrides) {
        Properties props = loadResource(DEFAULT_RESOURCE);
        try (InputStream is = Files.newInputStream(overrides)) {
            Properties fileProps = new Properties();
            fileProps.load(is);
            props.putAll(fileProps);
        } catch (IOException e) {
            throw new EvolutionConfigurationException("Could not read configuration file " + overrides, e);
        }
        return fromProperties(props);
    }

    public Properties loadResource(String resource) {
        Properties props = new Properties();
        try (InputStream is = EvolutionConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
            } else {
                log.warning("Configuration resource " + resource + " not found, using defaults");
            }
        } catch (IOException e) {
            throw new EvolutionConfigurationException("Could not load " + resource, e);
        }
        return props;
    }

    public EvolutionConfig fromProperties(Properties props) {
        EvolutionConfig.EvolutionConfigBuilder builder = EvolutionConfig.builder();

        readDouble(props, "evolution.minScore").ifPresent(builder::minScore);
        readInt(props, "evolution.maxWindowDays").ifPresent(builder::maxWindowDays);
        readDouble(props, "evolution.temporal.k").ifPresent(builder::temporalK);
        readDouble(props, "evolution.temporal.alpha").ifPresent(builder::temporalAlpha);
        readDouble(props, "evolution.missingSentimentScore").ifPresent(builder::missingSentimentScore);
        readInt(props, "evolution.workerPoolSize").ifPresent(builder::workerPoolSize);
        readInt(props, "evolution.chunkSize").ifPresent(builder::chunkSize);
        readLong(props, "evolution.timeoutMs").ifPresent(builder::timeoutMs);
        readLong(props, "evolution.maxCandidatePairs").ifPresent(builder::maxCandidatePairs);
        readInt(props, "embedding.failureLimit").ifPresent(builder::embeddingFailureLimit);

        String causalityTable = trimmed(props, "evolution.causalityTable");
        if (causalityTable != null)
            builder.causalityTable(causalityTable);
        String topicTable = trimmed(props, "evolution.topicSimilarityTable");
        if (topicTable != null)
            builder.topicSimilarityTable(topicTable);

        String mode = trimmed(props, "evolution.causalityStrategy");
        if (mode != null) {
            try {
                builder.causalityMode(EvolutionConfig.CausalityMode.valueOf(mode.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new EvolutionConfigurationException("Unknown causality strategy '" + mode + "'", e);
            }
        }

        Map<ScoringMethod, Double> weights = new EnumMap<>(ScoringMethod.class);
        for (String key : props.stringPropertyNames()) {
            if (!key.startsWith(WEIGHT_PREFIX))
                continue;
            String name = key.substring(WEIGHT_PREFIX.length());
            ScoringMethod method = ScoringMethod.fromKey(name)
                    .orElseThrow(() -> new EvolutionConfigurationException("Unknown scoring method in weights: " + name));
            readDouble(props, key).ifPresent(w -> weights.put(method, w));
        }
        if (!weights.isEmpty())
            builder.weights(ScoringWeights.of(weights));

        builder.embeddingBaseUrl(trimmed(props, "embedding.baseUrl"));
        builder.embeddingApiKey(trimmed(props, "embedding.apiKey"));
        builder.embeddingModel(trimmed(props, "embedding.model"));
        builder.reasoningModel(trimmed(props, "reasoning.model"));

        EvolutionConfig config = builder.build().validate();
        log.info("Evolution config: minScore=" + config.getMinScore()
                + ", maxWindowDays=" + config.getMaxWindowDays()
                + ", weights=" + config.getWeights()
                + ", workers=" + config.effectiveWorkerCount());
        return config;
    }

    private static String trimmed(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty())
            return null;
        return value.trim();
    }

    private static Optional<Double> readDouble(Properties props, String key) {
        String value = trimmed(props, key);
        if (value == null)
            return Optional.empty();
        try {
            return Optional.of(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            throw new EvolutionConfigurationException(key + " is not a number: " + value, e);
        }
    }

    private static Optional<Integer> readInt(Properties props, String key) {
        String value = trimmed(props, key);
        if (value == null)
            return Optional.empty();
        try {
            return Optional.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            throw new EvolutionConfigurationException(key + " is not an integer: " + value, e);
        }
    }

    private static Optional<Long> readLong(Properties props, String key) {
        String value = trimmed(props, key);
        if (value == null)
            return Optional.empty();
        try {
            return Optional.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new EvolutionConfigurationException(key + " is not an integer: " + value, e);
        }
    }
}
