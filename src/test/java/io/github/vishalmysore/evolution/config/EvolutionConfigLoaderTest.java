package io.github.vishalmysore.evolution.config;

import io.github.vishalmysore.evolution.domain.ScoringMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class EvolutionConfigLoaderTest {

    private static final double EPS = 1e-9;

    private EvolutionConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new EvolutionConfigLoader();
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        void classpathDefaultsMatchDocumentedValues() {
            EvolutionConfig config = loader.load();
            assertEquals(0.2, config.getMinScore(), EPS);
            assertEquals(365, config.getMaxWindowDays());
            assertEquals(1.0, config.getTemporalK(), EPS);
            assertEquals(0.1, config.getTemporalAlpha(), EPS);
            assertEquals(0.5, config.getMissingSentimentScore(), EPS);
            assertEquals(2048, config.getChunkSize());
            assertEquals(EvolutionConfig.CausalityMode.LOOKUP, config.getCausalityMode());
            for (ScoringMethod method : ScoringMethod.values())
                assertEquals(1.0, config.getWeights().weight(method), EPS);
            assertFalse(config.hasEmbeddingCredentials());
        }

        @Test
        void partialWeightsEnableOnlyListedMethods() {
            EvolutionConfig config = loader.fromProperties(loader.loadResource("evolution-test.properties"));
            assertEquals(0.4, config.getMinScore(), EPS);
            assertEquals(30, config.getMaxWindowDays());
            assertEquals(16, config.getChunkSize());
            assertEquals(EvolutionConfig.CausalityMode.REASONING, config.getCausalityMode());
            assertEquals(2.0, config.getWeights().weight(ScoringMethod.TEMPORAL), EPS);
            assertTrue(config.getWeights().isEnabled(ScoringMethod.CAUSALITY));
            assertFalse(config.getWeights().isEnabled(ScoringMethod.SEMANTIC));
        }

        @Test
        void fileOverridesClasspathValues(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("override.properties");
            Files.writeString(file, "evolution.minScore=0.6\nevolution.workerPoolSize=2\nembedding.apiKey=secret\n");
            EvolutionConfig config = loader.load(file);
            assertEquals(0.6, config.getMinScore(), EPS);
            assertEquals(2, config.getWorkerPoolSize());
            assertEquals(365, config.getMaxWindowDays());
            assertTrue(config.hasEmbeddingCredentials());
        }

        @Test
        void missingOverrideFileIsAConfigurationError(@TempDir Path dir) {
            assertThrows(EvolutionConfigurationException.class, () -> loader.load(dir.resolve("absent.properties")));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        private Properties props(String key, String value) {
            Properties props = new Properties();
            props.setProperty(key, value);
            return props;
        }

        @Test
        void rejectsInvalidValues() {
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.minScore", "1.5")));
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.minScore", "-0.1")));
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.maxWindowDays", "-1")));
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.temporal.k", "0")));
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.temporal.k", "1.5")));
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.temporal.alpha", "-0.1")));
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.workerPoolSize", "0")));
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.weights.temporal", "-1")));
        }

        @Test
        void rejectsUnknownNamesAndMalformedNumbers() {
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.weights.astrology", "1.0")));
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.causalityStrategy", "oracle")));
            assertThrows(EvolutionConfigurationException.class, () -> loader.fromProperties(props("evolution.minScore", "high")));
        }

        @Test
        void builderDefaultsAreValid() {
            EvolutionConfig config = EvolutionConfig.builder().build().validate();
            assertTrue(config.effectiveWorkerCount() >= 1);
            assertTrue(config.effectiveWorkerCount() <= Runtime.getRuntime().availableProcessors());
        }
    }
}
