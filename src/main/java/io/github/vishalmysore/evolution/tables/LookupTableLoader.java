package io.github.vishalmysore.evolution.tables;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vishalmysore.evolution.config.EvolutionConfigurationException;
import io.github.vishalmysore.evolution.domain.EventType;
import io.github.vishalmysore.evolution.domain.TopicCategory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Loads lookup tables from JSON. A location is tried first as a classpath
 * resource, then as a file path.
 *
 * <pre>
 * causality: {"indirectStrength": 0.6, "entries": {"liquidity_warning": {"bankruptcy": 0.9}}}
 * topics:    {"defaultSimilarity": 0.3, "pairs": {"credit": {"market": 0.7}}}
 * </pre>
 *
 * Unknown event types or categories are logged and skipped; malformed
 * documents and out of range values are configuration errors.
 */
public class LookupTableLoader {
    private static final Logger log = Logger.getLogger(LookupTableLoader.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String DEFAULT_CAUSALITY_TABLE = "causality-table.json";
    public static final String DEFAULT_TOPIC_TABLE = "topic-similarity.json";

    public CausalityTable loadCausalityTable(String location) {
        JsonNode root = read(location);
        CausalityTable.Builder builder = CausalityTable.builder();

        JsonNode indirect = root.path("indirectStrength");
        if (!indirect.isMissingNode())
            builder.indirectStrength(requireNumber(indirect, location, "indirectStrength"));

        JsonNode entries = root.path("entries");
        if (!entries.isObject())
            throw new EvolutionConfigurationException("Causality table " + location + " has no 'entries' object");

        Iterator<Map.Entry<String, JsonNode>> rows = entries.fields();
        while (rows.hasNext()) {
            Map.Entry<String, JsonNode> row = rows.next();
            Optional<EventType> from = EventType.fromCode(row.getKey());
            if (from.isEmpty()) {
                log.warning("Causality table " + location + ": unknown event type '" + row.getKey() + "', row skipped");
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> cells = row.getValue().fields();
            while (cells.hasNext()) {
                Map.Entry<String, JsonNode> cell = cells.next();
                Optional<EventType> to = EventType.fromCode(cell.getKey());
                if (to.isEmpty()) {
                    log.warning("Causality table " + location + ": unknown event type '" + cell.getKey() + "', entry skipped");
                    continue;
                }
                builder.entry(from.get(), to.get(),
                        requireNumber(cell.getValue(), location, row.getKey() + " -> " + cell.getKey()));
            }
        }

        CausalityTable table = builder.build();
        log.info("Loaded causality table from " + location + " with " + table.size() + " entries");
        return table;
    }

    public TopicSimilarityTable loadTopicSimilarityTable(String location) {
        JsonNode root = read(location);
        TopicSimilarityTable.Builder builder = TopicSimilarityTable.builder();

        JsonNode fallback = root.path("defaultSimilarity");
        if (!fallback.isMissingNode())
            builder.defaultSimilarity(requireNumber(fallback, location, "defaultSimilarity"));

        JsonNode pairs = root.path("pairs");
        if (!pairs.isObject())
            throw new EvolutionConfigurationException("Topic table " + location + " has no 'pairs' object");

        Iterator<Map.Entry<String, JsonNode>> rows = pairs.fields();
        while (rows.hasNext()) {
            Map.Entry<String, JsonNode> row = rows.next();
            Optional<TopicCategory> a = TopicCategory.fromCode(row.getKey());
            if (a.isEmpty()) {
                log.warning("Topic table " + location + ": unknown category '" + row.getKey() + "', row skipped");
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> cells = row.getValue().fields();
            while (cells.hasNext()) {
                Map.Entry<String, JsonNode> cell = cells.next();
                Optional<TopicCategory> b = TopicCategory.fromCode(cell.getKey());
                if (b.isEmpty()) {
                    log.warning("Topic table " + location + ": unknown category '" + cell.getKey() + "', entry skipped");
                    continue;
                }
                builder.pair(a.get(), b.get(),
                        requireNumber(cell.getValue(), location, row.getKey() + " ~ " + cell.getKey()));
            }
        }
        log.info("Loaded topic similarity table from " + location);
        return builder.build();
    }

    private JsonNode read(String location) {
        if (location == null || location.isBlank())
            throw new EvolutionConfigurationException("Lookup table location is empty");
        try (InputStream is = LookupTableLoader.class.getClassLoader().getResourceAsStream(location)) {
            if (is != null)
                return mapper.readTree(is);
        } catch (IOException e) {
            throw new EvolutionConfigurationException("Failed to parse lookup table resource " + location, e);
        }

        Path path = Path.of(location);
        if (!Files.isRegularFile(path))
            throw new EvolutionConfigurationException("Lookup table not found on classpath or disk: " + location);
        try (InputStream is = Files.newInputStream(path)) {
            return mapper.readTree(is);
        } catch (IOException e) {
            throw new EvolutionConfigurationException("Failed to read lookup table " + path, e);
        }
    }

    private static double requireNumber(JsonNode node, String location, String what) {
        if (!node.isNumber())
            throw new EvolutionConfigurationException("Lookup table " + location + ": '" + what + "' is not a number");
        return node.asDouble();
    }
}
