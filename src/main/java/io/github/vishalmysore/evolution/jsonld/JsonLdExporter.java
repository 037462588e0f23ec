package io.github.vishalmysore.evolution.jsonld;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.vishalmysore.evolution.domain.Entity;
import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.EvolutionLink;
import io.github.vishalmysore.evolution.domain.RunSummary;
import io.github.vishalmysore.evolution.graph.EvolutionGraph;
import io.github.vishalmysore.evolution.graph.LinkStatistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Exports the event evolution graph as a JSON-LD document using Schema.org
 * terms and an {@code fe:} ontology prefix for events, entities and
 * {@code fe:EvolvesTo} relationships.
 */
public class JsonLdExporter {
    private static final Logger log = Logger.getLogger(JsonLdExporter.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Export the full graph, with link statistics and the run summary when one
     * is given.
     */
    public String exportGraph(EvolutionGraph graph, RunSummary summary) {
        Map<String, Object> doc = buildGraphDocument(graph, summary);
        log.info("Exporting JSON-LD graph: " + graph.getNodeCount() + " events, " + graph.getEdgeCount() + " links");
        return write(doc);
    }

    Map<String, Object> buildGraphDocument(EvolutionGraph graph, RunSummary summary) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("@context", context());
        doc.put("@type", "fe:EvolutionGraph");

        List<Map<String, Object>> graphItems = new ArrayList<>();
        for (Entity entity : graph.getAllEntities()) {
            graphItems.add(entity.toJsonLd());
        }
        for (Event event : graph.getAllNodes()) {
            graphItems.add(event.toJsonLd());
        }
        for (EvolutionLink link : graph.getAllEdges()) {
            graphItems.add(link.toJsonLd());
        }
        doc.put("@graph", graphItems);

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("eventCount", graph.getNodeCount());
        statistics.put("entityCount", graph.getAllEntities().size());
        statistics.put("linkCount", graph.getEdgeCount());
        statistics.put("scores", LinkStatistics.of(graph.getAllEdges()).toMap());
        doc.put("fe:statistics", statistics);
        if (summary != null) {
            doc.put("fe:runSummary", summary.toMap());
        }
        return doc;
    }

    /**
     * Export a list of links only, for example the top-N of a run.
     */
    public String exportLinks(List<EvolutionLink> links) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("@context", context());
        doc.put("@type", "fe:EvolutionLinkSet");
        doc.put("fe:linkCount", links.size());
        doc.put("@graph", links.stream()
                .map(EvolutionLink::toJsonLd)
                .collect(Collectors.toList()));
        return write(doc);
    }

    private static Map<String, Object> context() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("schema", "https://schema.org/");
        context.put("fe", "urn:feekg:ontology:");
        context.put("name", "schema:name");
        context.put("description", "schema:description");
        context.put("startDate", "schema:startDate");
        context.put("source", Map.of("@type", "@id"));
        context.put("target", Map.of("@type", "@id"));
        context.put("weight", "fe:weight");
        return context;
    }

    private static String write(Map<String, Object> doc) {
        try {
            return mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON-LD document", e);
        }
    }
}
