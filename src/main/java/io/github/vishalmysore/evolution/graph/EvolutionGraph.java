package io.github.vishalmysore.evolution.graph;

import io.github.vishalmysore.evolution.domain.Entity;
import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.EvolutionLink;
import io.github.vishalmysore.evolution.engine.EvolutionResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * The event evolution graph: events as nodes, evolution links as directed
 * edges from the earlier event to the later one. This is what a run hands to
 * graph storage or export.
 */
public class EvolutionGraph {
    private static final Logger log = Logger.getLogger(EvolutionGraph.class.getName());

    private final Map<String, Event> nodes = new LinkedHashMap<>();
    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final List<EvolutionLink> edges = new ArrayList<>();
    private final Map<String, List<EvolutionLink>> outgoing = new HashMap<>();
    private final Map<String, List<EvolutionLink>> incoming = new HashMap<>();

    public static EvolutionGraph from(EvolutionResult result) {
        EvolutionGraph graph = new EvolutionGraph();
        result.getEntities().forEach(graph::addEntity);
        result.getEvents().forEach(graph::addNode);
        result.getLinks().forEach(graph::addEdge);
        log.info("Evolution graph built: " + graph.getNodeCount() + " events, " + graph.getEdgeCount() + " links");
        return graph;
    }

    public void addNode(Event event) {
        nodes.put(event.getId(), event);
    }

    public void addEntity(Entity entity) {
        entities.put(entity.getId(), entity);
    }

    /**
     * Adds a link. Both endpoints must already be nodes.
     */
    public void addEdge(EvolutionLink link) {
        if (!nodes.containsKey(link.getFromEventId()) || !nodes.containsKey(link.getToEventId()))
            throw new IllegalArgumentException("Link " + link.getFromEventId() + " -> " + link.getToEventId()
                    + " refers to an unknown event");
        edges.add(link);
        outgoing.computeIfAbsent(link.getFromEventId(), k -> new ArrayList<>()).add(link);
        incoming.computeIfAbsent(link.getToEventId(), k -> new ArrayList<>()).add(link);
    }

    public Event getNode(String id) {
        return nodes.get(id);
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }

    public List<EvolutionLink> getOutgoing(String eventId) {
        return Collections.unmodifiableList(outgoing.getOrDefault(eventId, Collections.emptyList()));
    }

    public List<EvolutionLink> getIncoming(String eventId) {
        return Collections.unmodifiableList(incoming.getOrDefault(eventId, Collections.emptyList()));
    }

    /**
     * Events this event evolved into.
     */
    public List<Event> getSuccessors(String eventId) {
        return getOutgoing(eventId).stream()
                .map(link -> nodes.get(link.getToEventId()))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    /**
     * Events that evolved into this event.
     */
    public List<Event> getPredecessors(String eventId) {
        return getIncoming(eventId).stream()
                .map(link -> nodes.get(link.getFromEventId()))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    public Collection<Event> getAllNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Collection<Entity> getAllEntities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    public List<EvolutionLink> getAllEdges() {
        return Collections.unmodifiableList(edges);
    }
}
