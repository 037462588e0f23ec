package io.github.vishalmysore.evolution.domain;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Observability record for a single evolution run.
 */
@Value
@Builder
public class RunSummary {
    int eventsConsidered;
    int eventsExcluded;

    // Candidate pairs inside the time window
    long pairsConsidered;
    long pairsScored;
    long pairsSkippedDueToFailure;

    // Pairs of chunks never dispatched because of cancellation or timeout
    long pairsNotDispatched;

    int chunksTotal;
    int chunksFailed;
    long linksMaterialized;
    long degradedLinks;
    int workerCount;
    boolean cancelled;
    boolean timedOut;
    long durationMs;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("eventsConsidered", eventsConsidered);
        map.put("eventsExcluded", eventsExcluded);
        map.put("pairsConsidered", pairsConsidered);
        map.put("pairsScored", pairsScored);
        map.put("pairsSkippedDueToFailure", pairsSkippedDueToFailure);
        map.put("pairsNotDispatched", pairsNotDispatched);
        map.put("chunksTotal", chunksTotal);
        map.put("chunksFailed", chunksFailed);
        map.put("linksMaterialized", linksMaterialized);
        map.put("degradedLinks", degradedLinks);
        map.put("workerCount", workerCount);
        map.put("cancelled", cancelled);
        map.put("timedOut", timedOut);
        map.put("durationMs", durationMs);
        return map;
    }
}
