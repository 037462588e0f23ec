package io.github.vishalmysore.evolution.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed, time-ordered edge between two events. The source event is never
 * later than the target; {@code componentScores} holds only the methods that
 * were actually computed for the pair.
 */
@Value
@Builder
public class EvolutionLink {
    String fromEventId;
    String toEventId;
    LocalDate fromDate;
    LocalDate toDate;
    EventType fromType;
    EventType toType;
    long dayGap;

    @Builder.Default
    Map<ScoringMethod, Double> componentScores = Collections.emptyMap();

    double compositeScore;

    // True when at least one component came from a fallback
    boolean degraded;

    // Set only by the reasoning causality strategy
    String explanation;

    public Double getComponentScore(ScoringMethod method) {
        return componentScores.get(method);
    }

    /**
     * Converts this link to a JSON-LD relationship representation.
     */
    public Map<String, Object> toJsonLd() {
        Map<String, Object> jsonLd = new LinkedHashMap<>();
        jsonLd.put("@type", "fe:EvolvesTo");
        jsonLd.put("source", Map.of("@id", "urn:feekg:event:" + fromEventId));
        jsonLd.put("target", Map.of("@id", "urn:feekg:event:" + toEventId));
        jsonLd.put("weight", compositeScore);
        jsonLd.put("fe:dayGap", dayGap);
        Map<String, Double> components = new LinkedHashMap<>();
        componentScores.forEach((method, score) -> components.put(method.getKey(), score));
        jsonLd.put("fe:components", components);
        if (degraded) {
            jsonLd.put("fe:degraded", true);
        }
        if (explanation != null) {
            jsonLd.put("fe:explanation", explanation);
        }
        return jsonLd;
    }
}
