package io.github.vishalmysore.evolution.graph;

import io.github.vishalmysore.evolution.domain.EvolutionLink;
import io.github.vishalmysore.evolution.domain.ScoringMethod;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Score statistics over a link set: composite average, maximum and minimum,
 * and the average of each component over the links that carry it.
 */
@Value
public class LinkStatistics {
    int linkCount;
    double averageScore;
    double maxScore;
    double minScore;
    Map<ScoringMethod, Double> averageComponentScores;

    public static LinkStatistics of(Collection<EvolutionLink> links) {
        if (links.isEmpty())
            return new LinkStatistics(0, 0.0, 0.0, 0.0, Map.of());

        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        Map<ScoringMethod, double[]> components = new EnumMap<>(ScoringMethod.class);
        for (EvolutionLink link : links) {
            double score = link.getCompositeScore();
            sum += score;
            max = Math.max(max, score);
            min = Math.min(min, score);
            link.getComponentScores().forEach((method, value) -> {
                double[] acc = components.computeIfAbsent(method, k -> new double[2]);
                acc[0] += value;
                acc[1]++;
            });
        }

        Map<ScoringMethod, Double> averages = new EnumMap<>(ScoringMethod.class);
        components.forEach((method, acc) -> averages.put(method, acc[0] / acc[1]));
        return new LinkStatistics(links.size(), sum / links.size(), max, min, averages);
    }

    /**
     * The {@code n} highest scoring links, ties kept in input order.
     */
    public static List<EvolutionLink> topLinks(Collection<EvolutionLink> links, int n) {
        return links.stream()
                .sorted(Comparator.comparingDouble(EvolutionLink::getCompositeScore).reversed())
                .limit(Math.max(0, n))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("linkCount", linkCount);
        map.put("averageScore", averageScore);
        map.put("maxScore", maxScore);
        map.put("minScore", minScore);
        Map<String, Double> byMethod = new LinkedHashMap<>();
        averageComponentScores.forEach((method, avg) -> byMethod.put(method.getKey(), avg));
        map.put("averageComponentScores", byMethod);
        return map;
    }
}
