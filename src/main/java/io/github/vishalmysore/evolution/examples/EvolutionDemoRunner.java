package io.github.vishalmysore.evolution.examples;

import io.github.vishalmysore.evolution.config.EvolutionConfig;
import io.github.vishalmysore.evolution.config.EvolutionConfigLoader;
import io.github.vishalmysore.evolution.domain.EvolutionLink;
import io.github.vishalmysore.evolution.domain.RunSummary;
import io.github.vishalmysore.evolution.engine.EvolutionEngine;
import io.github.vishalmysore.evolution.engine.EvolutionResult;
import io.github.vishalmysore.evolution.graph.EvolutionGraph;
import io.github.vishalmysore.evolution.graph.LinkStatistics;
import io.github.vishalmysore.evolution.io.EventDataset;
import io.github.vishalmysore.evolution.io.EventDatasetReader;
import io.github.vishalmysore.evolution.jsonld.JsonLdExporter;

import java.nio.file.Path;
import java.util.List;

/**
 * End-to-end run of the evolution engine:
 * 1. Configuration from evolution.properties (optional override file as 2nd arg)
 * 2. Dataset loading (classpath sample, or a file given as 1st arg)
 * 3. Parallel link computation
 * 4. Statistics, top links and JSON-LD export
 */
public class EvolutionDemoRunner {

        private static final String SAMPLE_DATASET = "datasets/lehman-2008.json";

        public static void main(String[] args) {
                System.out.println("╔════════════════════════════════════════════════════════════╗");
                System.out.println("║        Event Evolution Linking Engine Demo                 ║");
                System.out.println("╚════════════════════════════════════════════════════════════╝\n");

                // === Phase 0: Configuration ===
                EvolutionConfigLoader loader = new EvolutionConfigLoader();
                EvolutionConfig config = args.length > 1 ? loader.load(Path.of(args[1])) : loader.load();
                System.out.println("Weights: " + config.getWeights());
                System.out.println("min_score=" + config.getMinScore() + ", window=" + config.getMaxWindowDays()
                                + " days, workers=" + config.effectiveWorkerCount());
                System.out.println(config.hasEmbeddingCredentials()
                                ? "Embedding API configured\n"
                                : "No API key found. Semantic scores use lexical overlap, sentiment uses the dataset\n");

                // === Phase 1: Load events ===
                System.out.println("═══ PHASE 1: LOADING EVENTS ═══\n");
                EventDatasetReader reader = new EventDatasetReader();
                EventDataset dataset = args.length > 0 ? reader.read(Path.of(args[0])) : reader.readResource(SAMPLE_DATASET);
                System.out.println("Loaded " + dataset.getEvents().size() + " events, " + dataset.getEntities().size()
                                + " entities\n");

                // === Phase 2: Compute links ===
                System.out.println("═══ PHASE 2: COMPUTING EVOLUTION LINKS ═══\n");
                EvolutionEngine engine = EvolutionEngine.fromConfig(config);
                EvolutionResult result = engine.run(dataset.getEvents(), dataset.getEntities());
                RunSummary summary = result.getSummary();
                System.out.println("Pairs considered: " + summary.getPairsConsidered()
                                + ", scored: " + summary.getPairsScored()
                                + ", links: " + summary.getLinksMaterialized()
                                + " (" + summary.getDurationMs() + " ms)\n");

                if (result.getLinks().isEmpty()) {
                        System.out.println("No evolution links found above threshold");
                        return;
                }

                // === Phase 3: Statistics ===
                System.out.println("═══ PHASE 3: ANALYSIS ═══\n");
                LinkStatistics stats = LinkStatistics.of(result.getLinks());
                System.out.printf("Score statistics:%n  Average: %.3f%n  Maximum: %.3f%n  Minimum: %.3f%n",
                                stats.getAverageScore(), stats.getMaxScore(), stats.getMinScore());
                System.out.println("\nAverage component scores:");
                stats.getAverageComponentScores().forEach(
                                (method, avg) -> System.out.printf("  %-15s %.3f%n", method.getKey(), avg));

                List<EvolutionLink> top = LinkStatistics.topLinks(result.getLinks(), 10);
                System.out.println("\nTop " + top.size() + " evolution links:");
                for (int i = 0; i < top.size(); i++) {
                        EvolutionLink link = top.get(i);
                        System.out.printf("  %2d. %s -> %s%n      (%s -> %s, score: %.3f%s)%n",
                                        i + 1, link.getFromType(), link.getToType(),
                                        link.getFromDate(), link.getToDate(), link.getCompositeScore(),
                                        link.isDegraded() ? ", degraded" : "");
                }

                // === Phase 4: JSON-LD Export ===
                System.out.println("\n═══ PHASE 4: JSON-LD EXPORT ═══\n");
                EvolutionGraph graph = EvolutionGraph.from(result);
                JsonLdExporter exporter = new JsonLdExporter();
                String graphJsonLd = exporter.exportGraph(graph, summary);
                System.out.println("JSON-LD Graph Document (preview):");
                System.out.println(graphJsonLd.substring(0, Math.min(graphJsonLd.length(), 800)) + "\n...\n");

                String linksJsonLd = exporter.exportLinks(top.subList(0, Math.min(3, top.size())));
                System.out.println("JSON-LD Top Links:");
                System.out.println(linksJsonLd.substring(0, Math.min(linksJsonLd.length(), 600)) + "\n...\n");

                System.out.println("╔════════════════════════════════════════════════════════════╗");
                System.out.println("║                    DEMO COMPLETE                           ║");
                System.out.println("╚════════════════════════════════════════════════════════════╝");
        }
}
