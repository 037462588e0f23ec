package io.github.vishalmysore.evolution.engine;

import io.github.vishalmysore.evolution.TestEvents;
import io.github.vishalmysore.evolution.config.EvolutionConfig;
import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.EventType;
import io.github.vishalmysore.evolution.domain.EvolutionLink;
import io.github.vishalmysore.evolution.domain.RunSummary;
import io.github.vishalmysore.evolution.domain.ScoringMethod;
import io.github.vishalmysore.evolution.embedding.EmbeddingClient;
import io.github.vishalmysore.evolution.scoring.ComponentScore;
import io.github.vishalmysore.evolution.scoring.ComponentScorer;
import io.github.vishalmysore.evolution.scoring.PairScorer;
import io.github.vishalmysore.evolution.scoring.ScoringContext;
import io.github.vishalmysore.evolution.scoring.ScoringWeights;
import io.github.vishalmysore.evolution.scoring.causality.CausalAssessment;
import io.github.vishalmysore.evolution.scoring.causality.ReasoningCausalityStrategy;
import io.github.vishalmysore.evolution.scoring.causality.ReasoningClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static io.github.vishalmysore.evolution.TestEvents.event;
import static org.junit.jupiter.api.Assertions.*;

class EvolutionEngineTest {

    private static final double EPS = 1e-9;

    private static EvolutionEngine engine(EvolutionConfig config) {
        return EvolutionEngine.builder().config(config).build();
    }

    private static Set<String> pairKeys(List<EvolutionLink> links) {
        return links.stream()
                .map(l -> l.getFromEventId() + "->" + l.getToEventId())
                .collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Worked scenarios")
    class Scenarios {

        @Test
        void lehmanLiquidityWarningToBankruptcy() {
            EvolutionConfig config = EvolutionConfig.builder()
                    .weights(ScoringWeights.equal(ScoringMethod.TEMPORAL, ScoringMethod.ENTITY_OVERLAP,
                            ScoringMethod.CAUSALITY))
                    .build();
            EvolutionResult result = engine(config).run(List.of(
                    event("evt_a", "2008-09-12", EventType.LIQUIDITY_WARNING, "ent_lehman"),
                    event("evt_b", "2008-09-15", EventType.BANKRUPTCY, "ent_lehman")), List.of());

            assertEquals(1, result.getLinks().size());
            EvolutionLink link = result.getLinks().get(0);
            assertEquals("evt_a", link.getFromEventId());
            assertEquals("evt_b", link.getToEventId());
            assertEquals(Math.exp(-0.3), link.getComponentScore(ScoringMethod.TEMPORAL), EPS);
            assertEquals(1.0, link.getComponentScore(ScoringMethod.ENTITY_OVERLAP), EPS);
            assertEquals(0.9, link.getComponentScore(ScoringMethod.CAUSALITY), EPS);
            assertEquals((Math.exp(-0.3) + 1.0 + 0.9) / 3.0, link.getCompositeScore(), EPS);
            assertEquals(0.8803, link.getCompositeScore(), 1e-4);
            assertFalse(link.isDegraded());
        }

        @Test
        void fiveEventsProduceExactlyTheExpectedLinks() {
            EvolutionConfig config = EvolutionConfig.builder()
                    .weights(ScoringWeights.equal(ScoringMethod.TEMPORAL, ScoringMethod.ENTITY_OVERLAP,
                            ScoringMethod.CAUSALITY))
                    .minScore(0.5)
                    .maxWindowDays(30)
                    .build();
            List<Event> events = List.of(
                    event("e5", "2008-03-05", EventType.CONTAGION, "ent_x"),
                    event("e1", "2008-01-01", EventType.REGULATORY_PRESSURE, "ent_x"),
                    event("e3", "2008-01-10", EventType.CREDIT_DOWNGRADE, "ent_y"),
                    event("e2", "2008-01-03", EventType.LIQUIDITY_WARNING, "ent_x"),
                    event("e4", "2008-03-01", EventType.BANKRUPTCY, "ent_x"));

            EvolutionResult result = engine(config).run(events, List.of());

            assertEquals(List.of("e1->e2", "e4->e5"), result.getLinks().stream()
                    .map(l -> l.getFromEventId() + "->" + l.getToEventId())
                    .collect(Collectors.toList()));
            assertEquals((Math.exp(-0.2) + 1.0 + 0.9) / 3.0, result.getLinks().get(0).getCompositeScore(), EPS);
            assertEquals((Math.exp(-0.4) + 1.0 + 0.9) / 3.0, result.getLinks().get(1).getCompositeScore(), EPS);

            RunSummary summary = result.getSummary();
            assertEquals(5, summary.getEventsConsidered());
            assertEquals(4, summary.getPairsConsidered());
            assertEquals(4, summary.getPairsScored());
            assertEquals(0, summary.getPairsSkippedDueToFailure());
            assertEquals(2, summary.getLinksMaterialized());
        }

        @Test
        void tenDaysSharingOneEntityEmitExactlyTheQualifyingPairs() {
            EvolutionConfig config = EvolutionConfig.builder()
                    .weights(ScoringWeights.equal(ScoringMethod.TEMPORAL, ScoringMethod.ENTITY_OVERLAP,
                            ScoringMethod.CAUSALITY))
                    .minScore(0.3)
                    .maxWindowDays(30)
                    .build();
            // every pair shares ent_lehman and nothing else: entity overlap 1/7
            List<Event> events = List.of(
                    event("e1", "2008-09-05", EventType.LIQUIDITY_WARNING, "ent_lehman", "ent_a1", "ent_a2", "ent_a3"),
                    event("e2", "2008-09-07", EventType.CREDIT_DOWNGRADE, "ent_lehman", "ent_b1", "ent_b2", "ent_b3"),
                    event("e3", "2008-09-09", EventType.MANAGEMENT_CHANGE, "ent_lehman", "ent_c1", "ent_c2", "ent_c3"),
                    event("e4", "2008-09-12", EventType.BANKRUPTCY, "ent_lehman", "ent_d1", "ent_d2", "ent_d3"),
                    event("e5", "2008-09-15", EventType.EARNINGS_ANNOUNCEMENT, "ent_lehman", "ent_f1", "ent_f2", "ent_f3"));

            EvolutionResult result = engine(config).run(events, List.of());

            // e1->e3, e1->e5, e2->e5, e3->e4, e3->e5 and e4->e5 have no causal entry and fall below 0.3
            assertEquals(List.of("e1->e2", "e1->e4", "e2->e3", "e2->e4"), result.getLinks().stream()
                    .map(l -> l.getFromEventId() + "->" + l.getToEventId())
                    .collect(Collectors.toList()));

            double overlap = 1.0 / 7.0;
            assertEquals((Math.exp(-0.2) + overlap + 0.9) / 3.0, result.getLinks().get(0).getCompositeScore(), EPS);
            assertEquals((Math.exp(-0.7) + overlap + 0.9) / 3.0, result.getLinks().get(1).getCompositeScore(), EPS);
            assertEquals((Math.exp(-0.2) + overlap + 0.0) / 3.0, result.getLinks().get(2).getCompositeScore(), EPS);
            // credit_downgrade -> debt_default -> bankruptcy: derived indirect strength
            assertEquals((Math.exp(-0.5) + overlap + 0.6) / 3.0, result.getLinks().get(3).getCompositeScore(), EPS);

            RunSummary summary = result.getSummary();
            assertEquals(10, summary.getPairsConsidered());
            assertEquals(10, summary.getPairsScored());
            assertEquals(4, summary.getLinksMaterialized());
        }

        @Test
        void malformedEmbeddingDegradesOnlyPairsThatUseIt() {
            EmbeddingClient client = new EmbeddingClient() {
                @Override
                public double[] embed(String text) {
                    return text.equals("broken") ? new double[] { Double.NaN, 1.0 } : new double[] { 1.0, 0.0 };
                }

                @Override
                public double sentiment(String text) {
                    return 0.0;
                }

                @Override
                public String getName() {
                    return "nan-for-broken";
                }
            };
            EvolutionEngine engine = EvolutionEngine.builder()
                    .config(EvolutionConfig.builder()
                            .weights(ScoringWeights.equal(ScoringMethod.TEMPORAL, ScoringMethod.SEMANTIC))
                            .minScore(0.0)
                            .build())
                    .embeddingClient(client)
                    .build();

            EvolutionResult result = engine.run(List.of(
                    TestEvents.described("a", "2008-09-12", EventType.LIQUIDITY_WARNING, "funding stress", null, null),
                    TestEvents.described("b", "2008-09-13", EventType.CREDIT_DOWNGRADE, "rating cut", null, null),
                    TestEvents.described("c", "2008-09-15", EventType.BANKRUPTCY, "broken", null, null)),
                    List.of());

            RunSummary summary = result.getSummary();
            assertEquals(0, summary.getChunksFailed());
            assertEquals(0, summary.getPairsSkippedDueToFailure());
            assertEquals(3, summary.getPairsScored());
            assertEquals(List.of("a->b", "a->c", "b->c"), result.getLinks().stream()
                    .map(l -> l.getFromEventId() + "->" + l.getToEventId())
                    .collect(Collectors.toList()));

            EvolutionLink clean = result.getLinks().get(0);
            assertFalse(clean.isDegraded());
            assertEquals(1.0, clean.getComponentScore(ScoringMethod.SEMANTIC), EPS);
            assertTrue(result.getLinks().get(1).isDegraded());
            assertTrue(result.getLinks().get(2).isDegraded());
            assertEquals(2, summary.getDegradedLinks());
        }

        @Test
        void reasoningStrategySuppliesExplanation() {
            ReasoningClient client = new ReasoningClient() {
                @Override
                public CausalAssessment assessCausality(EventType fromType, EventType toType, String fromText,
                        String toText) {
                    return new CausalAssessment(0.8, "Funding run preceded the filing", false);
                }

                @Override
                public String getName() {
                    return "fixed";
                }
            };
            EvolutionEngine engine = EvolutionEngine.builder()
                    .config(EvolutionConfig.builder()
                            .weights(ScoringWeights.equal(ScoringMethod.CAUSALITY))
                            .causalityMode(EvolutionConfig.CausalityMode.REASONING)
                            .build())
                    .reasoningClient(client)
                    .build();
            assertTrue(engine.getCausalityStrategy() instanceof ReasoningCausalityStrategy);

            EvolutionResult result = engine.run(List.of(
                    event("a", "2008-09-12", EventType.LIQUIDITY_WARNING),
                    event("b", "2008-09-15", EventType.BANKRUPTCY)), List.of());

            assertEquals(1, result.getLinks().size());
            assertEquals(0.8, result.getLinks().get(0).getCompositeScore(), EPS);
            assertEquals("Funding run preceded the filing", result.getLinks().get(0).getExplanation());
        }

        @Test
        void missingEmbeddingsDegradeButDoNotFailTheRun() {
            EvolutionResult result = engine(EvolutionConfig.builder().minScore(0.0).build()).run(List.of(
                    event("a", "2008-09-12", EventType.LIQUIDITY_WARNING, "ent_lehman"),
                    event("b", "2008-09-15", EventType.BANKRUPTCY, "ent_lehman")), List.of());
            assertEquals(1, result.getLinks().size());
            assertTrue(result.getLinks().get(0).isDegraded());
            assertEquals(1, result.getSummary().getDegradedLinks());
            // no categories on either side: topic is skipped
            assertNull(result.getLinks().get(0).getComponentScore(ScoringMethod.TOPIC));
        }
    }

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        private final List<Event> events = TestEvents.random(180, 200, 42L);

        @Test
        void outputDoesNotDependOnWorkerCount() {
            EvolutionConfig base = EvolutionConfig.builder().maxWindowDays(20).minScore(0.3).chunkSize(7).build();
            EvolutionResult single = engine(base.toBuilder().workerPoolSize(1).build()).run(events, List.of());
            EvolutionResult parallel = engine(base.toBuilder().workerPoolSize(8).build()).run(events, List.of());

            assertFalse(single.getLinks().isEmpty());
            assertEquals(single.getLinks(), parallel.getLinks());
            assertEquals(single.getSummary().getPairsScored(), parallel.getSummary().getPairsScored());
        }

        @Test
        void linksRespectDirectionBoundsAndWindow() {
            EvolutionConfig config = EvolutionConfig.builder().maxWindowDays(15).minScore(0.0).build();
            EvolutionResult result = engine(config).run(events, List.of());

            for (EvolutionLink link : result.getLinks()) {
                assertNotEquals(link.getFromEventId(), link.getToEventId());
                assertFalse(link.getFromDate().isAfter(link.getToDate()));
                if (link.getFromDate().equals(link.getToDate()))
                    assertTrue(link.getFromEventId().compareTo(link.getToEventId()) < 0);
                assertTrue(ChronoUnit.DAYS.between(link.getFromDate(), link.getToDate()) <= 15);
                assertTrue(link.getCompositeScore() >= 0.0 && link.getCompositeScore() <= 1.0);
                link.getComponentScores().values().forEach(s -> assertTrue(s >= 0.0 && s <= 1.0));
            }
            // minScore 0 keeps every candidate pair
            assertEquals(result.getSummary().getPairsConsidered(), result.getLinks().size());
        }

        @Test
        void raisingMinScoreOnlyRemovesLinks() {
            EvolutionConfig low = EvolutionConfig.builder().maxWindowDays(30).minScore(0.3).build();
            EvolutionConfig high = low.toBuilder().minScore(0.45).build();
            List<EvolutionLink> lowLinks = engine(low).run(events, List.of()).getLinks();
            List<EvolutionLink> highLinks = engine(high).run(events, List.of()).getLinks();

            assertTrue(lowLinks.containsAll(highLinks));
            assertTrue(highLinks.size() <= lowLinks.size());
        }

        @Test
        void shrinkingTheWindowOnlyRemovesLinks() {
            EvolutionConfig wide = EvolutionConfig.builder().maxWindowDays(60).minScore(0.3).build();
            EvolutionConfig narrow = wide.toBuilder().maxWindowDays(10).build();
            List<EvolutionLink> wideLinks = engine(wide).run(events, List.of()).getLinks();
            List<EvolutionLink> narrowLinks = engine(narrow).run(events, List.of()).getLinks();

            assertTrue(wideLinks.containsAll(narrowLinks));
            assertTrue(pairKeys(wideLinks).containsAll(pairKeys(narrowLinks)));
        }

        @Test
        void linksAreSortedByFromDateThenIds() {
            List<EvolutionLink> links = engine(EvolutionConfig.builder().maxWindowDays(30).minScore(0.3).build())
                    .run(events, List.of()).getLinks();
            List<EvolutionLink> sorted = new ArrayList<>(links);
            sorted.sort(EvolutionEngine.LINK_ORDER);
            assertEquals(sorted, links);
        }
    }

    @Nested
    @DisplayName("Pruning and resource guards")
    class Pruning {

        /**
         * Counts invocations and records the widest day gap it was asked to score.
         */
        class CountingScorer implements ComponentScorer {
            final AtomicInteger calls = new AtomicInteger();
            final AtomicLong maxGap = new AtomicLong();

            @Override
            public ScoringMethod method() {
                return ScoringMethod.TEMPORAL;
            }

            @Override
            public Optional<ComponentScore> score(Event from, Event to, ScoringContext context) {
                calls.incrementAndGet();
                maxGap.accumulateAndGet(ChronoUnit.DAYS.between(from.getDate(), to.getDate()), Math::max);
                return Optional.of(ComponentScore.of(method(), 0.5));
            }
        }

        private EvolutionEngine countingEngine(CountingScorer scorer, EvolutionConfig config) {
            return EvolutionEngine.builder()
                    .config(config.toBuilder().weights(ScoringWeights.equal(ScoringMethod.TEMPORAL)).build())
                    .scorers(List.of(scorer))
                    .build();
        }

        @Test
        void scorersNeverSeePairsOutsideTheWindow() {
            List<Event> events = TestEvents.random(300, 400, 9L);
            CountingScorer scorer = new CountingScorer();
            EvolutionResult result = countingEngine(scorer, EvolutionConfig.builder().maxWindowDays(14).build())
                    .run(events, List.of());

            long expected = new PairEnumerator(events, 14).countCandidatePairs();
            assertEquals(expected, scorer.calls.get());
            assertEquals(expected, result.getSummary().getPairsScored());
            assertTrue(scorer.maxGap.get() <= 14);
            assertTrue(expected < (long) events.size() * (events.size() - 1) / 2);
        }

        @Test
        void candidateBudgetIsCheckedBeforeScoring() {
            CountingScorer scorer = new CountingScorer();
            EvolutionEngine engine = countingEngine(scorer, EvolutionConfig.builder().maxCandidatePairs(2).build());
            List<Event> events = List.of(
                    event("a", "2008-09-15", EventType.BANKRUPTCY),
                    event("b", "2008-09-15", EventType.CONTAGION),
                    event("c", "2008-09-15", EventType.TRADING_HALT));

            PairBudgetExceededException e = assertThrows(PairBudgetExceededException.class,
                    () -> engine.run(events, List.of()));
            assertEquals(3, e.getCandidatePairs());
            assertEquals(0, scorer.calls.get());
        }

        @Test
        void invalidEventsAreExcludedAndCounted() {
            CountingScorer scorer = new CountingScorer();
            EvolutionResult result = countingEngine(scorer, EvolutionConfig.builder().build()).run(List.of(
                    event("a", "2008-09-12", EventType.LIQUIDITY_WARNING),
                    Event.builder().id("b").type(EventType.BANKRUPTCY).build(),
                    event("c", "2008-09-15", EventType.BANKRUPTCY)), List.of());

            assertEquals(1, result.getSummary().getEventsExcluded());
            assertEquals(2, result.getSummary().getEventsConsidered());
            assertEquals(1, scorer.calls.get());
        }

        @Test
        void embeddingsFetchedOnlyForParticipatingEvents() {
            AtomicInteger embedCalls = new AtomicInteger();
            EmbeddingClient client = new EmbeddingClient() {
                @Override
                public double[] embed(String text) {
                    embedCalls.incrementAndGet();
                    return new double[] { 1.0, 0.0 };
                }

                @Override
                public double sentiment(String text) {
                    return 0.0;
                }

                @Override
                public String getName() {
                    return "unit vectors";
                }
            };
            EvolutionEngine engine = EvolutionEngine.builder()
                    .config(EvolutionConfig.builder()
                            .weights(ScoringWeights.equal(ScoringMethod.SEMANTIC))
                            .maxWindowDays(5)
                            .build())
                    .embeddingClient(client)
                    .build();

            EvolutionResult result = engine.run(List.of(
                    event("a", "2008-09-12", EventType.LIQUIDITY_WARNING),
                    event("b", "2008-09-15", EventType.BANKRUPTCY),
                    event("c", "2008-12-01", EventType.GOVERNMENT_INTERVENTION)), List.of());

            assertEquals(2, embedCalls.get());
            assertEquals(1, result.getLinks().size());
            assertEquals(1.0, result.getLinks().get(0).getCompositeScore(), EPS);
            assertFalse(result.getLinks().get(0).isDegraded());
        }

        @Test
        void failingChunksAreReportedInTheSummary() {
            ComponentScorer flaky = new ComponentScorer() {
                @Override
                public ScoringMethod method() {
                    return ScoringMethod.TEMPORAL;
                }

                @Override
                public Optional<ComponentScore> score(Event from, Event to, ScoringContext context) {
                    if (from.getId().equals("e1"))
                        throw new IllegalStateException("scorer bug");
                    return Optional.of(ComponentScore.of(method(), 1.0));
                }
            };
            List<Event> events = new ArrayList<>();
            for (int i = 0; i < 5; i++)
                events.add(Event.builder().id("e" + i).date(LocalDate.of(2008, 9, 15)).type(EventType.CONTAGION).build());

            EvolutionResult result = EvolutionEngine.builder()
                    .config(EvolutionConfig.builder()
                            .weights(ScoringWeights.equal(ScoringMethod.TEMPORAL))
                            .chunkSize(1)
                            .build())
                    .scorers(List.of(flaky))
                    .build()
                    .run(events, List.of());

            RunSummary summary = result.getSummary();
            assertEquals(10, summary.getPairsConsidered());
            assertEquals(3, summary.getPairsSkippedDueToFailure());
            assertEquals(7, summary.getPairsScored());
            assertEquals(1, summary.getChunksFailed());
            assertEquals(7, summary.getLinksMaterialized());
        }
    }

    @Test
    void defaultScorersCoverEveryMethod() {
        assertEquals(ScoringMethod.values().length,
                PairScorer.defaultScorers().stream().map(ComponentScorer::method).distinct().count());
    }
}
