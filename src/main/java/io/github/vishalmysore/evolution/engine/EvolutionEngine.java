package io.github.vishalmysore.evolution.engine;

import io.github.vishalmysore.evolution.config.EvolutionConfig;
import io.github.vishalmysore.evolution.domain.Entity;
import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.EvolutionLink;
import io.github.vishalmysore.evolution.domain.RunSummary;
import io.github.vishalmysore.evolution.domain.ScoringMethod;
import io.github.vishalmysore.evolution.embedding.EmbeddingCache;
import io.github.vishalmysore.evolution.embedding.EmbeddingClient;
import io.github.vishalmysore.evolution.embedding.OpenAiEmbeddingClient;
import io.github.vishalmysore.evolution.scoring.ComponentScorer;
import io.github.vishalmysore.evolution.scoring.PairScorer;
import io.github.vishalmysore.evolution.scoring.ScoringContext;
import io.github.vishalmysore.evolution.scoring.causality.CausalityStrategy;
import io.github.vishalmysore.evolution.scoring.causality.LookupCausalityStrategy;
import io.github.vishalmysore.evolution.scoring.causality.OpenAiReasoningClient;
import io.github.vishalmysore.evolution.scoring.causality.ReasoningCausalityStrategy;
import io.github.vishalmysore.evolution.scoring.causality.ReasoningClient;
import io.github.vishalmysore.evolution.similarity.JaccardSimilarityProvider;
import io.github.vishalmysore.evolution.similarity.SimilarityProvider;
import io.github.vishalmysore.evolution.tables.CausalityTable;
import io.github.vishalmysore.evolution.tables.LookupTableLoader;
import io.github.vishalmysore.evolution.tables.TopicSimilarityTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Computes evolution links for a set of events.
 *
 * A run validates the events, sorts them by date, counts in-window candidate
 * pairs (refusing to start above {@code maxCandidatePairs}), fetches every
 * needed embedding and sentiment in one single-threaded pass, then scores the
 * candidate chunks in parallel and keeps the pairs that clear {@code minScore}.
 * Tables, cache and configuration are read-only while workers run.
 */
public class EvolutionEngine {
    private static final Logger log = Logger.getLogger(EvolutionEngine.class.getName());

    static final Comparator<EvolutionLink> LINK_ORDER = Comparator
            .comparing(EvolutionLink::getFromDate)
            .thenComparing(EvolutionLink::getFromEventId)
            .thenComparing(EvolutionLink::getToDate)
            .thenComparing(EvolutionLink::getToEventId);

    private final EvolutionConfig config;
    private final List<ComponentScorer> scorers;
    private final CausalityTable causalityTable;
    private final TopicSimilarityTable topicTable;
    private final EmbeddingClient embeddingClient;
    private final CausalityStrategy causalityStrategy;
    private final SimilarityProvider lexicalFallback;
    private final EventValidator validator = new EventValidator();

    private EvolutionEngine(Builder b) {
        this.config = b.config.validate();
        this.scorers = Collections.unmodifiableList(new ArrayList<>(
                b.scorers != null ? b.scorers : PairScorer.defaultScorers()));

        LookupTableLoader loader = new LookupTableLoader();
        this.causalityTable = b.causalityTable != null
                ? b.causalityTable
                : loader.loadCausalityTable(config.getCausalityTable());
        this.topicTable = b.topicTable != null
                ? b.topicTable
                : loader.loadTopicSimilarityTable(config.getTopicSimilarityTable());

        this.embeddingClient = b.embeddingClient;
        this.lexicalFallback = b.lexicalFallback != null ? b.lexicalFallback : new JaccardSimilarityProvider();
        this.causalityStrategy = resolveCausalityStrategy(b.reasoningClient);

        log.info("EvolutionEngine initialized: causality=" + causalityStrategy.getName()
                + ", embeddings=" + (embeddingClient != null ? embeddingClient.getName() : "none")
                + ", lexical fallback=" + lexicalFallback.getName());
    }

    private CausalityStrategy resolveCausalityStrategy(ReasoningClient reasoningClient) {
        LookupCausalityStrategy lookup = new LookupCausalityStrategy(causalityTable);
        if (config.getCausalityMode() != EvolutionConfig.CausalityMode.REASONING)
            return lookup;
        if (reasoningClient == null) {
            log.warning("Reasoning causality requested but no reasoning client configured; using table lookup");
            return lookup;
        }
        return new ReasoningCausalityStrategy(reasoningClient, lookup, config.getEmbeddingFailureLimit());
    }

    public EvolutionResult run(Collection<Event> events, Collection<Entity> entities) {
        return run(events, entities, new RunControl());
    }

    public EvolutionResult run(Collection<Event> events, Collection<Entity> entities, RunControl control) {
        long start = System.currentTimeMillis();
        List<Entity> entityList = entities != null ? List.copyOf(entities) : List.of();

        EventValidator.Result validation = validator.validate(events, entityList);
        PairEnumerator enumerator = new PairEnumerator(validation.getValidEvents(), config.getMaxWindowDays());

        long candidatePairs = enumerator.countCandidatePairs();
        log.info("Computing evolution scores for " + enumerator.getSortedEvents().size() + " events ("
                + candidatePairs + " pairs within " + config.getMaxWindowDays() + " days)");
        if (candidatePairs > config.getMaxCandidatePairs())
            throw new PairBudgetExceededException(candidatePairs, config.getMaxCandidatePairs(),
                    config.getMaxWindowDays());

        EmbeddingCache cache = populateCache(enumerator);
        ScoringContext context = ScoringContext.builder()
                .config(config)
                .causalityTable(causalityTable)
                .topicTable(topicTable)
                .embeddingCache(cache)
                .lexicalFallback(lexicalFallback)
                .causalityStrategy(causalityStrategy)
                .build();

        PairScorer pairScorer = new PairScorer(scorers, context);
        LinkMaterializer materializer = new LinkMaterializer(config.getMinScore(), config.getMaxWindowDays());
        List<PairChunk> chunks = enumerator.plan(config.getChunkSize());

        int workers = config.effectiveWorkerCount();
        ParallelPairScheduler scheduler = new ParallelPairScheduler(workers, config.getTimeoutMs());
        log.info("Scoring " + chunks.size() + " chunks on " + workers + " workers");
        ParallelPairScheduler.Outcome outcome = scheduler.run(enumerator, chunks, pairScorer, materializer, control);

        List<EvolutionLink> links = new ArrayList<>(outcome.getLinks());
        links.sort(LINK_ORDER);
        long degraded = links.stream().filter(EvolutionLink::isDegraded).count();

        RunSummary summary = RunSummary.builder()
                .eventsConsidered(enumerator.getSortedEvents().size())
                .eventsExcluded(validation.getExcluded())
                .pairsConsidered(candidatePairs)
                .pairsScored(outcome.getPairsScored())
                .pairsSkippedDueToFailure(outcome.getPairsSkipped())
                .pairsNotDispatched(outcome.getPairsNotDispatched())
                .chunksTotal(chunks.size())
                .chunksFailed(outcome.getChunksFailed())
                .linksMaterialized(links.size())
                .degradedLinks(degraded)
                .workerCount(workers)
                .cancelled(outcome.isCancelled())
                .timedOut(outcome.isTimedOut())
                .durationMs(System.currentTimeMillis() - start)
                .build();

        log.info("Created " + links.size() + " evolution links (min_score=" + config.getMinScore() + "): "
                + summary.getPairsScored() + " scored, " + summary.getPairsSkippedDueToFailure() + " skipped, "
                + summary.getPairsNotDispatched() + " not dispatched, " + degraded + " degraded, "
                + summary.getDurationMs() + " ms");
        return new EvolutionResult(Collections.unmodifiableList(links), summary,
                enumerator.getSortedEvents(), entityList);
    }

    private EmbeddingCache populateCache(PairEnumerator enumerator) {
        boolean needEmbeddings = config.getWeights().isEnabled(ScoringMethod.SEMANTIC);
        boolean needSentiments = config.getWeights().isEnabled(ScoringMethod.EMOTIONAL);
        if (embeddingClient == null || (!needEmbeddings && !needSentiments))
            return EmbeddingCache.empty();
        return EmbeddingCache.populate(enumerator.participatingEvents(), embeddingClient,
                needEmbeddings, needSentiments, config.getEmbeddingFailureLimit());
    }

    public EvolutionConfig getConfig() {
        return config;
    }

    public CausalityStrategy getCausalityStrategy() {
        return causalityStrategy;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Engine wired from configuration alone: tables from the configured
     * locations and, when an API key is set, the OpenAI-compatible embedding
     * and reasoning clients.
     */
    public static EvolutionEngine fromConfig(EvolutionConfig config) {
        Builder builder = builder().config(config);
        if (config.hasEmbeddingCredentials()) {
            builder.embeddingClient(new OpenAiEmbeddingClient(config.getEmbeddingApiKey(),
                    config.getEmbeddingBaseUrl(), config.getEmbeddingModel(), config.getReasoningModel()));
            if (config.getReasoningModel() != null)
                builder.reasoningClient(new OpenAiReasoningClient(config.getEmbeddingApiKey(),
                        config.getEmbeddingBaseUrl(), config.getReasoningModel()));
        }
        return builder.build();
    }

    public static final class Builder {
        private EvolutionConfig config = EvolutionConfig.builder().build();
        private List<ComponentScorer> scorers;
        private CausalityTable causalityTable;
        private TopicSimilarityTable topicTable;
        private EmbeddingClient embeddingClient;
        private ReasoningClient reasoningClient;
        private SimilarityProvider lexicalFallback;

        public Builder config(EvolutionConfig config) {
            this.config = config;
            return this;
        }

        public Builder scorers(List<ComponentScorer> scorers) {
            this.scorers = scorers;
            return this;
        }

        public Builder causalityTable(CausalityTable causalityTable) {
            this.causalityTable = causalityTable;
            return this;
        }

        public Builder topicTable(TopicSimilarityTable topicTable) {
            this.topicTable = topicTable;
            return this;
        }

        public Builder embeddingClient(EmbeddingClient embeddingClient) {
            this.embeddingClient = embeddingClient;
            return this;
        }

        public Builder reasoningClient(ReasoningClient reasoningClient) {
            this.reasoningClient = reasoningClient;
            return this;
        }

        public Builder lexicalFallback(SimilarityProvider lexicalFallback) {
            this.lexicalFallback = lexicalFallback;
            return this;
        }

        public EvolutionEngine build() {
            return new EvolutionEngine(this);
        }
    }
}
