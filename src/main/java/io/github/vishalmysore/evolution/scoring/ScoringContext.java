package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.config.EvolutionConfig;
import io.github.vishalmysore.evolution.embedding.EmbeddingCache;
import io.github.vishalmysore.evolution.scoring.causality.CausalityStrategy;
import io.github.vishalmysore.evolution.scoring.causality.LookupCausalityStrategy;
import io.github.vishalmysore.evolution.similarity.JaccardSimilarityProvider;
import io.github.vishalmysore.evolution.similarity.SimilarityProvider;
import io.github.vishalmysore.evolution.tables.CausalityTable;
import io.github.vishalmysore.evolution.tables.TopicSimilarityTable;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a scorer may read: configuration, lookup tables, the embedding
 * cache and the pluggable strategies. Built once before scoring and shared by
 * all workers without locking. Unset parts fall back to empty tables, an
 * empty cache, Jaccard lexical similarity and a lookup causality strategy.
 */
@Value
public class ScoringContext {
    EvolutionConfig config;
    CausalityTable causalityTable;
    TopicSimilarityTable topicTable;
    EmbeddingCache embeddingCache;
    SimilarityProvider lexicalFallback;
    CausalityStrategy causalityStrategy;

    @Builder
    private ScoringContext(EvolutionConfig config, CausalityTable causalityTable, TopicSimilarityTable topicTable,
            EmbeddingCache embeddingCache, SimilarityProvider lexicalFallback, CausalityStrategy causalityStrategy) {
        this.config = config != null ? config : EvolutionConfig.builder().build();
        this.causalityTable = causalityTable != null ? causalityTable : CausalityTable.empty();
        this.topicTable = topicTable != null ? topicTable : TopicSimilarityTable.empty();
        this.embeddingCache = embeddingCache != null ? embeddingCache : EmbeddingCache.empty();
        this.lexicalFallback = lexicalFallback != null ? lexicalFallback : new JaccardSimilarityProvider();
        this.causalityStrategy = causalityStrategy != null
                ? causalityStrategy
                : new LookupCausalityStrategy(this.causalityTable);
    }
}
