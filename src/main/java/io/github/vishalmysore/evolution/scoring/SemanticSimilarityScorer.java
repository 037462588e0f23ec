package io.github.vishalmysore.evolution.scoring;

import io.github.vishalmysore.evolution.domain.Event;
import io.github.vishalmysore.evolution.domain.ScoringMethod;
import io.github.vishalmysore.evolution.embedding.EmbeddingCache;
import io.github.vishalmysore.evolution.similarity.VectorSimilarity;

import java.util.Optional;

/**
 * Cosine similarity of the cached description embeddings, rescaled to [0,1].
 *
 * When either event has no usable embedding the context's lexical provider
 * (Jaccard over description tokens by default) answers instead and the score
 * is marked degraded. Never calls the embedding collaborator itself.
 */
public class SemanticSimilarityScorer implements ComponentScorer {

    @Override
    public ScoringMethod method() {
        return ScoringMethod.SEMANTIC;
    }

    @Override
    public Optional<ComponentScore> score(Event from, Event to, ScoringContext context) {
        EmbeddingCache cache = context.getEmbeddingCache();
        double[] embA = cache.embedding(from.getId());
        double[] embB = cache.embedding(to.getId());

        if (embA != null && embB != null && embA.length == embB.length) {
            double cosine = VectorSimilarity.normalizedCosine(embA, embB);
            if (Double.isFinite(cosine))
                return Optional.of(ComponentScore.of(method(), cosine));
        }

        double lexical = context.getLexicalFallback()
                .computeSimilarity(from.descriptionOrEmpty(), to.descriptionOrEmpty());
        return Optional.of(ComponentScore.fallback(method(), Math.max(0.0, Math.min(1.0, lexical))));
    }
}
