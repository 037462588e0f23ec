package io.github.vishalmysore.evolution.scoring.causality;

import io.github.vishalmysore.evolution.domain.EventType;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Causality judged by an external reasoning collaborator. This is the one
 * strategy that performs network I/O while pairs are being scored, so answers
 * are memoized per (types, texts) and shared across workers.
 *
 * A failed call answers from the lookup strategy and marks the assessment as
 * a fallback. After {@code failureLimit} consecutive failures the collaborator
 * is no longer called for the rest of the run.
 */
public class ReasoningCausalityStrategy implements CausalityStrategy {
    private static final Logger log = Logger.getLogger(ReasoningCausalityStrategy.class.getName());

    private final ReasoningClient client;
    private final LookupCausalityStrategy fallback;
    private final int failureLimit;
    private final ConcurrentHashMap<String, CausalAssessment> answers = new ConcurrentHashMap<>();
    private final AtomicInteger failureStreak = new AtomicInteger();

    public ReasoningCausalityStrategy(ReasoningClient client, LookupCausalityStrategy fallback, int failureLimit) {
        this.client = client;
        this.fallback = fallback;
        this.failureLimit = failureLimit;
    }

    @Override
    public CausalAssessment assess(EventType fromType, EventType toType, String fromText, String toText) {
        if (failureStreak.get() >= failureLimit)
            return asFallback(fromType, toType, fromText, toText);

        String key = fromType + "\u0001" + toType + "\u0001" + fromText + "\u0001" + toText;
        CausalAssessment cached = answers.get(key);
        if (cached != null)
            return cached;

        try {
            CausalAssessment answer = client.assessCausality(fromType, toType, fromText, toText);
            double clamped = Math.max(0.0, Math.min(1.0, answer.getScore()));
            CausalAssessment normalized = new CausalAssessment(clamped, answer.getExplanation(), false);
            failureStreak.set(0);
            answers.putIfAbsent(key, normalized);
            return answers.get(key);
        } catch (RuntimeException e) {
            int streak = failureStreak.incrementAndGet();
            log.warning("Causal reasoning failed for " + fromType + " -> " + toType + ": " + e.getMessage());
            if (streak == failureLimit)
                log.warning("Reasoning collaborator disabled after " + failureLimit + " consecutive failures");
            return asFallback(fromType, toType, fromText, toText);
        }
    }

    private CausalAssessment asFallback(EventType fromType, EventType toType, String fromText, String toText) {
        CausalAssessment lookup = fallback.assess(fromType, toType, fromText, toText);
        return new CausalAssessment(lookup.getScore(), null, true);
    }

    public int getCachedAnswers() {
        return answers.size();
    }

    @Override
    public String getName() {
        return "Reasoning (" + client.getName() + ", fallback " + fallback.getName() + ")";
    }
}
