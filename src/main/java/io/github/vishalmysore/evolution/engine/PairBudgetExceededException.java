package io.github.vishalmysore.evolution.engine;

import io.github.vishalmysore.evolution.config.EvolutionConfigurationException;

/**
 * The candidate pair count for the configured window exceeds the configured
 * budget. Raised before any scoring; shrink the window or raise the budget.
 */
public class PairBudgetExceededException extends EvolutionConfigurationException {

    private final long candidatePairs;
    private final long budget;

    public PairBudgetExceededException(long candidatePairs, long budget, int maxWindowDays) {
        super("Candidate pairs " + candidatePairs + " exceed budget " + budget
                + " for maxWindowDays=" + maxWindowDays + "; use a smaller window or raise maxCandidatePairs");
        this.candidatePairs = candidatePairs;
        this.budget = budget;
    }

    public long getCandidatePairs() {
        return candidatePairs;
    }

    public long getBudget() {
        return budget;
    }
}
