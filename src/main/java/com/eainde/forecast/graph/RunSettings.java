package com.eainde.forecast.graph;

import java.time.Duration;

/**
 * Per-run limits.
 *
 * @param budget                wall-clock budget of one run
 * @param maxSynthesisRecoveries re-prompts allowed after unparseable model output
 * @param maxValidationRevisions returns to synthesis allowed after a failed validation
 */
public record RunSettings(Duration budget, int maxSynthesisRecoveries, int maxValidationRevisions) {

    public static final Duration DEFAULT_BUDGET = Duration.ofMinutes(5);

    public static RunSettings defaults() {
        return new RunSettings(DEFAULT_BUDGET, 2, 1);
    }

    public RunSettings withBudget(Duration newBudget) {
        return new RunSettings(newBudget, maxSynthesisRecoveries, maxValidationRevisions);
    }
}
