package com.gillianbc.planner.model;

import lombok.Value;

/**
 * Estimated effect of cutting spending when markets go badly.
 */
@Value
public class GuardrailsResult {
    double spendingReduction;
    int totalFailures;
    int preventableFailures;
    double baselineSuccessRate;
    double newSuccessRate;

    public double improvement() {
        return newSuccessRate - baselineSuccessRate;
    }
}
