package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.Value;

/**
 * What a full calculation should run besides the core batch.
 */
@Value
@Builder
public class CalculationOptions {

    public static final long DEFAULT_SEED = 12345L;

    @Builder.Default
    long baseSeed = DEFAULT_SEED;
    // zero means the configured default
    int paths;
    // generational analysis runs only when present
    GenerationalRequest generational;
    @Builder.Default
    boolean runGuardrails = true;
    @Builder.Default
    boolean runRothOptimizer = true;
    // revert the estate tax exemption to the lower sunset level
    @Builder.Default
    boolean estateExemptionSunset = false;
    // calendar year of "today", for estate tax exemption indexing
    @Builder.Default
    int currentYear = 2026;

    public static CalculationOptions defaults() {
        return CalculationOptions.builder().build();
    }
}
