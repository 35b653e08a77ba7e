package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.Value;

/**
 * Healthcare and long-term-care cost assumptions. Dollar amounts are in today's money and
 * grow with medicalInflationPct.
 */
@Value
@Builder
public class HealthcareAssumptions {

    @Builder.Default
    boolean includeMedicare = false;
    // per person, per month
    @Builder.Default
    double medicarePremium = 400;
    @Builder.Default
    double medicalInflationPct = 5.0;

    @Builder.Default
    boolean includeLongTermCare = false;
    @Builder.Default
    double ltcAnnualCost = 80_000;
    // chance (0..100) that a path needs care at all
    @Builder.Default
    double ltcProbabilityPct = 50;
    @Builder.Default
    double ltcDurationYears = 2.5;
    @Builder.Default
    int ltcOnsetStartAge = 75;
    @Builder.Default
    int ltcOnsetEndAge = 90;

    /** Employer or marketplace premiums for anyone under Medicare age. */
    @Builder.Default
    boolean includePreMedicare = false;

    public static HealthcareAssumptions none() {
        return HealthcareAssumptions.builder().build();
    }
}
