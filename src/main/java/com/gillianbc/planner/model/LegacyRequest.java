package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Input of one deterministic legacy depletion run. All money is in real (today's) dollars.
 */
@Value
@Builder(toBuilder = true)
public class LegacyRequest {

    double fundReal;
    // real growth rate of the fund, as a fraction
    double realReturn;
    double perBeneficiaryPayout;
    @NonNull
    @Singular
    List<BeneficiaryCohort> cohorts;
    @Builder.Default
    double fertilityRate = 2.1;
    @Builder.Default
    int generationLength = 30;
    @Builder.Default
    int deathAge = 90;
    @Builder.Default
    int minDistributionAge = 21;
    @Builder.Default
    int fertilityWindowStart = 20;
    @Builder.Default
    int fertilityWindowEnd = 45;
    @Builder.Default
    int capYears = 10_000;

    // used only for the nominal estate figures of generation snapshots
    @Builder.Default
    double inflationPct = 2.6;
    // years from today until the fund starts paying out
    int yearsUntilStart;
    // calendar year the fund starts paying out, for estate tax exemption indexing
    @Builder.Default
    int startYear = 2026;
    @NonNull
    @Builder.Default
    FilingStatus filingStatus = FilingStatus.SINGLE;
    @Builder.Default
    boolean estateExemptionSunset = false;

    public double startingBeneficiaries() {
        return cohorts.stream().mapToDouble(BeneficiaryCohort::getSize).sum();
    }
}
