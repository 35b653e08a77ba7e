package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Multi-generation view of an estate: the median outcome in full plus the 10th and 90th
 * percentile estates, and the share of all simulated paths whose estate would last forever.
 */
@Value
@Builder
public class GenerationalPayout {

    @Value
    @Builder
    public static class Variant {
        int percentile;
        double netEstateReal;
        // real growth rate back-solved from the batch, as a fraction
        double impliedRealReturn;
        int years;
        boolean perpetual;
        double fundLeftReal;
        @NonNull
        @Singular
        List<GenerationSnapshot> generations;
    }

    double perBeneficiaryPayout;
    int years;
    boolean perpetual;
    double remainingFund;
    double beneficiaryCount;
    double livingBeneficiaries;
    @NonNull
    @Singular
    List<BeneficiaryCohort> cohorts;
    @NonNull
    @Singular
    List<GenerationSnapshot> generations;
    @NonNull
    Variant p10;
    @NonNull
    Variant p50;
    @NonNull
    Variant p90;
    double probabilityOfPerpetuity;
}
