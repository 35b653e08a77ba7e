package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Describes the heirs of an estate and the real amount each should receive per year.
 */
@Value
@Builder(toBuilder = true)
public class GenerationalRequest {

    @NonNull
    @Singular
    List<Integer> beneficiaryAges;
    // defaults to one beneficiary per listed age when zero
    double beneficiaryCount;
    double perBeneficiaryPayout;
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
}
