package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * The three legacy runs to perform for an estate, one per terminal-wealth percentile,
 * together with the figures that do not depend on running them.
 */
@Value
@Builder
public class LegacyPlan {
    @NonNull
    LegacyRequest p10;
    @NonNull
    LegacyRequest p50;
    @NonNull
    LegacyRequest p90;
    @NonNull
    @Singular
    List<BeneficiaryCohort> cohorts;
    double beneficiaryCount;
    double perBeneficiaryPayout;
    double probabilityOfPerpetuity;
}
