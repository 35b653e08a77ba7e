package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * How long a legacy fund sustained its payouts. When perpetual is set, years counts the years
 * actually simulated (zero when perpetuity was shown analytically) rather than a depletion date.
 */
@Value
@Builder
public class LegacyOutcome {
    int years;
    boolean perpetual;
    double fundLeftReal;
    double livingBeneficiaries;
    @NonNull
    @Singular
    List<GenerationSnapshot> generations;
}
