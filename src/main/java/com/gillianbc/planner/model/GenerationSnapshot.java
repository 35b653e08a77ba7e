package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.Value;

/**
 * State of a legacy fund at a generation boundary, with the estate tax that a transfer at that
 * point would incur.
 */
@Value
@Builder
public class GenerationSnapshot {
    int generation;
    // years since the legacy fund started paying out
    int year;
    double nominalEstate;
    double estateTax;
    double netToHeirs;
    double realFund;
    double livingBeneficiaries;
}
