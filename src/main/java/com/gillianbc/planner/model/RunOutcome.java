package com.gillianbc.planner.model;

import lombok.Value;

/**
 * Terminal outcome of one path, kept for every path of a batch.
 */
@Value
public class RunOutcome {
    double terminalReal;
    double firstYearAfterTaxReal;
    boolean ruined;
    int survivalYears;
}
