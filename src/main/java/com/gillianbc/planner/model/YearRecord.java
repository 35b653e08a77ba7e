package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.Value;

/**
 * One simulated year of one path. Cash-flow fields are nominal and are zero during accumulation.
 */
@Value
@Builder
public class YearRecord {

    public enum Phase {
        ACCUMULATION,
        RETIREMENT
    }

    int index;
    int age;
    Phase phase;
    double nominalBalance;
    double realBalance;
    double grossWithdrawal;
    double netWithdrawal;
    double totalTax;
    double rmd;
    double socialSecurity;
    double healthcareCost;
    double rothConversion;
    boolean ruined;
}
