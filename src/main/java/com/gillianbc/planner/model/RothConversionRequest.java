package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RothConversionRequest {
    int retirementAge;
    double pretaxBalance;
    @NonNull
    @Builder.Default
    FilingStatus filingStatus = FilingStatus.SINGLE;
    // annual Social Security income
    double socialSecurityIncome;
    double annualWithdrawal;
    @Builder.Default
    double targetBracketRate = 0.24;
    // fraction, for example 0.07
    @Builder.Default
    double growthRate = 0.07;
    @Builder.Default
    int lifeExpectancy = SimulationInputs.DEFAULT_LIFE_EXPECTANCY;
}
