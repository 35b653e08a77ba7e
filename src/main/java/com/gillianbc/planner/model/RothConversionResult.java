package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Comparison of lifetime tax with and without yearly Roth conversions before RMDs start.
 */
@Value
@Builder
public class RothConversionResult {

    @Value
    public static class Conversion {
        int age;
        double amount;
        double tax;
        double pretaxBalanceBefore;
    }

    @Value
    public static class RmdYear {
        int age;
        double rmd;
        double tax;
    }

    boolean recommended;
    // why there is no recommendation, null when there is one
    String reason;
    @Singular
    List<Conversion> conversions;
    int windowStartAge;
    int windowEndAge;
    double targetBracketRate;
    double targetBracketLimit;
    double totalConverted;
    double averageAnnualConversion;
    double baselineLifetimeTax;
    double optimizedLifetimeTax;
    double lifetimeTaxSavings;
    double rmdReduction;
    double rmdReductionPct;
    double effectiveRateImprovementPct;
    @Singular
    List<RmdYear> baselineRmds;
    @Singular
    List<RmdYear> optimizedRmds;

    public static RothConversionResult noRecommendation(String reason) {
        return RothConversionResult.builder().recommended(false).reason(reason).build();
    }
}
