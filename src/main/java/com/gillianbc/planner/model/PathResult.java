package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Full trajectory of a single simulated path.
 */
@Value
@Builder
public class PathResult {

    @NonNull
    @Singular
    List<YearRecord> years;
    long seed;
    double balanceAtRetirement;
    double pretaxAtRetirement;
    double firstYearGrossWithdrawal;
    @NonNull
    TaxBreakdown firstYearTaxes;
    double firstYearAfterTaxReal;
    double terminalNominal;
    double terminalReal;
    boolean ruined;
    // retirement years fully funded
    int survivalYears;
    double totalRothConversions;
    double rothConversionTaxes;

    public double realBalance(int index) {
        return years.get(index).getRealBalance();
    }

    public double nominalBalance(int index) {
        return years.get(index).getNominalBalance();
    }

    public RunOutcome toOutcome() {
        return new RunOutcome(terminalReal, firstYearAfterTaxReal, ruined, survivalYears);
    }
}
