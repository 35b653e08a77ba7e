package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Everything a caller gets back from one full calculation.
 */
@Value
@Builder
public class CalculationResult {

    // formatted summary fields, e.g. "1,234,567.89"
    String balanceAtRetirement;
    String firstYearWithdrawal;
    String medianEndOfLifeWealth;
    String successRate;

    double balanceAtRetirementNominal;
    double balanceAtRetirementReal;
    double firstYearGrossWithdrawal;
    double firstYearAfterTaxReal;
    double endOfLifeNominal;
    double endOfLifeReal;
    double estateTax;
    double netEstate;
    double probRuin;

    @NonNull
    TaxBreakdown firstYearTaxes;
    // year-by-year series of the path simulated with the base seed
    @NonNull
    @Singular
    List<YearRecord> years;
    @NonNull
    BatchSummary batch;

    GenerationalPayout generationalPayout;
    // why a requested generational projection has no payout, for example a legacy timeout
    Throwable generationalFailure;
    GuardrailsResult guardrails;
    RothConversionResult rothConversion;

    public Optional<GenerationalPayout> generational() {
        return Optional.ofNullable(generationalPayout);
    }

    public Optional<Throwable> generationalError() {
        return Optional.ofNullable(generationalFailure);
    }

    public Optional<GuardrailsResult> guardrailsResult() {
        return Optional.ofNullable(guardrails);
    }

    public Optional<RothConversionResult> rothConversionResult() {
        return Optional.ofNullable(rothConversion);
    }
}
