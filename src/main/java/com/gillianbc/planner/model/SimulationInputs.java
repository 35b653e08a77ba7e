package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything one projection needs, captured once per invocation.
 * <p>
 * Percentages are expressed as whole numbers (9.8 means 9.8%). Balances and incomes are in
 * today's dollars. Spouse fields are ignored for single filers.
 */
@Value
@Builder(toBuilder = true)
public class SimulationInputs {

    public static final int DEFAULT_LIFE_EXPECTANCY = 95;

    int primaryAge;
    int spouseAge;
    @NonNull
    @Builder.Default
    FilingStatus filingStatus = FilingStatus.SINGLE;
    int retirementAge;

    @NonNull
    @Builder.Default
    EmploymentType primaryEmployment = EmploymentType.W2;
    @NonNull
    @Builder.Default
    EmploymentType spouseEmployment = EmploymentType.W2;
    double primaryIncome;
    double spouseIncome;

    double taxableBalance;
    double pretaxBalance;
    double rothBalance;
    double emergencyFund;

    @NonNull
    @Builder.Default
    Contributions primaryContributions = Contributions.NONE;
    @NonNull
    @Builder.Default
    Contributions spouseContributions = Contributions.NONE;

    @Builder.Default
    double expectedReturnPct = 9.8;
    @Builder.Default
    double inflationPct = 2.6;
    @Builder.Default
    double stateTaxPct = 0;
    @Builder.Default
    double withdrawalRatePct = 3.5;
    @Builder.Default
    double incomeGrowthPct = 4.5;
    @Builder.Default
    boolean escalateContributions = true;
    // annual dividend/interest yield of the taxable account, taxed every year
    @Builder.Default
    double dividendYieldPct = 2.0;

    @NonNull
    @Builder.Default
    ReturnMode returnMode = ReturnMode.SEEDED_RANDOM;
    @NonNull
    @Builder.Default
    WalkSeries walkSeries = WalkSeries.NOMINAL;
    // first replayed year in HISTORICAL mode
    Integer historicalStartYear;
    InflationShock inflationShock;

    @NonNull
    @Builder.Default
    SocialSecurityElection primarySocialSecurity = SocialSecurityElection.NONE;
    @NonNull
    @Builder.Default
    SocialSecurityElection spouseSocialSecurity = SocialSecurityElection.NONE;

    @NonNull
    @Builder.Default
    HealthcareAssumptions healthcare = HealthcareAssumptions.none();
    BondGlidePath bondGlidePath;
    RothConversionPolicy rothConversionPolicy;

    @Builder.Default
    int lifeExpectancy = DEFAULT_LIFE_EXPECTANCY;

    public boolean isMarried() {
        return filingStatus.isMarried();
    }

    public int youngerAge() {
        return isMarried() ? Math.min(primaryAge, spouseAge) : primaryAge;
    }

    public int olderAge() {
        return isMarried() ? Math.max(primaryAge, spouseAge) : primaryAge;
    }

    /** Years until the younger spouse reaches the retirement age. */
    public int yearsToRetirement() {
        return retirementAge - youngerAge();
    }

    /** Retirement years simulated, until the older spouse reaches life expectancy. */
    public int yearsInRetirement() {
        return Math.max(0, lifeExpectancy - (olderAge() + yearsToRetirement()));
    }

    /** Number of yearly balances a path produces, year 0 included. */
    public int horizon() {
        return yearsToRetirement() + yearsInRetirement() + 1;
    }

    public double startingPortfolio() {
        return taxableBalance + pretaxBalance + rothBalance;
    }
}
