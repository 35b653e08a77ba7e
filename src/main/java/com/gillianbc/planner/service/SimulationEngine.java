package com.gillianbc.planner.service;

import com.gillianbc.planner.exception.ValidationException;
import com.gillianbc.planner.model.BondGlidePath;
import com.gillianbc.planner.model.Contributions;
import com.gillianbc.planner.model.EmploymentType;
import com.gillianbc.planner.model.FilingStatus;
import com.gillianbc.planner.model.HealthcareAssumptions;
import com.gillianbc.planner.model.InflationShock;
import com.gillianbc.planner.model.PathResult;
import com.gillianbc.planner.model.ReturnMode;
import com.gillianbc.planner.model.SimulationInputs;
import com.gillianbc.planner.model.SocialSecurityElection;
import com.gillianbc.planner.model.WalkSeries;
import com.gillianbc.planner.model.WithdrawalTaxes;
import com.gillianbc.planner.model.YearRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Runs one accumulation and decumulation path for a household.
 * <p>
 * Accumulation runs from today (year 0) until the younger spouse reaches the retirement age.
 * Each later year is a retirement year: Social Security and RMDs are worked out, healthcare costs
 * are added to spending, the year's withdrawal is taken and taxed in full, and what remains grows
 * by the year's return. Running out of money is recorded as ruin, never thrown.
 */
@Slf4j
@Service
public class SimulationEngine {

    public static final int MAX_AGE = 120;

    // contributions arrive on average half way through the year
    private static final double MID_YEAR = 0.5;
    // less than a dollar left, or unfunded, counts as depleted
    private static final double DEPLETED = 1.0;

    private final TaxModel taxModel;
    private final HealthcareCostModel healthcareCostModel;
    private final ReturnPathFactory returnPathFactory;

    public SimulationEngine(TaxModel taxModel, HealthcareCostModel healthcareCostModel,
                            ReturnPathFactory returnPathFactory) {
        this.taxModel = taxModel;
        this.healthcareCostModel = healthcareCostModel;
        this.returnPathFactory = returnPathFactory;
    }

    /**
     * Simulates one path.
     *
     * @param seed drives the sampled returns and the long-term-care draw; the same seed and inputs
     *             always give the same path
     * @throws ValidationException if an input is out of range
     */
    public PathResult runSingleSimulation(SimulationInputs inputs, long seed) {
        validate(inputs);

        FilingStatus status = inputs.getFilingStatus();
        boolean married = inputs.isMarried();
        int yearsToRetirement = inputs.yearsToRetirement();
        int yearsInRetirement = inputs.yearsInRetirement();
        int older = inputs.olderAge();
        int historicalStart = inputs.getHistoricalStartYear() != null
                ? inputs.getHistoricalStartYear() : MarketData.START_YEAR;

        double[] accumulationReturns = returnPathFactory.annualFactors(
                inputs, yearsToRetirement + 1, inputs.youngerAge(), seed, historicalStart);
        double[] retirementReturns = returnPathFactory.annualFactors(
                inputs, yearsInRetirement, older + yearsToRetirement + 1, seed + 1, historicalStart + yearsToRetirement);

        HealthcareAssumptions health = inputs.getHealthcare();
        RandomGenerator careRandom = new Well19937c(seed + 2);
        OptionalInt primaryCareOnset = healthcareCostModel.drawLongTermCareOnset(health, careRandom);
        OptionalInt spouseCareOnset = healthcareCostModel.drawLongTermCareOnset(health, careRandom);
        if (!married) {
            spouseCareOnset = OptionalInt.empty();
        }

        // REAL walk factors are already net of inflation, so balances are in today's dollars
        boolean realWalk = inputs.getReturnMode() != ReturnMode.FIXED && inputs.getWalkSeries() == WalkSeries.REAL;
        double incomeGrowth = 1 + inputs.getIncomeGrowthPct() / 100.0;
        double medicalGrowth = 1 + health.getMedicalInflationPct() / 100.0;
        if (realWalk) {
            // in today's dollars only the excess over general inflation remains
            medicalGrowth /= 1 + inputs.getInflationPct() / 100.0;
        }

        double taxable = inputs.getTaxableBalance();
        double pretax = inputs.getPretaxBalance();
        double roth = inputs.getRothBalance();
        double emergency = inputs.getEmergencyFund();
        double basis = taxable;
        double cumulativeInflation = 1.0;
        Contributions primary = inputs.getPrimaryContributions();
        Contributions spouse = inputs.getSpouseContributions();
        double lastEarnings = 0;

        PathResult.PathResultBuilder result = PathResult.builder().seed(seed);

        for (int y = 0; y <= yearsToRetirement; y++) {
            double growth = accumulationReturns[y];
            int primaryAge = inputs.getPrimaryAge() + y;
            int spouseAge = inputs.getSpouseAge() + y;
            double medicalInflation = Math.pow(medicalGrowth, y);

            if (y > 0) {
                taxable *= growth;
                pretax *= growth;
                roth *= growth;
                if (!realWalk) {
                    emergency *= 1 + inputs.getInflationPct() / 100.0;
                }
                taxable -= dividendDrag(taxable, inputs);
                if (inputs.isEscalateContributions()) {
                    primary = primary.scaled(incomeGrowth);
                    spouse = spouse.scaled(incomeGrowth);
                }
                cumulativeInflation *= 1 + effectiveInflationPct(inputs, y) / 100.0;
            }

            boolean primaryWorking = primaryAge < inputs.getRetirementAge();
            boolean spouseWorking = married && spouseAge < inputs.getRetirementAge();
            double primaryEarnings = primaryWorking ? inputs.getPrimaryIncome() * Math.pow(incomeGrowth, y) : 0;
            double spouseEarnings = spouseWorking ? inputs.getSpouseIncome() * Math.pow(incomeGrowth, y) : 0;

            if (primaryWorking) {
                taxable += midYear(primary.getTaxable(), growth);
                pretax += midYear(primary.getPretax() + Math.max(0, primary.getEmployerMatch()), growth);
                roth += midYear(primary.getRoth(), growth);
                basis += primary.getTaxable();
                taxable -= halfSelfEmploymentTax(primaryEarnings, inputs.getPrimaryEmployment());
                lastEarnings = primaryEarnings;
            }
            if (spouseWorking) {
                taxable += midYear(spouse.getTaxable(), growth);
                pretax += midYear(spouse.getPretax() + Math.max(0, spouse.getEmployerMatch()), growth);
                roth += midYear(spouse.getRoth(), growth);
                basis += spouse.getTaxable();
                taxable -= halfSelfEmploymentTax(spouseEarnings, inputs.getSpouseEmployment());
            }
            if (health.isIncludePreMedicare() && (primaryWorking || spouseWorking)) {
                taxable -= healthcareCostModel.preMedicareCost(primaryAge, medicalInflation);
                if (married) {
                    taxable -= healthcareCostModel.preMedicareCost(spouseAge, medicalInflation);
                }
            }

            // benefits claimed by an already retired or still working spouse before the household retires
            double benefits = socialSecurity(inputs, primaryAge, spouseAge, primaryEarnings, spouseEarnings);
            taxable += benefits;
            basis += benefits;

            taxable = Math.max(0, taxable);
            basis = Math.min(basis, taxable);

            double balance = taxable + pretax + roth + emergency;
            result.year(YearRecord.builder()
                    .index(y)
                    .age(primaryAge)
                    .phase(YearRecord.Phase.ACCUMULATION)
                    .nominalBalance(realWalk ? balance * cumulativeInflation : balance)
                    .realBalance(realWalk ? balance : balance / cumulativeInflation)
                    .build());
        }

        double balanceAtRetirement = taxable + pretax + roth + emergency;
        double grossWithdrawal = balanceAtRetirement * inputs.getWithdrawalRatePct() / 100.0;
        WithdrawalTaxes firstYear = taxModel.withdrawalTaxes(grossWithdrawal, status,
                taxable, pretax, roth, basis, inputs.getStateTaxPct(), 0);
        double firstYearAfterTax = grossWithdrawal - firstYear.totalTax();
        double firstYearAfterTaxReal = realWalk ? firstYearAfterTax : firstYearAfterTax / cumulativeInflation;
        result.balanceAtRetirement(balanceAtRetirement)
                .pretaxAtRetirement(pretax)
                .firstYearGrossWithdrawal(grossWithdrawal)
                .firstYearTaxes(firstYear.getTaxes())
                .firstYearAfterTaxReal(firstYearAfterTaxReal);

        double priorYearMagi = lastEarnings + (married ? inputs.getSpouseIncome() * Math.pow(incomeGrowth, yearsToRetirement) : 0);
        double totalConversions = 0;
        double conversionTaxes = 0;
        boolean ruined = false;
        int survivalYears = 0;

        for (int y = 1; y <= yearsInRetirement; y++) {
            int index = yearsToRetirement + y;
            int primaryAge = inputs.getPrimaryAge() + index;
            int spouseAge = inputs.getSpouseAge() + index;
            int olderAge = older + index;
            double medicalInflation = Math.pow(medicalGrowth, index);

            if (ruined) {
                cumulativeInflation *= 1 + effectiveInflationPct(inputs, index) / 100.0;
                result.year(YearRecord.builder()
                        .index(index)
                        .age(primaryAge)
                        .phase(YearRecord.Phase.RETIREMENT)
                        .ruined(true)
                        .build());
                continue;
            }

            double rmd = taxModel.requiredMinimumDistribution(pretax, olderAge);
            double benefits = socialSecurity(inputs, primaryAge, spouseAge, 0, 0);

            int onMedicare = (primaryAge >= TaxTables.MEDICARE_AGE ? 1 : 0)
                    + (married && spouseAge >= TaxTables.MEDICARE_AGE ? 1 : 0);
            double healthcare = healthcareCostModel.medicareCost(health, onMedicare, priorYearMagi, status, medicalInflation);
            healthcare += healthcareCostModel.longTermCareCost(health, primaryCareOnset, primaryAge, medicalInflation);
            if (married) {
                healthcare += healthcareCostModel.longTermCareCost(health, spouseCareOnset, spouseAge, medicalInflation);
            }
            if (health.isIncludePreMedicare()) {
                healthcare += healthcareCostModel.preMedicareCost(primaryAge, medicalInflation);
                if (married) {
                    healthcare += healthcareCostModel.preMedicareCost(spouseAge, medicalInflation);
                }
            }

            double need = Math.max(0, grossWithdrawal + healthcare - benefits);
            double withdrawal = Math.max(need, rmd);
            double rmdExcess = withdrawal - need;

            double conversion = 0;
            if (inputs.getRothConversionPolicy() != null && olderAge < TaxTables.RMD_START_AGE
                    && pretax > 0 && taxable > 0) {
                double total = taxable + pretax + roth;
                double pretaxDraw = withdrawal * pretax / total;
                double baseIncome = taxModel.taxableSocialSecurity(benefits, pretaxDraw, status) + pretaxDraw;
                double ceiling = taxModel.bracketCeiling(inputs.getRothConversionPolicy().getTargetBracketRate(), status);
                conversion = Math.min(Math.max(0, ceiling - baseIncome), Math.max(0, pretax - pretaxDraw));
                double tax = conversionTax(baseIncome, conversion, status, inputs.getStateTaxPct());
                if (tax > taxable) {
                    conversion *= taxable / tax;
                    tax = conversionTax(baseIncome, conversion, status, inputs.getStateTaxPct());
                }
                if (conversion > 0) {
                    pretax -= conversion;
                    roth += conversion;
                    taxable = Math.max(0, taxable - tax);
                    basis = Math.min(basis, taxable);
                    totalConversions += conversion;
                    conversionTaxes += tax;
                }
            }

            WithdrawalTaxes taxes = taxModel.withdrawalTaxes(withdrawal, status,
                    taxable, pretax, roth, basis, inputs.getStateTaxPct(), benefits);
            taxable -= taxes.getFromTaxable();
            pretax -= taxes.getFromPretax();
            roth -= taxes.getFromRoth();
            basis = taxes.getRemainingBasis();

            double drawn = taxes.totalDrawn();
            double unfunded = withdrawal - drawn;
            if (unfunded > 0 && emergency > 0) {
                double fromEmergency = Math.min(unfunded, emergency);
                emergency -= fromEmergency;
                drawn += fromEmergency;
                unfunded -= fromEmergency;
            }
            double tax = taxes.totalTax();

            if (rmdExcess > 0 && unfunded <= 0) {
                double reinvested = rmdExcess * (1 - tax / withdrawal);
                taxable += reinvested;
                basis += reinvested;
            }

            double growth = retirementReturns[y - 1];
            taxable = Math.max(0, taxable) * growth;
            pretax = Math.max(0, pretax) * growth;
            roth = Math.max(0, roth) * growth;
            taxable -= dividendDrag(taxable, inputs);
            emergency = Math.max(0, emergency) * (realWalk ? 1 : 1 + inputs.getInflationPct() / 100.0);
            cumulativeInflation *= 1 + effectiveInflationPct(inputs, index) / 100.0;

            double balance = taxable + pretax + roth + emergency;
            if (balance < DEPLETED || unfunded > DEPLETED) {
                ruined = true;
                survivalYears = y - 1;
                taxable = 0;
                pretax = 0;
                roth = 0;
                emergency = 0;
                balance = 0;
                log.debug("Path with seed {} ran out of money in retirement year {}", seed, y);
            } else {
                survivalYears = y;
            }

            result.year(YearRecord.builder()
                    .index(index)
                    .age(primaryAge)
                    .phase(YearRecord.Phase.RETIREMENT)
                    .nominalBalance(realWalk ? balance * cumulativeInflation : balance)
                    .realBalance(realWalk ? balance : balance / cumulativeInflation)
                    .grossWithdrawal(drawn)
                    .netWithdrawal(drawn - tax)
                    .totalTax(tax)
                    .rmd(rmd)
                    .socialSecurity(benefits)
                    .healthcareCost(healthcare)
                    .rothConversion(conversion)
                    .ruined(ruined)
                    .build());

            priorYearMagi = taxes.getFromPretax() + taxes.getRealizedGains() + conversion
                    + taxModel.taxableSocialSecurity(benefits, taxes.getFromPretax() + taxes.getRealizedGains() + conversion, status);
            if (!realWalk) {
                grossWithdrawal *= 1 + effectiveInflationPct(inputs, index) / 100.0;
            }
        }

        double terminal = Math.max(0, taxable + pretax + roth + emergency);
        return result
                .terminalNominal(realWalk ? terminal * cumulativeInflation : terminal)
                .terminalReal(realWalk ? terminal : terminal / cumulativeInflation)
                .ruined(ruined)
                .survivalYears(ruined ? survivalYears : yearsInRetirement)
                .totalRothConversions(totalConversions)
                .rothConversionTaxes(conversionTaxes)
                .build();
    }

    /**
     * Checks every input the engine depends on.
     *
     * @throws ValidationException naming the first offending field
     */
    public void validate(SimulationInputs inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        requireAge("primaryAge", inputs.getPrimaryAge());
        if (inputs.isMarried()) {
            requireAge("spouseAge", inputs.getSpouseAge());
        }
        requireAge("retirementAge", inputs.getRetirementAge());
        if (inputs.getRetirementAge() < inputs.youngerAge()) {
            throw new ValidationException("retirementAge", "must be >= the younger spouse's current age (" + inputs.youngerAge() + ")");
        }
        if (inputs.getLifeExpectancy() <= 0 || inputs.getLifeExpectancy() > MAX_AGE) {
            throw new ValidationException("lifeExpectancy", "must be between 1 and " + MAX_AGE);
        }

        requireAmount("primaryIncome", inputs.getPrimaryIncome());
        requireAmount("spouseIncome", inputs.getSpouseIncome());
        requireAmount("taxableBalance", inputs.getTaxableBalance());
        requireAmount("pretaxBalance", inputs.getPretaxBalance());
        requireAmount("rothBalance", inputs.getRothBalance());
        requireAmount("emergencyFund", inputs.getEmergencyFund());
        requireContributions("primaryContributions", inputs.getPrimaryContributions());
        requireContributions("spouseContributions", inputs.getSpouseContributions());

        requireRange("expectedReturnPct", inputs.getExpectedReturnPct(), -50, 50);
        requireRange("inflationPct", inputs.getInflationPct(), -10, 50);
        requireRange("stateTaxPct", inputs.getStateTaxPct(), 0, 20);
        requireRange("withdrawalRatePct", inputs.getWithdrawalRatePct(), 0, 100);
        requireRange("incomeGrowthPct", inputs.getIncomeGrowthPct(), -50, 50);
        requireRange("dividendYieldPct", inputs.getDividendYieldPct(), 0, 20);

        if (inputs.getReturnMode() == ReturnMode.HISTORICAL) {
            Integer start = inputs.getHistoricalStartYear();
            if (start == null || start < MarketData.START_YEAR || start > MarketData.END_YEAR) {
                throw new ValidationException("historicalStartYear",
                        "must be between " + MarketData.START_YEAR + " and " + MarketData.END_YEAR);
            }
        }
        InflationShock shock = inputs.getInflationShock();
        if (shock != null) {
            requireRange("inflationShock.ratePct", shock.getRatePct(), -10, 50);
            if (shock.getDurationYears() < 0) {
                throw new ValidationException("inflationShock.durationYears", "must be >= 0");
            }
        }

        requireElection("primarySocialSecurity", inputs.getPrimarySocialSecurity());
        if (inputs.isMarried()) {
            requireElection("spouseSocialSecurity", inputs.getSpouseSocialSecurity());
        }

        HealthcareAssumptions health = inputs.getHealthcare();
        requireAmount("healthcare.medicarePremium", health.getMedicarePremium());
        requireRange("healthcare.medicalInflationPct", health.getMedicalInflationPct(), -10, 50);
        requireAmount("healthcare.ltcAnnualCost", health.getLtcAnnualCost());
        requireRange("healthcare.ltcProbabilityPct", health.getLtcProbabilityPct(), 0, 100);
        requireAmount("healthcare.ltcDurationYears", health.getLtcDurationYears());
        if (health.getLtcOnsetStartAge() > health.getLtcOnsetEndAge()) {
            throw new ValidationException("healthcare.ltcOnsetStartAge", "must be <= ltcOnsetEndAge");
        }

        BondGlidePath glidePath = inputs.getBondGlidePath();
        if (glidePath != null) {
            requireRange("bondGlidePath.startPct", glidePath.getStartPct(), 0, 100);
            requireRange("bondGlidePath.endPct", glidePath.getEndPct(), 0, 100);
            if (glidePath.getStrategy() == BondGlidePath.Strategy.CUSTOM
                    && glidePath.getStartAge() >= glidePath.getEndAge()) {
                throw new ValidationException("bondGlidePath.startAge", "must be < endAge");
            }
        }
        if (inputs.getRothConversionPolicy() != null) {
            // rejects rates that are not a bounded bracket
            taxModel.bracketLimit(inputs.getRothConversionPolicy().getTargetBracketRate(), inputs.getFilingStatus());
        }
    }

    private double socialSecurity(SimulationInputs inputs, int primaryAge, int spouseAge,
                                  double primaryEarnings, double spouseEarnings) {
        SocialSecurityElection own = inputs.getPrimarySocialSecurity();
        SocialSecurityElection partner = inputs.getSpouseSocialSecurity();
        boolean primaryClaiming = own.isEnabled() && primaryAge >= own.getClaimAge();
        boolean spouseClaiming = inputs.isMarried() && partner.isEnabled() && spouseAge >= partner.getClaimAge();

        double primaryPia = taxModel.primaryInsuranceAmount(own.getAverageCareerIncome());
        double spousePia = taxModel.primaryInsuranceAmount(partner.getAverageCareerIncome());

        double total = 0;
        if (primaryClaiming) {
            double monthly = spouseClaiming
                    ? taxModel.effectiveMonthlyBenefit(primaryPia, spousePia, own.getClaimAge())
                    : taxModel.claimAdjustedBenefit(primaryPia, own.getClaimAge());
            total += taxModel.applyEarningsTest(monthly * 12.0, primaryEarnings, primaryAge);
        }
        if (spouseClaiming) {
            double monthly = primaryClaiming
                    ? taxModel.effectiveMonthlyBenefit(spousePia, primaryPia, partner.getClaimAge())
                    : taxModel.claimAdjustedBenefit(spousePia, partner.getClaimAge());
            total += taxModel.applyEarningsTest(monthly * 12.0, spouseEarnings, spouseAge);
        }
        return total;
    }

    private double dividendDrag(double taxable, SimulationInputs inputs) {
        if (taxable <= 0 || inputs.getDividendYieldPct() <= 0) {
            return 0;
        }
        return taxModel.capitalGainsTax(taxable * inputs.getDividendYieldPct() / 100.0, inputs.getFilingStatus(), 0);
    }

    private double halfSelfEmploymentTax(double earnings, EmploymentType type) {
        double selfEmployedShare;
        if (type == EmploymentType.SELF_EMPLOYED) {
            selfEmployedShare = 1.0;
        } else if (type == EmploymentType.BOTH) {
            selfEmployedShare = 0.5;
        } else {
            return 0;
        }
        return taxModel.selfEmploymentTax(earnings * selfEmployedShare) * 0.5;
    }

    private double conversionTax(double baseIncome, double conversion, FilingStatus status, double statePct) {
        if (conversion <= 0) {
            return 0;
        }
        return taxModel.ordinaryTax(baseIncome + conversion, status) - taxModel.ordinaryTax(baseIncome, status)
                + taxModel.stateTax(conversion, statePct);
    }

    private static double midYear(double amount, double growth) {
        return amount * (1 + (growth - 1) * MID_YEAR);
    }

    /**
     * Inflation for a year index, using the shock rate from the retirement year for its duration.
     */
    private static double effectiveInflationPct(SimulationInputs inputs, int index) {
        InflationShock shock = inputs.getInflationShock();
        if (shock == null) {
            return inputs.getInflationPct();
        }
        int start = inputs.yearsToRetirement();
        if (index >= start && index < start + shock.getDurationYears()) {
            return shock.getRatePct();
        }
        return inputs.getInflationPct();
    }

    private static void requireAge(String field, int age) {
        if (age < 0 || age > MAX_AGE) {
            throw new ValidationException(field, "must be between 0 and " + MAX_AGE);
        }
    }

    private static void requireAmount(String field, double amount) {
        if (!Double.isFinite(amount) || amount < 0) {
            throw new ValidationException(field, "must be a finite amount >= 0");
        }
    }

    private static void requireRange(String field, double value, double min, double max) {
        if (!Double.isFinite(value) || value < min || value > max) {
            throw new ValidationException(field, "must be between " + min + " and " + max);
        }
    }

    private static void requireContributions(String field, Contributions contributions) {
        requireAmount(field + ".taxable", contributions.getTaxable());
        requireAmount(field + ".pretax", contributions.getPretax());
        requireAmount(field + ".roth", contributions.getRoth());
        if (!Double.isFinite(contributions.getEmployerMatch())) {
            throw new ValidationException(field + ".employerMatch", "must be finite");
        }
    }

    private static void requireElection(String field, SocialSecurityElection election) {
        if (!election.isEnabled()) {
            return;
        }
        requireAmount(field + ".averageCareerIncome", election.getAverageCareerIncome());
        if (election.getClaimAge() < 62 || election.getClaimAge() > 70) {
            throw new ValidationException(field + ".claimAge", "must be between 62 and 70");
        }
    }
}
