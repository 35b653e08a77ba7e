package com.gillianbc.planner.service;

import com.gillianbc.planner.exception.ValidationException;
import com.gillianbc.planner.model.FilingStatus;
import com.gillianbc.planner.model.RothConversionRequest;
import com.gillianbc.planner.model.RothConversionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recommends yearly Roth conversions between retirement and the RMD start age.
 * <p>
 * Each year in the window converts whatever fits under the target bracket once Social Security
 * and planned withdrawals are counted. The plan is compared with doing nothing by totalling the
 * tax on conversions and on the RMDs that follow until life expectancy.
 */
@Slf4j
@Service
public class RothConversionOptimizer {

    // conversions smaller than this are not worth the paperwork
    private static final double MIN_CONVERSION = 5_000;
    // RMD rows returned for display
    private static final int RMD_ROWS = 10;

    private final TaxModel taxModel;

    public RothConversionOptimizer(TaxModel taxModel) {
        this.taxModel = taxModel;
    }

    public RothConversionResult optimize(RothConversionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (request.getPretaxBalance() <= 0) {
            return RothConversionResult.noRecommendation("No pre-tax balance to convert");
        }
        if (request.getRetirementAge() >= TaxTables.RMD_START_AGE) {
            return RothConversionResult.noRecommendation("Already at or past RMD age");
        }
        if (request.getGrowthRate() <= -1) {
            throw new ValidationException("growthRate", "must be > -1");
        }

        FilingStatus status = request.getFilingStatus();
        double limit = taxModel.bracketLimit(request.getTargetBracketRate(), status);
        double ceiling = taxModel.bracketCeiling(request.getTargetBracketRate(), status);
        double growth = 1 + request.getGrowthRate();
        double ss = Math.max(0, request.getSocialSecurityIncome());

        List<RothConversionResult.RmdYear> baselineRmds = rmdSchedule(request.getPretaxBalance(), request, growth);
        double baselineTax = 0;
        double baselineRmdTotal = 0;
        for (RothConversionResult.RmdYear year : baselineRmds) {
            baselineTax += year.getTax();
            baselineRmdTotal += year.getRmd();
        }

        double withdrawal = Math.max(0, request.getAnnualWithdrawal());
        double baseIncome = withdrawal + taxModel.taxableSocialSecurity(ss, withdrawal, status);
        double pretax = request.getPretaxBalance();
        double optimizedTax = 0;
        double totalConverted = 0;
        List<RothConversionResult.Conversion> conversions = new ArrayList<>();
        for (int age = request.getRetirementAge(); age < TaxTables.RMD_START_AGE; age++) {
            double amount = Math.min(Math.max(0, ceiling - baseIncome), pretax);
            if (amount > MIN_CONVERSION) {
                double tax = taxModel.ordinaryTax(baseIncome + amount, status) - taxModel.ordinaryTax(baseIncome, status);
                conversions.add(new RothConversionResult.Conversion(age, amount, tax, pretax));
                optimizedTax += tax;
                totalConverted += amount;
                pretax -= amount;
            }
            pretax *= growth;
        }

        List<RothConversionResult.RmdYear> optimizedRmds = rmdSchedule(pretax, request, growth);
        double optimizedRmdTotal = 0;
        for (RothConversionResult.RmdYear year : optimizedRmds) {
            optimizedTax += year.getTax();
            optimizedRmdTotal += year.getRmd();
        }

        double savings = baselineTax - optimizedTax;
        double rmdReduction = baselineRmdTotal - optimizedRmdTotal;
        double baselineRate = baselineRmdTotal > 0 ? baselineTax / baselineRmdTotal : 0;
        double optimizedBase = optimizedRmdTotal + totalConverted;
        double optimizedRate = optimizedBase > 0 ? optimizedTax / optimizedBase : 0;

        boolean recommended = !conversions.isEmpty() && savings > 0;
        log.debug("Roth plan from age {}: {} conversions totalling {}, lifetime saving {}",
                request.getRetirementAge(), conversions.size(),
                String.format("%,.2f", totalConverted), String.format("%,.2f", savings));

        return RothConversionResult.builder()
                .recommended(recommended)
                .reason(recommended ? null : "Conversions do not reduce lifetime tax")
                .conversions(conversions)
                .windowStartAge(request.getRetirementAge())
                .windowEndAge(TaxTables.RMD_START_AGE - 1)
                .targetBracketRate(request.getTargetBracketRate())
                .targetBracketLimit(limit)
                .totalConverted(totalConverted)
                .averageAnnualConversion(conversions.isEmpty() ? 0 : totalConverted / conversions.size())
                .baselineLifetimeTax(baselineTax)
                .optimizedLifetimeTax(optimizedTax)
                .lifetimeTaxSavings(savings)
                .rmdReduction(rmdReduction)
                .rmdReductionPct(baselineRmdTotal > 0 ? rmdReduction / baselineRmdTotal * 100 : 0)
                .effectiveRateImprovementPct((baselineRate - optimizedRate) * 100)
                .baselineRmds(baselineRmds.subList(0, Math.min(RMD_ROWS, baselineRmds.size())))
                .optimizedRmds(optimizedRmds.subList(0, Math.min(RMD_ROWS, optimizedRmds.size())))
                .build();
    }

    /**
     * RMDs from the start age to life expectancy on a balance that keeps growing, with the ordinary
     * tax on each RMD plus the taxable part of Social Security.
     */
    private List<RothConversionResult.RmdYear> rmdSchedule(double startingPretax, RothConversionRequest request,
                                                          double growth) {
        FilingStatus status = request.getFilingStatus();
        double ss = Math.max(0, request.getSocialSecurityIncome());
        List<RothConversionResult.RmdYear> years = new ArrayList<>();
        double pretax = startingPretax;
        for (int age = TaxTables.RMD_START_AGE; age <= request.getLifeExpectancy(); age++) {
            double rmd = taxModel.requiredMinimumDistribution(pretax, age);
            double income = rmd + taxModel.taxableSocialSecurity(ss, rmd, status);
            years.add(new RothConversionResult.RmdYear(age, rmd, taxModel.ordinaryTax(income, status)));
            pretax = (pretax - rmd) * growth;
        }
        return years;
    }
}
