package com.gillianbc.planner.service;

import com.gillianbc.planner.exception.ValidationException;
import com.gillianbc.planner.model.FilingStatus;
import com.gillianbc.planner.model.TaxBreakdown;
import com.gillianbc.planner.model.WithdrawalTaxes;
import com.gillianbc.planner.service.TaxTables.Bracket;
import com.gillianbc.planner.service.TaxTables.Schedule;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Federal, state and estate tax, Social Security and RMD rules.
 * <p>
 * Every method is a pure function of its arguments. Negative or non-finite amounts are
 * treated as zero so the simulation can feed raw intermediate values in.
 */
@Service
public class TaxModel {

    /**
     * Progressive federal tax on ordinary income after the standard deduction.
     */
    public double ordinaryTax(double income, FilingStatus status) {
        double gross = safe(income);
        if (gross <= 0) {
            return 0;
        }
        Schedule schedule = TaxTables.schedule(status);
        return progressive(Math.max(0, gross - schedule.standardDeduction), schedule.ordinary);
    }

    /**
     * Long-term capital gains tax. Gains stack on top of taxable ordinary income, so the
     * 0% band is only available to the extent ordinary income has not filled it.
     *
     * @param gains          long-term gains realised
     * @param ordinaryIncome gross ordinary income of the same year
     */
    public double capitalGainsTax(double gains, FilingStatus status, double ordinaryIncome) {
        double remaining = safe(gains);
        if (remaining <= 0) {
            return 0;
        }
        Schedule schedule = TaxTables.schedule(status);
        double stackedIncome = Math.max(0, safe(ordinaryIncome) - schedule.standardDeduction);
        double tax = 0;
        for (Bracket bracket : schedule.capitalGains) {
            double room = Math.max(0, bracket.limit - stackedIncome);
            double taxedHere = Math.min(remaining, room);
            if (taxedHere > 0) {
                tax += taxedHere * bracket.rate;
                remaining -= taxedHere;
                stackedIncome += taxedHere;
            }
            if (remaining <= 0) {
                break;
            }
        }
        return tax;
    }

    /**
     * 3.8% net investment income tax on the lesser of investment income and MAGI above the threshold.
     */
    public double niit(double investmentIncome, FilingStatus status, double modifiedAgi) {
        double investment = safe(investmentIncome);
        if (investment <= 0) {
            return 0;
        }
        double excess = safe(modifiedAgi) - TaxTables.schedule(status).niitThreshold;
        if (excess <= 0) {
            return 0;
        }
        return Math.min(investment, excess) * TaxTables.NIIT_RATE;
    }

    /** Flat state income tax. */
    public double stateTax(double taxableIncome, double statePct) {
        return safe(taxableIncome) * safe(statePct) / 100.0;
    }

    /**
     * Estate tax exemption for a death in the given calendar year.
     *
     * @param sunset when true the exemption reverts to the lower pre-2026 level
     */
    public double estateExemption(FilingStatus status, int year, boolean sunset) {
        double base;
        if (sunset) {
            base = status.isMarried() ? TaxTables.ESTATE_SUNSET_EXEMPTION_MARRIED : TaxTables.ESTATE_SUNSET_EXEMPTION_SINGLE;
        } else {
            base = status.isMarried() ? TaxTables.ESTATE_EXEMPTION_MARRIED : TaxTables.ESTATE_EXEMPTION_SINGLE;
        }
        int yearsIndexed = year - TaxTables.ESTATE_BASE_YEAR;
        if (yearsIndexed <= 0) {
            return base;
        }
        return base * Math.pow(1 + TaxTables.ESTATE_EXEMPTION_INDEXING, yearsIndexed);
    }

    /**
     * Graduated federal estate tax on the part of the estate above the exemption.
     * Zero at or below the exemption and strictly increasing above it.
     */
    public double estateTax(double estate, FilingStatus status, int year, boolean sunset) {
        double taxable = safe(estate) - estateExemption(status, year, sunset);
        if (taxable <= 0) {
            return 0;
        }
        return progressive(taxable, TaxTables.ESTATE_BRACKETS);
    }

    /**
     * Primary insurance amount from average annual career earnings.
     *
     * @return monthly benefit at full retirement age
     */
    public double primaryInsuranceAmount(double averageAnnualIncome) {
        double income = safe(averageAnnualIncome);
        if (income <= 0) {
            return 0;
        }
        double aime = income / 12.0;
        if (aime <= TaxTables.SS_FIRST_BEND) {
            return aime * 0.90;
        }
        if (aime <= TaxTables.SS_SECOND_BEND) {
            return TaxTables.SS_FIRST_BEND * 0.90 + (aime - TaxTables.SS_FIRST_BEND) * 0.32;
        }
        return TaxTables.SS_FIRST_BEND * 0.90
                + (TaxTables.SS_SECOND_BEND - TaxTables.SS_FIRST_BEND) * 0.32
                + (aime - TaxTables.SS_SECOND_BEND) * 0.15;
    }

    /**
     * Scales a monthly PIA for claiming before or after full retirement age.
     * Early: 5/9% per month for the first 36 months, 5/12% beyond. Delayed: 2/3% per month.
     */
    public double claimAdjustedBenefit(double monthlyPia, int claimAge) {
        if (monthlyPia <= 0) {
            return 0;
        }
        int months = (claimAge - TaxTables.FULL_RETIREMENT_AGE) * 12;
        double factor = 1.0;
        if (months < 0) {
            int early = -months;
            if (early <= 36) {
                factor = 1 - early * (5.0 / 9.0) / 100.0;
            } else {
                factor = 1 - 36 * (5.0 / 9.0) / 100.0 - (early - 36) * (5.0 / 12.0) / 100.0;
            }
        } else if (months > 0) {
            factor = 1 + months * (2.0 / 3.0) / 100.0;
        }
        return monthlyPia * factor;
    }

    /**
     * @return annual own-record Social Security benefit
     */
    public double socialSecurityBenefit(double averageAnnualIncome, int claimAge) {
        return claimAdjustedBenefit(primaryInsuranceAmount(averageAnnualIncome), claimAge) * 12.0;
    }

    /**
     * Monthly benefit of a married person: the higher of their own claim-adjusted benefit and
     * half the spouse's PIA. The spousal half is reduced for early claiming but never increased for delay.
     */
    public double effectiveMonthlyBenefit(double ownPia, double spousePia, int claimAge) {
        double own = claimAdjustedBenefit(ownPia, claimAge);
        double spousal = Math.max(0, spousePia) * 0.5;
        if (claimAge < TaxTables.FULL_RETIREMENT_AGE) {
            int early = (TaxTables.FULL_RETIREMENT_AGE - claimAge) * 12;
            if (early <= 36) {
                spousal *= 1 - early * (25.0 / 36.0) / 100.0;
            } else {
                spousal *= 1 - 36 * (25.0 / 36.0) / 100.0 - (early - 36) * (5.0 / 12.0) / 100.0;
            }
        }
        return Math.max(own, spousal);
    }

    /**
     * Benefits withheld while an early claimant still has earned income.
     *
     * @return the annual benefit actually paid, never negative
     */
    public double applyEarningsTest(double annualBenefit, double earnedIncome, int age) {
        if (age >= TaxTables.FULL_RETIREMENT_AGE || annualBenefit <= 0 || earnedIncome <= 0) {
            return Math.max(0, annualBenefit);
        }
        double withheld;
        if (age == TaxTables.FULL_RETIREMENT_AGE - 1) {
            withheld = Math.max(0, earnedIncome - TaxTables.SS_EARNINGS_EXEMPT_FRA_YEAR) / 3.0;
        } else {
            withheld = Math.max(0, earnedIncome - TaxTables.SS_EARNINGS_EXEMPT) / 2.0;
        }
        return Math.max(0, annualBenefit - withheld);
    }

    /**
     * Part of the Social Security benefit included in taxable income (0%, up to 50% or up to 85%).
     *
     * @param otherIncome all other income counted in AGI
     */
    public double taxableSocialSecurity(double benefit, double otherIncome, FilingStatus status) {
        if (benefit <= 0) {
            return 0;
        }
        Schedule schedule = TaxTables.schedule(status);
        double combined = safe(otherIncome) + benefit * 0.5;
        if (combined <= schedule.ssTier1) {
            return 0;
        }
        if (combined <= schedule.ssTier2) {
            return Math.min(benefit * 0.5, (combined - schedule.ssTier1) * 0.5);
        }
        double firstTier = (schedule.ssTier2 - schedule.ssTier1) * 0.5;
        double secondTier = (combined - schedule.ssTier2) * 0.85;
        return Math.min(benefit * 0.85, firstTier + secondTier);
    }

    /**
     * Required minimum distribution for the year the account owner reaches the given age.
     */
    public double requiredMinimumDistribution(double pretaxBalance, int age) {
        double divisor = TaxTables.rmdDivisor(age);
        if (divisor <= 0 || pretaxBalance <= 0) {
            return 0;
        }
        return pretaxBalance / divisor;
    }

    /** Both halves of Social Security and Medicare tax on net self-employment earnings. */
    public double selfEmploymentTax(double netEarnings) {
        if (netEarnings <= 0) {
            return 0;
        }
        double earnings = netEarnings * TaxTables.SELF_EMPLOYMENT_FACTOR;
        double medicare = earnings * TaxTables.MEDICARE_RATE_SELF_EMPLOYED;
        if (earnings > TaxTables.ADDITIONAL_MEDICARE_THRESHOLD) {
            medicare += (earnings - TaxTables.ADDITIONAL_MEDICARE_THRESHOLD) * TaxTables.ADDITIONAL_MEDICARE_RATE;
        }
        return Math.min(earnings, TaxTables.SS_WAGE_BASE) * TaxTables.SS_RATE_SELF_EMPLOYED + medicare;
    }

    /**
     * Top of the bracket taxed at the given marginal rate, expressed as gross income
     * (taxable limit plus the standard deduction).
     *
     * @throws ValidationException if no bracket has that rate
     */
    public double bracketCeiling(double rate, FilingStatus status) {
        Schedule schedule = TaxTables.schedule(status);
        return bracketLimit(rate, status) + schedule.standardDeduction;
    }

    /**
     * Upper limit of the bracket with the given rate, on taxable income.
     *
     * @throws ValidationException if no bracket has that rate or it is the open-ended top bracket
     */
    public double bracketLimit(double rate, FilingStatus status) {
        for (Bracket bracket : TaxTables.schedule(status).ordinary) {
            if (Math.abs(bracket.rate - rate) < 1e-9 && !Double.isInfinite(bracket.limit)) {
                return bracket.limit;
            }
        }
        throw new ValidationException("targetBracketRate", "must match a bounded federal bracket rate, was " + rate);
    }

    /**
     * Draws a gross amount pro rata across the taxable, pre-tax and Roth accounts and works out
     * the tax due. A shortfall in one account cascades to the next (taxable, then pre-tax, then Roth).
     *
     * @param socialSecurity benefit received this year; its taxable part is ordinary income and
     *                       the withdrawal is charged the tax it adds on top of the benefit
     */
    public WithdrawalTaxes withdrawalTaxes(double gross, FilingStatus status,
                                           double taxableBalance, double pretaxBalance, double rothBalance,
                                           double taxableBasis, double statePct, double socialSecurity) {
        double taxable = Math.max(0, taxableBalance);
        double pretax = Math.max(0, pretaxBalance);
        double roth = Math.max(0, rothBalance);
        double total = taxable + pretax + roth;
        if (total <= 0 || gross <= 0) {
            return new WithdrawalTaxes(TaxBreakdown.ZERO, 0, 0, 0, 0, Math.max(0, taxableBasis));
        }

        double wantTaxable = gross * taxable / total;
        double wantPretax = gross * pretax / total;
        double wantRoth = gross * roth / total;

        double fromTaxable = Math.min(wantTaxable, taxable);
        double carry = wantTaxable - fromTaxable;
        double fromPretax = Math.min(wantPretax + carry, pretax);
        carry = wantPretax + carry - fromPretax;
        double fromRoth = Math.min(wantRoth + carry, roth);

        double gainRatio = taxable > 0 ? Math.max(0, taxable - taxableBasis) / taxable : 0;
        double gains = fromTaxable * gainRatio;
        double basisUsed = fromTaxable - gains;

        double taxableSs = taxableSocialSecurity(socialSecurity, fromPretax + gains, status);
        double ordinaryIncome = fromPretax + taxableSs;

        // Social Security alone fills the lowest brackets; the withdrawal pays for the rest,
        // including tax on benefits that the withdrawal makes taxable
        double benefitsOnlyTax = ordinaryTax(taxableSocialSecurity(socialSecurity, 0, status), status);
        double ordinary = Math.max(0, ordinaryTax(ordinaryIncome, status) - benefitsOnlyTax);
        double capitalGains = capitalGainsTax(gains, status, ordinaryIncome);
        double niit = niit(gains, status, ordinaryIncome + gains);
        double state = stateTax(fromPretax + gains, statePct);

        return new WithdrawalTaxes(new TaxBreakdown(ordinary, capitalGains, niit, state),
                fromTaxable, fromPretax, fromRoth, gains, Math.max(0, taxableBasis - basisUsed));
    }

    private static double progressive(double amount, Iterable<Bracket> brackets) {
        double remaining = amount;
        double tax = 0;
        double previous = 0;
        for (Bracket bracket : brackets) {
            double slice = Math.min(remaining, bracket.limit - previous);
            tax += slice * bracket.rate;
            remaining -= slice;
            previous = bracket.limit;
            if (remaining <= 0) {
                break;
            }
        }
        return tax;
    }

    private static double safe(double value) {
        return Double.isFinite(value) ? Math.max(0, value) : 0;
    }
}
