package com.gillianbc.planner.service;

import com.gillianbc.planner.exception.ValidationException;
import com.gillianbc.planner.model.FilingStatus;
import com.gillianbc.planner.model.WithdrawalTaxes;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class TaxModelTest {

    private static final double DELTA = 0.01;

    private final TaxModel taxModel = new TaxModel();

    @Test
    @DisplayName("Ordinary tax applies the standard deduction then the brackets")
    void ordinaryTax_single_fillsBrackets() {
        // 50,000 - 16,100 = 33,900 taxable: 12,400 @ 10% + 21,500 @ 12%
        assertEquals(3_820.00, taxModel.ordinaryTax(50_000, FilingStatus.SINGLE), DELTA);
        assertEquals(0.0, taxModel.ordinaryTax(10_000, FilingStatus.SINGLE), DELTA);
        assertEquals(0.0, taxModel.ordinaryTax(-5_000, FilingStatus.MARRIED), DELTA);
    }

    @Test
    @DisplayName("Capital gains use the 0% band only where ordinary income leaves room")
    void capitalGainsTax_stacksOnOrdinaryIncome() {
        assertEquals(0.0, taxModel.capitalGainsTax(20_000, FilingStatus.SINGLE, 0), DELTA);
        // ordinary taxable 44,000 leaves 5,450 at 0%, the remaining 14,550 at 15%
        assertEquals(2_182.50, taxModel.capitalGainsTax(20_000, FilingStatus.SINGLE, 60_100), DELTA);
    }

    @Test
    @DisplayName("NIIT is 3.8% of the lesser of investment income and MAGI over the threshold")
    void niit_lesserOfIncomeAndExcess() {
        assertEquals(760.00, taxModel.niit(50_000, FilingStatus.SINGLE, 220_000), DELTA);
        assertEquals(0.0, taxModel.niit(50_000, FilingStatus.MARRIED, 220_000), DELTA);
    }

    @Test
    @DisplayName("State tax is a flat percentage")
    void stateTax_flat() {
        assertEquals(5_000.00, taxModel.stateTax(100_000, 5), DELTA);
    }

    @Test
    @DisplayName("Estate tax is zero up to the exemption and graduated above it")
    void estateTax_graduatedAboveExemption() {
        assertEquals(0.0, taxModel.estateTax(10_000_000, FilingStatus.SINGLE, 2026, false), DELTA);
        assertEquals(0.0, taxModel.estateTax(15_000_000, FilingStatus.SINGLE, 2026, false), DELTA);
        // first 100,000 over the exemption: 1,800 + 2,000 + 4,400 + 4,800 + 5,200 + 5,600
        assertEquals(23_800.00, taxModel.estateTax(15_100_000, FilingStatus.SINGLE, 2026, false), DELTA);
        assertTrue(taxModel.estateTax(17_000_000, FilingStatus.SINGLE, 2026, false)
                > taxModel.estateTax(16_000_000, FilingStatus.SINGLE, 2026, false));
    }

    @Test
    @DisplayName("Estate exemption is indexed from 2027 and drops when the sunset applies")
    void estateExemption_indexingAndSunset() {
        assertEquals(15_000_000, taxModel.estateExemption(FilingStatus.SINGLE, 2026, false), DELTA);
        assertEquals(15_390_000, taxModel.estateExemption(FilingStatus.SINGLE, 2027, false), DELTA);
        assertEquals(14_000_000, taxModel.estateExemption(FilingStatus.MARRIED, 2026, true), DELTA);
        assertTrue(taxModel.estateTax(10_000_000, FilingStatus.SINGLE, 2026, true) > 0);
    }

    @Test
    @DisplayName("PIA uses the bend points on monthly average earnings")
    void primaryInsuranceAmount_bendPoints() {
        // AIME 5,000: 1,286 * 90% + 3,714 * 32%
        assertEquals(2_345.88, taxModel.primaryInsuranceAmount(60_000), DELTA);
        assertEquals(0.0, taxModel.primaryInsuranceAmount(0), DELTA);
    }

    @Test
    @DisplayName("Claiming at 62 cuts the benefit by 30%, claiming at 70 raises it by 24%")
    void claimAdjustedBenefit_earlyAndDelayed() {
        assertEquals(700.00, taxModel.claimAdjustedBenefit(1_000, 62), DELTA);
        assertEquals(1_000.00, taxModel.claimAdjustedBenefit(1_000, 67), DELTA);
        assertEquals(1_240.00, taxModel.claimAdjustedBenefit(1_000, 70), DELTA);
    }

    @Test
    @DisplayName("Spousal benefit is half the partner's PIA when that beats the own benefit")
    void effectiveMonthlyBenefit_spousal() {
        assertEquals(1_500.00, taxModel.effectiveMonthlyBenefit(500, 3_000, 67), DELTA);
        assertEquals(2_000.00, taxModel.effectiveMonthlyBenefit(2_000, 3_000, 67), DELTA);
    }

    @Test
    @DisplayName("Earnings test withholds $1 for every $2 over the exempt amount before FRA")
    void applyEarningsTest_withholds() {
        assertEquals(10_000.00, taxModel.applyEarningsTest(20_000, 43_400, 63), DELTA);
        assertEquals(20_000.00, taxModel.applyEarningsTest(20_000, 43_400, 67), DELTA);
        assertEquals(0.0, taxModel.applyEarningsTest(20_000, 200_000, 63), DELTA);
    }

    @Test
    @DisplayName("Taxable Social Security is capped at 85% of the benefit")
    void taxableSocialSecurity_tiers() {
        assertEquals(0.0, taxModel.taxableSocialSecurity(20_000, 0, FilingStatus.SINGLE), DELTA);
        assertEquals(17_000.00, taxModel.taxableSocialSecurity(20_000, 40_000, FilingStatus.SINGLE), DELTA);
    }

    @Test
    @DisplayName("RMD is zero before 73 and balance over divisor from 73")
    void requiredMinimumDistribution_startsAt73() {
        assertEquals(0.0, taxModel.requiredMinimumDistribution(265_000, 72), DELTA);
        assertEquals(10_000.00, taxModel.requiredMinimumDistribution(265_000, 73), DELTA);
        assertEquals(50_000.00, taxModel.requiredMinimumDistribution(100_000, 125), DELTA);
    }

    @Test
    @DisplayName("Self-employment tax applies both halves to 92.35% of net earnings")
    void selfEmploymentTax_bothHalves() {
        assertEquals(14_129.55, taxModel.selfEmploymentTax(100_000), DELTA);
        assertEquals(0.0, taxModel.selfEmploymentTax(0), DELTA);
    }

    @Test
    @DisplayName("Bracket ceiling adds the standard deduction; unknown rates are rejected")
    void bracketCeiling_knownAndUnknownRates() {
        assertEquals(201_775, taxModel.bracketLimit(0.24, FilingStatus.SINGLE), DELTA);
        assertEquals(217_875, taxModel.bracketCeiling(0.24, FilingStatus.SINGLE), DELTA);
        ValidationException ex = assertThrows(ValidationException.class,
                () -> taxModel.bracketCeiling(0.25, FilingStatus.SINGLE));
        assertEquals("targetBracketRate", ex.getField());
        assertThrows(ValidationException.class, () -> taxModel.bracketLimit(0.37, FilingStatus.MARRIED));
    }

    @Test
    @DisplayName("Withdrawals are drawn pro rata and only pre-tax and gains are taxed")
    void withdrawalTaxes_proRata() {
        WithdrawalTaxes taxes = taxModel.withdrawalTaxes(30_000, FilingStatus.SINGLE,
                100_000, 100_000, 100_000, 100_000, 5, 0);
        assertEquals(10_000.00, taxes.getFromTaxable(), DELTA);
        assertEquals(10_000.00, taxes.getFromPretax(), DELTA);
        assertEquals(10_000.00, taxes.getFromRoth(), DELTA);
        assertEquals(0.0, taxes.getRealizedGains(), DELTA);
        // 10,000 of pre-tax income is under the deduction, so only state tax is due
        assertEquals(500.00, taxes.totalTax(), DELTA);
        assertEquals(90_000.00, taxes.getRemainingBasis(), DELTA);
    }

    @Test
    @DisplayName("A shortfall in one account cascades until every account is empty")
    void withdrawalTaxes_shortfallCascades() {
        WithdrawalTaxes taxes = taxModel.withdrawalTaxes(200_000, FilingStatus.SINGLE,
                5_000, 100_000, 0, 5_000, 0, 0);
        assertEquals(5_000.00, taxes.getFromTaxable(), DELTA);
        assertEquals(100_000.00, taxes.getFromPretax(), DELTA);
        assertEquals(105_000.00, taxes.totalDrawn(), DELTA);
    }

    @Test
    @DisplayName("Social Security does not make the withdrawal pay tax the benefit alone would owe")
    void withdrawalTaxes_incrementalOverBenefits() {
        WithdrawalTaxes withBenefits = taxModel.withdrawalTaxes(60_000, FilingStatus.SINGLE,
                0, 1_000_000, 0, 0, 0, 40_000);
        WithdrawalTaxes without = taxModel.withdrawalTaxes(60_000, FilingStatus.SINGLE,
                0, 1_000_000, 0, 0, 0, 0);
        log.info("Tax with benefits {}, without {}", withBenefits.totalTax(), without.totalTax());
        assertTrue(withBenefits.totalTax() >= without.totalTax());
    }
}
