package com.gillianbc.planner.model;

import lombok.Value;

/**
 * Result of drawing a gross amount pro rata from the three account types:
 * how much came from each account, the tax owed, and the taxable account's remaining cost basis.
 */
@Value
public class WithdrawalTaxes {

    TaxBreakdown taxes;
    double fromTaxable;
    double fromPretax;
    double fromRoth;
    // gain portion of the taxable account draw
    double realizedGains;
    double remainingBasis;

    public double totalDrawn() {
        return fromTaxable + fromPretax + fromRoth;
    }

    public double totalTax() {
        return taxes.total();
    }
}
