package com.gillianbc.planner.model;

import lombok.Value;

/**
 * Taxes due on one year's withdrawals.
 */
@Value
public class TaxBreakdown {

    public static final TaxBreakdown ZERO = new TaxBreakdown(0, 0, 0, 0);

    double ordinary;
    double capitalGains;
    double niit;
    double state;

    public double total() {
        return ordinary + capitalGains + niit + state;
    }
}
