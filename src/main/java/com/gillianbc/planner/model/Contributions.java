package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.Value;

/**
 * Annual contributions for one person, split by account type.
 * Employer match lands in the pre-tax account.
 */
@Value
@Builder
public class Contributions {

    public static final Contributions NONE = Contributions.builder().build();

    double taxable;
    double pretax;
    double roth;
    double employerMatch;

    /**
     * @return a copy with every amount multiplied by factor
     */
    public Contributions scaled(double factor) {
        return new Contributions(taxable * factor, pretax * factor, roth * factor, employerMatch * factor);
    }

    public double total() {
        return taxable + pretax + roth + employerMatch;
    }
}
