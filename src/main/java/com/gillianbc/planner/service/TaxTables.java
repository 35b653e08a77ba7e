package com.gillianbc.planner.service;

import com.gillianbc.planner.model.FilingStatus;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 2026 federal tax and benefit constants. All amounts are nominal dollars.
 */
public final class TaxTables {

    public static final int RMD_START_AGE = 73;
    public static final int FULL_RETIREMENT_AGE = 67;
    public static final int MEDICARE_AGE = 65;

    // IRS Uniform Lifetime Table, index 0 is age 73
    private static final double[] RMD_DIVISORS = {
            26.5, 25.5, 24.6, 23.7, 22.9, 22.0, 21.1, 20.2,
            19.4, 18.5, 17.7, 16.8, 16.0, 15.2, 14.4, 13.7,
            12.9, 12.2, 11.5, 10.8, 10.1, 9.5, 8.9, 8.4,
            7.8, 7.3, 6.8, 6.4, 6.0, 5.6, 5.2, 4.9,
            4.6, 4.3, 4.1, 3.9, 3.7, 3.5, 3.4, 3.3,
            3.1, 3.0, 2.9, 2.8, 2.7, 2.5, 2.3, 2.0
    };
    // used past the end of the table
    private static final double RMD_FLOOR_DIVISOR = 2.0;

    // Social Security PIA bend points on monthly average indexed earnings
    public static final double SS_FIRST_BEND = 1286;
    public static final double SS_SECOND_BEND = 7749;

    // earnings test: $1 withheld per $2 over the limit, $1 per $3 in the year FRA is reached
    public static final double SS_EARNINGS_EXEMPT = 23_400;
    public static final double SS_EARNINGS_EXEMPT_FRA_YEAR = 62_160;

    // Self-employment tax
    public static final double SS_WAGE_BASE = 184_500;
    public static final double SS_RATE_SELF_EMPLOYED = 0.124;
    public static final double MEDICARE_RATE_SELF_EMPLOYED = 0.029;
    public static final double ADDITIONAL_MEDICARE_THRESHOLD = 200_000;
    public static final double ADDITIONAL_MEDICARE_RATE = 0.009;
    // share of net self-employment earnings subject to SE tax
    public static final double SELF_EMPLOYMENT_FACTOR = 0.9235;

    public static final double NIIT_RATE = 0.038;

    // Estate tax: $15M / $30M exemption, indexed from 2027
    public static final double ESTATE_EXEMPTION_SINGLE = 15_000_000;
    public static final double ESTATE_EXEMPTION_MARRIED = 30_000_000;
    // exemption if the higher exemption sunsets
    public static final double ESTATE_SUNSET_EXEMPTION_SINGLE = 7_000_000;
    public static final double ESTATE_SUNSET_EXEMPTION_MARRIED = 14_000_000;
    public static final double ESTATE_EXEMPTION_INDEXING = 0.026;
    public static final int ESTATE_BASE_YEAR = 2026;

    /** Graduated estate tax schedule, applied to the amount above the exemption. */
    public static final List<Bracket> ESTATE_BRACKETS = brackets(
            10_000, 0.18,
            20_000, 0.20,
            40_000, 0.22,
            60_000, 0.24,
            80_000, 0.26,
            100_000, 0.28,
            150_000, 0.30,
            250_000, 0.32,
            500_000, 0.34,
            750_000, 0.37,
            1_000_000, 0.39,
            Double.POSITIVE_INFINITY, 0.40);

    private static final Schedule SINGLE = new Schedule(
            16_100,
            brackets(
                    12_400, 0.10,
                    50_400, 0.12,
                    105_700, 0.22,
                    201_775, 0.24,
                    256_225, 0.32,
                    640_600, 0.35,
                    Double.POSITIVE_INFINITY, 0.37),
            brackets(
                    49_450, 0.0,
                    545_500, 0.15,
                    Double.POSITIVE_INFINITY, 0.20),
            200_000,
            25_000, 34_000,
            new double[]{109_000, 137_000, 171_000, 205_000, 500_000});

    private static final Schedule MARRIED = new Schedule(
            32_200,
            brackets(
                    24_800, 0.10,
                    100_800, 0.12,
                    211_400, 0.22,
                    403_550, 0.24,
                    512_450, 0.32,
                    768_700, 0.35,
                    Double.POSITIVE_INFINITY, 0.37),
            brackets(
                    98_900, 0.0,
                    613_700, 0.15,
                    Double.POSITIVE_INFINITY, 0.20),
            250_000,
            32_000, 44_000,
            new double[]{218_000, 274_000, 342_000, 410_000, 750_000});

    // monthly Medicare Part B surcharge per IRMAA tier, the last entry applies above the top threshold
    private static final double[] IRMAA_SURCHARGES = {0, 81.20, 202.90, 324.60, 446.30, 487.00};

    private TaxTables() {
    }

    public static Schedule schedule(FilingStatus status) {
        return status.isMarried() ? MARRIED : SINGLE;
    }

    /**
     * @return the Uniform Lifetime divisor, or 0 before the RMD start age
     */
    public static double rmdDivisor(int age) {
        if (age < RMD_START_AGE) {
            return 0;
        }
        int index = age - RMD_START_AGE;
        return index < RMD_DIVISORS.length ? RMD_DIVISORS[index] : RMD_FLOOR_DIVISOR;
    }

    public static double irmaaSurcharge(int tier) {
        return IRMAA_SURCHARGES[tier];
    }

    private static List<Bracket> brackets(double... limitsAndRates) {
        Bracket[] result = new Bracket[limitsAndRates.length / 2];
        for (int i = 0; i < result.length; i++) {
            result[i] = new Bracket(limitsAndRates[2 * i], limitsAndRates[2 * i + 1]);
        }
        return Collections.unmodifiableList(Arrays.asList(result));
    }

    /** Upper limit of a bracket and the marginal rate applied below it. */
    public static final class Bracket {
        public final double limit;
        public final double rate;

        public Bracket(double limit, double rate) {
            this.limit = limit;
            this.rate = rate;
        }
    }

    /** Filing-status specific thresholds. */
    public static final class Schedule {
        public final double standardDeduction;
        /** Ordinary brackets on taxable income (after the deduction). */
        public final List<Bracket> ordinary;
        /** Capital gains brackets, stacked on top of ordinary income. */
        public final List<Bracket> capitalGains;
        public final double niitThreshold;
        public final double ssTier1;
        public final double ssTier2;
        final double[] irmaaThresholds;

        Schedule(double standardDeduction, List<Bracket> ordinary, List<Bracket> capitalGains,
                 double niitThreshold, double ssTier1, double ssTier2, double[] irmaaThresholds) {
            this.standardDeduction = standardDeduction;
            this.ordinary = ordinary;
            this.capitalGains = capitalGains;
            this.niitThreshold = niitThreshold;
            this.ssTier1 = ssTier1;
            this.ssTier2 = ssTier2;
            this.irmaaThresholds = irmaaThresholds;
        }

        /**
         * @return the IRMAA tier (0 = no surcharge) for the given modified AGI
         */
        public int irmaaTier(double magi) {
            for (int tier = 0; tier < irmaaThresholds.length; tier++) {
                if (magi <= irmaaThresholds[tier]) {
                    return tier;
                }
            }
            return irmaaThresholds.length;
        }
    }
}
