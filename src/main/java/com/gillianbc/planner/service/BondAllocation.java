package com.gillianbc.planner.service;

import com.gillianbc.planner.model.BondGlidePath;

/**
 * Bond share of the portfolio by age, and the blended return that results.
 */
public final class BondAllocation {

    // long-run nominal bond return in percent
    static final double BOND_NOMINAL_AVG = 4.5;
    // equity return the bond model is centred on
    private static final double STOCK_REFERENCE = 9.8;
    private static final double STOCK_SENSITIVITY = 0.3;

    private BondAllocation() {
    }

    /**
     * Bond return loosely tracking the equity return of the same year.
     */
    public static double bondReturn(double stockReturnPct) {
        return BOND_NOMINAL_AVG + (stockReturnPct - STOCK_REFERENCE) * STOCK_SENSITIVITY;
    }

    /**
     * @return bond allocation in percent (0..100) at the given age, 0 when there is no glide path
     */
    public static double bondPct(int age, BondGlidePath glidePath) {
        if (glidePath == null) {
            return 0;
        }
        switch (glidePath.getStrategy()) {
            case AGGRESSIVE:
                return 0;
            case AGE_BASED:
                if (age < 40) {
                    return 10;
                }
                if (age <= 60) {
                    return 10 + 50 * (age - 40) / 20.0;
                }
                return 60;
            default:
                return customPct(age, glidePath);
        }
    }

    public static double blendedReturn(double stockReturnPct, double bondReturnPct, double bondPct) {
        double bondShare = bondPct / 100.0;
        return (1 - bondShare) * stockReturnPct + bondShare * bondReturnPct;
    }

    private static double customPct(int age, BondGlidePath glidePath) {
        if (age < glidePath.getStartAge()) {
            return glidePath.getStartPct();
        }
        if (age >= glidePath.getEndAge()) {
            return glidePath.getEndPct();
        }
        double progress = (age - glidePath.getStartAge()) / (double) (glidePath.getEndAge() - glidePath.getStartAge());
        switch (glidePath.getShape()) {
            case ACCELERATED:
                progress = Math.sqrt(progress);
                break;
            case DECELERATED:
                progress = progress * progress;
                break;
            default:
                break;
        }
        return glidePath.getStartPct() + (glidePath.getEndPct() - glidePath.getStartPct()) * progress;
    }
}
