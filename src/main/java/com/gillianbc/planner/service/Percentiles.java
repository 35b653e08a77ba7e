package com.gillianbc.planner.service;

import com.gillianbc.planner.model.PercentileBand;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

/**
 * Percentile bands over a set of path outcomes, with linear interpolation between order statistics.
 */
final class Percentiles {

    private Percentiles() {
    }

    /**
     * Sorts the values, drops trimFraction of them from each tail and returns p10..p90 of the rest.
     * Values are not modified.
     */
    static PercentileBand band(double[] values, double trimFraction) {
        if (values.length == 0) {
            return new PercentileBand(0, 0, 0, 0, 0);
        }
        double[] trimmed = trim(values, trimFraction);
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(trimmed);
        return new PercentileBand(
                percentile.evaluate(10),
                percentile.evaluate(25),
                percentile.evaluate(50),
                percentile.evaluate(75),
                percentile.evaluate(90));
    }

    static double[] trim(double[] values, double trimFraction) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int drop = (int) Math.floor(sorted.length * Math.max(0, trimFraction));
        if (sorted.length - 2 * drop < 1) {
            return sorted;
        }
        return Arrays.copyOfRange(sorted, drop, sorted.length - drop);
    }
}
