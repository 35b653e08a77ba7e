package com.gillianbc.planner.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Percentile view over all paths of a Monte Carlo batch.
 * <p>
 * The band lists hold one entry per simulated year, year 0 being today.
 */
@Value
@Builder
public class BatchSummary {

    @NonNull
    @Singular
    List<PercentileBand> realBands;
    @NonNull
    @Singular
    List<PercentileBand> nominalBands;
    double firstYearAfterTaxP25;
    double firstYearAfterTaxP50;
    double firstYearAfterTaxP75;
    @NonNull
    PercentileBand terminalReal;
    double probRuin;
    @NonNull
    @Singular
    List<RunOutcome> allRuns;
    long baseSeed;
    int paths;

    public int horizon() {
        return realBands.size();
    }

    public double successRate() {
        return 1.0 - probRuin;
    }

    /**
     * @param percentile one of 10, 25, 50, 75, 90
     * @return the real balance at that percentile for every year
     */
    public double[] realSeries(int percentile) {
        double[] series = new double[realBands.size()];
        for (int t = 0; t < series.length; t++) {
            series[t] = pick(realBands.get(t), percentile);
        }
        return series;
    }

    public double[] nominalSeries(int percentile) {
        double[] series = new double[nominalBands.size()];
        for (int t = 0; t < series.length; t++) {
            series[t] = pick(nominalBands.get(t), percentile);
        }
        return series;
    }

    private static double pick(PercentileBand band, int percentile) {
        switch (percentile) {
            case 10:
                return band.getP10();
            case 25:
                return band.getP25();
            case 50:
                return band.getP50();
            case 75:
                return band.getP75();
            case 90:
                return band.getP90();
            default:
                throw new IllegalArgumentException("percentile must be one of 10, 25, 50, 75, 90");
        }
    }
}
