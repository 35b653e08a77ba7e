package com.gillianbc.planner.service;

import com.gillianbc.planner.model.ReturnMode;
import com.gillianbc.planner.model.SimulationInputs;
import com.gillianbc.planner.model.WalkSeries;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Builds the sequence of annual gross return factors (1.07 for a 7% year) for one phase of a path.
 */
@Service
public class ReturnPathFactory {

    /**
     * @param inputs    supplies the return mode, expected return, inflation and glide path
     * @param years     number of factors to produce
     * @param startAge  age the glide path is evaluated at for the first factor
     * @param seed      seed of the bootstrap sampler, ignored unless the mode is random
     * @param startYear first calendar year replayed in HISTORICAL mode
     */
    public double[] annualFactors(SimulationInputs inputs, int years, int startAge, long seed, int startYear) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        if (years < 0) {
            throw new IllegalArgumentException("years must be >= 0");
        }
        double[] factors = new double[years];
        ReturnMode mode = inputs.getReturnMode();
        if (mode == ReturnMode.FIXED) {
            for (int i = 0; i < years; i++) {
                double pct = inputs.getExpectedReturnPct();
                if (inputs.getBondGlidePath() != null) {
                    double bondPct = BondAllocation.bondPct(startAge + i, inputs.getBondGlidePath());
                    pct = BondAllocation.blendedReturn(pct, BondAllocation.BOND_NOMINAL_AVG, bondPct);
                }
                factors[i] = 1 + pct / 100.0;
            }
            return factors;
        }

        double inflationFactor = 1 + inputs.getInflationPct() / 100.0;
        boolean real = inputs.getWalkSeries() == WalkSeries.REAL;
        int poolSize = MarketData.poolSize();
        RandomGenerator random = mode.isRandom() ? new Well19937c(seed) : null;
        int startIndex = startYear - MarketData.START_YEAR;

        for (int i = 0; i < years; i++) {
            int index = random != null ? random.nextInt(poolSize) : Math.floorMod(startIndex + i, poolSize);
            double stockPct = MarketData.poolReturn(index);
            double pct = stockPct;
            if (inputs.getBondGlidePath() != null) {
                double bondPct = BondAllocation.bondPct(startAge + i, inputs.getBondGlidePath());
                pct = BondAllocation.blendedReturn(stockPct, BondAllocation.bondReturn(stockPct), bondPct);
            }
            factors[i] = real ? (1 + pct / 100.0) / inflationFactor : 1 + pct / 100.0;
        }
        return factors;
    }
}
