package com.gillianbc.planner.service;

import com.gillianbc.planner.config.PlannerProperties;
import com.gillianbc.planner.exception.ValidationException;
import com.gillianbc.planner.model.BatchSummary;
import com.gillianbc.planner.model.GuardrailsResult;
import com.gillianbc.planner.model.RunOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Estimates how many failed paths a spending cut during bad markets would have rescued.
 * <p>
 * Failures early in retirement are the most preventable; a path that fails after decades of
 * withdrawals is rarely saved by trimming spending. The estimate works from the batch outcomes
 * alone and never changes the batch.
 */
@Slf4j
@Service
public class GuardrailsAnalyzer {

    // reduction the prevention rates are calibrated for
    private static final double REFERENCE_REDUCTION = 0.10;

    private final double defaultReduction;

    public GuardrailsAnalyzer(PlannerProperties properties) {
        this.defaultReduction = properties.guardrails().spendingReduction();
    }

    public GuardrailsResult analyze(BatchSummary batch) {
        return analyze(batch, defaultReduction);
    }

    /**
     * @param spendingReduction fraction of spending cut in a downturn, for example 0.10
     */
    public GuardrailsResult analyze(BatchSummary batch, double spendingReduction) {
        Objects.requireNonNull(batch, "batch must not be null");
        if (!Double.isFinite(spendingReduction) || spendingReduction < 0 || spendingReduction > 1) {
            throw new ValidationException("spendingReduction", "must be between 0 and 1");
        }
        List<RunOutcome> runs = batch.getAllRuns();
        if (runs.isEmpty()) {
            return new GuardrailsResult(spendingReduction, 0, 0, 1.0, 1.0);
        }

        double effectiveness = Math.min(1.0, spendingReduction / REFERENCE_REDUCTION);
        int failures = 0;
        double preventable = 0;
        for (RunOutcome run : runs) {
            if (run.isRuined()) {
                failures++;
                preventable += preventionRate(run.getSurvivalYears()) * effectiveness;
            }
        }
        if (failures == 0) {
            return new GuardrailsResult(spendingReduction, 0, 0, 1.0, 1.0);
        }

        int total = runs.size();
        double baseline = (double) (total - failures) / total;
        double improved = (total - failures + preventable) / total;
        log.debug("Guardrails at {}% reduction: {} failures, {} preventable",
                spendingReduction * 100, failures, String.format("%.1f", preventable));
        return new GuardrailsResult(spendingReduction, failures, (int) Math.round(preventable), baseline, improved);
    }

    static double preventionRate(int survivalYears) {
        if (survivalYears <= 5) {
            return 0.75;
        } else if (survivalYears <= 10) {
            return 0.65;
        } else if (survivalYears <= 15) {
            return 0.45;
        } else if (survivalYears <= 20) {
            return 0.30;
        } else if (survivalYears <= 25) {
            return 0.15;
        }
        return 0.05;
    }
}
