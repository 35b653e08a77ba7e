package com.gillianbc.planner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine tuning knobs bound from the {@code planner.*} section of application.yml.
 * Any section left out of the configuration falls back to the values in {@link #defaults()}.
 */
@ConfigurationProperties(prefix = "planner")
public record PlannerProperties(
        Simulation simulation,
        Dispatcher dispatcher,
        Legacy legacy,
        Guardrails guardrails,
        Roth roth
) {

    public PlannerProperties {
        if (simulation == null) {
            simulation = new Simulation(1000, 100, 0.025);
        }
        if (dispatcher == null) {
            dispatcher = new Dispatcher(Duration.ofSeconds(60));
        }
        if (legacy == null) {
            legacy = new Legacy(10_000, 20, 0.05);
        }
        if (guardrails == null) {
            guardrails = new Guardrails(0.10);
        }
        if (roth == null) {
            roth = new Roth(0.24);
        }
    }

    /**
     * @param paths            default number of Monte Carlo paths per batch
     * @param progressInterval paths between two progress events
     * @param trimFraction     share of outcomes dropped from each tail before percentiles are taken
     */
    public record Simulation(int paths, int progressInterval, double trimFraction) {
    }

    public record Dispatcher(Duration legacyTimeout) {
    }

    /**
     * @param capYears               longest legacy horizon simulated, in years
     * @param maxBackfillGenerations upper bound on synthetic descendant generations
     * @param perpetuitySafetyMargin extra estate required on top of the analytic perpetuity minimum
     */
    public record Legacy(int capYears, int maxBackfillGenerations, double perpetuitySafetyMargin) {
    }

    public record Guardrails(double spendingReduction) {
    }

    public record Roth(double targetBracketRate) {
    }

    /** Values matching application.yml, for code that runs without a Spring context. */
    public static PlannerProperties defaults() {
        return new PlannerProperties(null, null, null, null, null);
    }
}
