package com.gillianbc.planner.service;

import com.gillianbc.planner.config.PlannerProperties;
import com.gillianbc.planner.dispatch.ComputeDispatcher;
import com.gillianbc.planner.model.BatchSummary;
import com.gillianbc.planner.model.CalculationOptions;
import com.gillianbc.planner.model.CalculationResult;
import com.gillianbc.planner.model.GenerationalPayout;
import com.gillianbc.planner.model.GuardrailsResult;
import com.gillianbc.planner.model.LegacyOutcome;
import com.gillianbc.planner.model.LegacyPlan;
import com.gillianbc.planner.model.PathResult;
import com.gillianbc.planner.model.ProgressEvent;
import com.gillianbc.planner.model.RothConversionRequest;
import com.gillianbc.planner.model.RothConversionResult;
import com.gillianbc.planner.model.SimulationInputs;
import com.gillianbc.planner.model.SocialSecurityElection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Full calculation for one set of inputs: the Monte Carlo batch, the estate, and the optional
 * generational, guardrails and Roth conversion analyses, all run through the {@link ComputeDispatcher}.
 */
@Slf4j
@Service
public class RetirementCalculator {

    private final SimulationEngine engine;
    private final TaxModel taxModel;
    private final GenerationalWealthModel generationalWealthModel;
    private final ComputeDispatcher dispatcher;
    private final PlannerProperties properties;

    public RetirementCalculator(SimulationEngine engine, TaxModel taxModel,
                                GenerationalWealthModel generationalWealthModel,
                                ComputeDispatcher dispatcher, PlannerProperties properties) {
        this.engine = engine;
        this.taxModel = taxModel;
        this.generationalWealthModel = generationalWealthModel;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    public CompletableFuture<CalculationResult> calculate(SimulationInputs inputs) {
        return calculate(inputs, CalculationOptions.defaults(), event -> { });
    }

    /**
     * Validates the inputs on the calling thread, then runs everything else in the background.
     * A generational projection that times out or fails leaves the payout empty and is reported
     * through {@link CalculationResult#getGenerationalFailure()}.
     *
     * @throws com.gillianbc.planner.exception.ValidationException if the inputs are invalid
     */
    public CompletableFuture<CalculationResult> calculate(SimulationInputs inputs, CalculationOptions options,
                                                          Consumer<ProgressEvent> progress) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(progress, "progress must not be null");
        engine.validate(inputs);

        int paths = options.getPaths() > 0 ? options.getPaths() : properties.simulation().paths();
        log.info("Calculating {} paths for a {} household retiring at {}", paths,
                inputs.getFilingStatus(), inputs.getRetirementAge());

        return dispatcher.runBatch(inputs, options.getBaseSeed(), paths, progress)
                .thenCompose(batch -> analyse(inputs, options, batch, progress))
                .whenComplete((result, failure) -> {
                    if (failure == null) {
                        progress.accept(new ProgressEvent(ProgressEvent.Phase.DONE, 100, "Calculation complete"));
                        log.info("Calculation complete: success rate {}, median end-of-life wealth {}",
                                result.getSuccessRate(), result.getMedianEndOfLifeWealth());
                    }
                });
    }

    private CompletableFuture<CalculationResult> analyse(SimulationInputs inputs, CalculationOptions options,
                                                         BatchSummary batch, Consumer<ProgressEvent> progress) {
        progress.accept(new ProgressEvent(ProgressEvent.Phase.ANALYZING, 100, "Analysing simulated paths"));
        PathResult path = engine.runSingleSimulation(inputs, options.getBaseSeed());

        int yearsToEstate = inputs.horizon() - 1;
        double endOfLifeNominal = last(batch.nominalSeries(50));
        double endOfLifeReal = last(batch.realSeries(50));
        double estateTax = taxModel.estateTax(endOfLifeNominal, inputs.getFilingStatus(),
                options.getCurrentYear() + yearsToEstate, options.isEstateExemptionSunset());
        log.debug("Estate at year {}: {} nominal, {} estate tax", options.getCurrentYear() + yearsToEstate,
                String.format("%,.2f", endOfLifeNominal), String.format("%,.2f", estateTax));

        CalculationResult.CalculationResultBuilder result = CalculationResult.builder()
                .balanceAtRetirement(String.format("%,.2f", batch.getNominalBands().get(inputs.yearsToRetirement()).getP50()))
                .firstYearWithdrawal(String.format("%,.2f", batch.getFirstYearAfterTaxP50()))
                .medianEndOfLifeWealth(String.format("%,.2f", endOfLifeNominal))
                .successRate(String.format("%.1f%%", batch.successRate() * 100))
                .balanceAtRetirementNominal(batch.getNominalBands().get(inputs.yearsToRetirement()).getP50())
                .balanceAtRetirementReal(batch.getRealBands().get(inputs.yearsToRetirement()).getP50())
                .firstYearGrossWithdrawal(path.getFirstYearGrossWithdrawal())
                .firstYearAfterTaxReal(batch.getFirstYearAfterTaxP50())
                .endOfLifeNominal(endOfLifeNominal)
                .endOfLifeReal(endOfLifeReal)
                .estateTax(estateTax)
                .netEstate(endOfLifeNominal - estateTax)
                .probRuin(batch.getProbRuin())
                .firstYearTaxes(path.getFirstYearTaxes())
                .years(path.getYears())
                .batch(batch);

        CompletableFuture<GenerationalPayout> generational = generational(inputs, options, batch, progress);
        CompletableFuture<GuardrailsResult> guardrails = guardrails(options, batch);
        CompletableFuture<RothConversionResult> roth = roth(inputs, options, path);

        CompletableFuture<Throwable> generationalFailure = generational.handle((payout, failure) -> {
            if (failure == null) {
                return null;
            }
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause() : failure;
            log.warn("Generational projection failed: {}", cause.getMessage());
            return cause;
        });

        return CompletableFuture.allOf(generationalFailure, guardrails, roth)
                .thenApply(done -> result
                        .generationalPayout(generational.isCompletedExceptionally() ? null : generational.join())
                        .generationalFailure(generationalFailure.join())
                        .guardrails(guardrails.join())
                        .rothConversion(roth.join())
                        .build());
    }

    private CompletableFuture<GenerationalPayout> generational(SimulationInputs inputs, CalculationOptions options,
                                                               BatchSummary batch, Consumer<ProgressEvent> progress) {
        Optional<LegacyPlan> plan = generationalWealthModel.plan(inputs, batch, options.getGenerational(), options);
        if (plan.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        progress.accept(new ProgressEvent(ProgressEvent.Phase.LEGACY, 0, "Projecting generational wealth"));
        LegacyPlan legacy = plan.get();
        CompletableFuture<LegacyOutcome> p10 = dispatcher.runLegacy(legacy.getP10());
        CompletableFuture<LegacyOutcome> p50 = dispatcher.runLegacy(legacy.getP50());
        CompletableFuture<LegacyOutcome> p90 = dispatcher.runLegacy(legacy.getP90());
        return CompletableFuture.allOf(p10, p50, p90)
                .thenApply(done -> generationalWealthModel.assemble(legacy, p10.join(), p50.join(), p90.join()));
    }

    private CompletableFuture<GuardrailsResult> guardrails(CalculationOptions options, BatchSummary batch) {
        if (!options.isRunGuardrails() || batch.getProbRuin() <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        return dispatcher.runGuardrails(batch, properties.guardrails().spendingReduction());
    }

    private CompletableFuture<RothConversionResult> roth(SimulationInputs inputs, CalculationOptions options, PathResult path) {
        if (!options.isRunRothOptimizer() || path.getPretaxAtRetirement() <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        double targetRate = inputs.getRothConversionPolicy() != null
                ? inputs.getRothConversionPolicy().getTargetBracketRate()
                : properties.roth().targetBracketRate();
        RothConversionRequest request = RothConversionRequest.builder()
                .retirementAge(inputs.olderAge() + inputs.yearsToRetirement())
                .pretaxBalance(path.getPretaxAtRetirement())
                .filingStatus(inputs.getFilingStatus())
                .socialSecurityIncome(annualBenefit(inputs.getPrimarySocialSecurity())
                        + (inputs.isMarried() ? annualBenefit(inputs.getSpouseSocialSecurity()) : 0))
                .annualWithdrawal(path.getFirstYearGrossWithdrawal())
                .targetBracketRate(targetRate)
                .growthRate(inputs.getExpectedReturnPct() / 100.0)
                .lifeExpectancy(inputs.getLifeExpectancy())
                .build();
        return dispatcher.runRothOptimizer(request);
    }

    private double annualBenefit(SocialSecurityElection election) {
        return election.isEnabled()
                ? taxModel.socialSecurityBenefit(election.getAverageCareerIncome(), election.getClaimAge())
                : 0;
    }

    private static double last(double[] series) {
        return series.length == 0 ? 0 : series[series.length - 1];
    }
}
