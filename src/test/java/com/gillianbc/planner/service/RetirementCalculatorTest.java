package com.gillianbc.planner.service;

import com.gillianbc.planner.config.PlannerProperties;
import com.gillianbc.planner.dispatch.ComputeDispatcher;
import com.gillianbc.planner.exception.SimulationTimeoutException;
import com.gillianbc.planner.exception.ValidationException;
import com.gillianbc.planner.model.BatchSummary;
import com.gillianbc.planner.model.CalculationOptions;
import com.gillianbc.planner.model.CalculationResult;
import com.gillianbc.planner.model.GenerationalRequest;
import com.gillianbc.planner.model.ProgressEvent;
import com.gillianbc.planner.model.SimulationInputs;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class RetirementCalculatorTest {

    private final PlannerProperties properties = PlannerProperties.defaults();
    private final TaxModel taxModel = new TaxModel();
    private final SimulationEngine engine = new SimulationEngine(taxModel, new HealthcareCostModel(), new ReturnPathFactory());
    private final GenerationalWealthModel generationalWealthModel = new GenerationalWealthModel(taxModel, properties);
    private final ComputeDispatcher dispatcher = new ComputeDispatcher(
            new BatchOrchestrator(engine, properties),
            generationalWealthModel,
            new GuardrailsAnalyzer(properties),
            new RothConversionOptimizer(taxModel),
            properties);
    private final RetirementCalculator calculator =
            new RetirementCalculator(engine, taxModel, generationalWealthModel, dispatcher, properties);

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    @DisplayName("A full calculation fills in the summary and every requested analysis")
    void calculate_fullPipeline() throws Exception {
        SimulationInputs inputs = BatchOrchestratorTest.typicalSaver();
        CalculationOptions options = CalculationOptions.builder()
                .paths(200)
                .generational(GenerationalRequest.builder()
                        .beneficiaryAge(5)
                        .beneficiaryAge(30)
                        .perBeneficiaryPayout(5_000)
                        .build())
                .build();
        List<ProgressEvent> events = new CopyOnWriteArrayList<>();

        CalculationResult result = calculator.calculate(inputs, options, events::add).get(120, TimeUnit.SECONDS);
        log.info("Success rate {}, balance at retirement {}, median end-of-life wealth {}",
                result.getSuccessRate(), result.getBalanceAtRetirement(), result.getMedianEndOfLifeWealth());

        assertEquals(200, result.getBatch().getPaths());
        assertEquals(inputs.horizon(), result.getYears().size());
        assertThrows(UnsupportedOperationException.class, () -> result.getYears().clear());
        assertTrue(result.getBalanceAtRetirementNominal() > result.getBalanceAtRetirementReal());
        assertTrue(result.getSuccessRate().endsWith("%"));
        assertEquals(result.getEndOfLifeNominal() - result.getEstateTax(), result.getNetEstate(), 1e-6);
        assertTrue(result.getFirstYearGrossWithdrawal() > 0);
        assertTrue(result.generational().isPresent());
        assertFalse(result.generationalError().isPresent());
        assertEquals(result.getProbRuin() > 0, result.guardrailsResult().isPresent());
        assertTrue(result.rothConversionResult().isPresent());
        assertEquals(65, result.getRothConversion().getWindowStartAge());

        assertEquals(ProgressEvent.Phase.DONE, events.get(events.size() - 1).getPhase());
        assertTrue(events.stream().anyMatch(e -> e.getPhase() == ProgressEvent.Phase.ANALYZING));
        assertTrue(events.stream().anyMatch(e -> e.getPhase() == ProgressEvent.Phase.LEGACY));
    }

    @Test
    @DisplayName("A legacy timeout is reported on the result instead of an empty projection")
    void calculate_legacyTimeout_reported() throws Exception {
        PlannerProperties quick = new PlannerProperties(null,
                new PlannerProperties.Dispatcher(Duration.ofMillis(1)), null, null, null);
        ComputeDispatcher impatient = new ComputeDispatcher(
                new BatchOrchestrator(engine, quick),
                generationalWealthModel,
                new GuardrailsAnalyzer(quick),
                new RothConversionOptimizer(taxModel),
                quick);
        RetirementCalculator timed = new RetirementCalculator(engine, taxModel, generationalWealthModel, impatient, quick);
        CalculationOptions options = CalculationOptions.builder()
                .paths(100)
                .runGuardrails(false)
                .runRothOptimizer(false)
                .generational(GenerationalRequest.builder()
                        .beneficiaryAge(30)
                        .perBeneficiaryPayout(5_000)
                        .build())
                .build();
        try {
            CompletableFuture<CalculationResult> pending =
                    timed.calculate(BatchOrchestratorTest.typicalSaver(), options, event -> { });
            // queued behind the calculation's batch, so the legacy runs wait long enough to time out
            CompletableFuture<BatchSummary> blocker =
                    impatient.runBatch(BatchOrchestratorTest.typicalSaver(), 1L, 20_000, event -> { });

            CalculationResult result = pending.get(120, TimeUnit.SECONDS);
            blocker.cancel(true);

            assertFalse(result.generational().isPresent());
            assertTrue(result.generationalError().isPresent());
            assertInstanceOf(SimulationTimeoutException.class, result.getGenerationalFailure());
            assertTrue(result.getGenerationalFailure().getMessage().endsWith("1ms"));
        } finally {
            impatient.shutdown();
        }
    }

    @Test
    @DisplayName("Analyses that were switched off are left out")
    void calculate_optionalAnalysesOff() throws Exception {
        CalculationOptions options = CalculationOptions.builder()
                .paths(100)
                .runGuardrails(false)
                .runRothOptimizer(false)
                .build();

        CalculationResult result = calculator.calculate(BatchOrchestratorTest.typicalSaver(), options, event -> { })
                .get(120, TimeUnit.SECONDS);

        assertFalse(result.generational().isPresent());
        assertFalse(result.generationalError().isPresent());
        assertFalse(result.guardrailsResult().isPresent());
        assertFalse(result.rothConversionResult().isPresent());
    }

    @Test
    @DisplayName("Invalid inputs are rejected before anything is scheduled")
    void calculate_invalidInputs_throws() {
        SimulationInputs invalid = BatchOrchestratorTest.typicalSaver().toBuilder().withdrawalRatePct(150).build();

        assertThrows(ValidationException.class,
                () -> calculator.calculate(invalid, CalculationOptions.defaults(), event -> { }));
    }
}
