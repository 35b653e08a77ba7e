package com.gillianbc.planner.dispatch;

import com.gillianbc.planner.config.PlannerProperties;
import com.gillianbc.planner.exception.SimulationTimeoutException;
import com.gillianbc.planner.exception.ValidationException;
import com.gillianbc.planner.model.BatchSummary;
import com.gillianbc.planner.model.BeneficiaryCohort;
import com.gillianbc.planner.model.FilingStatus;
import com.gillianbc.planner.model.LegacyOutcome;
import com.gillianbc.planner.model.LegacyRequest;
import com.gillianbc.planner.model.ProgressEvent;
import com.gillianbc.planner.model.ReturnMode;
import com.gillianbc.planner.model.RothConversionRequest;
import com.gillianbc.planner.model.RothConversionResult;
import com.gillianbc.planner.model.SimulationInputs;
import com.gillianbc.planner.service.BatchOrchestrator;
import com.gillianbc.planner.service.GenerationalWealthModel;
import com.gillianbc.planner.service.GuardrailsAnalyzer;
import com.gillianbc.planner.service.HealthcareCostModel;
import com.gillianbc.planner.service.ReturnPathFactory;
import com.gillianbc.planner.service.RothConversionOptimizer;
import com.gillianbc.planner.service.SimulationEngine;
import com.gillianbc.planner.service.TaxModel;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class ComputeDispatcherTest {

    private static final long SEED = 12345L;

    private ComputeDispatcher dispatcher = dispatcher(PlannerProperties.defaults());

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    @DisplayName("A batch completes after all of its progress events")
    void runBatch_progressThenResult() throws Exception {
        List<ProgressEvent> events = new CopyOnWriteArrayList<>();

        BatchSummary summary = dispatcher.runBatch(saver(), SEED, 200, events::add).get(60, TimeUnit.SECONDS);

        assertEquals(200, summary.getAllRuns().size());
        assertEquals(2, events.size());
        assertEquals(ProgressEvent.Phase.SIMULATING, events.get(0).getPhase());
        assertEquals(100, events.get(events.size() - 1).getPercent());
    }

    @Test
    @DisplayName("Invalid inputs are rejected on the calling thread and nothing is queued")
    void runBatch_invalidInputs() {
        SimulationInputs invalid = saver().toBuilder().retirementAge(30).build();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> dispatcher.runBatch(invalid, SEED, 10, event -> { }));
        assertEquals("retirementAge", ex.getField());
        assertEquals(0, dispatcher.openRequests());
    }

    @Test
    @DisplayName("A legacy request stuck behind a long batch times out")
    void runLegacy_timesOut() {
        dispatcher.shutdown();
        dispatcher = dispatcher(new PlannerProperties(null, new PlannerProperties.Dispatcher(Duration.ofMillis(50)), null, null, null));

        CompletableFuture<BatchSummary> blocker = dispatcher.runBatch(saver(), SEED, 20_000, event -> { });
        CompletableFuture<LegacyOutcome> legacy = dispatcher.runLegacy(legacyRequest());

        ExecutionException ex = assertThrows(ExecutionException.class, () -> legacy.get(30, TimeUnit.SECONDS));
        assertInstanceOf(SimulationTimeoutException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().endsWith("after 50ms"));
        blocker.cancel(true);
    }

    @Test
    @DisplayName("A legacy request within its time limit returns the outcome")
    void runLegacy_completes() throws Exception {
        LegacyOutcome outcome = dispatcher.runLegacy(legacyRequest()).get(30, TimeUnit.SECONDS);

        assertTrue(outcome.isPerpetual());
    }

    @Test
    @DisplayName("Requests posted back to back each receive their own outcome")
    void runLegacy_eachRequestGetsItsOwnResult() throws Exception {
        LegacyRequest depleting = LegacyRequest.builder()
                .fundReal(100_000)
                .realReturn(0)
                .perBeneficiaryPayout(50_000)
                .cohort(new BeneficiaryCohort(30, 1, 0))
                .capYears(100)
                .build();

        CompletableFuture<LegacyOutcome> first = dispatcher.runLegacy(legacyRequest());
        CompletableFuture<LegacyOutcome> second = dispatcher.runLegacy(depleting);
        CompletableFuture<LegacyOutcome> third = dispatcher.runLegacy(legacyRequest());

        LegacyOutcome lasting = first.get(30, TimeUnit.SECONDS);
        LegacyOutcome depleted = second.get(30, TimeUnit.SECONDS);
        assertTrue(lasting.isPerpetual());
        assertEquals(0, lasting.getYears());
        assertFalse(depleted.isPerpetual());
        assertEquals(2, depleted.getYears());
        assertTrue(third.get(30, TimeUnit.SECONDS).isPerpetual());
    }

    @Test
    @DisplayName("The Roth optimiser runs through the dispatcher")
    void runRothOptimizer_completes() throws Exception {
        RothConversionResult result = dispatcher.runRothOptimizer(RothConversionRequest.builder()
                .retirementAge(65)
                .pretaxBalance(1_000_000)
                .build()).get(30, TimeUnit.SECONDS);

        assertEquals(65, result.getWindowStartAge());
        assertFalse(result.getConversions().isEmpty());
    }

    @Test
    @DisplayName("Restarting the context cancels every open request")
    void restart_cancelsOpenRequests() {
        CompletableFuture<BatchSummary> running = dispatcher.runBatch(saver(), SEED, 20_000, event -> { });
        CompletableFuture<LegacyOutcome> queued = dispatcher.runLegacy(legacyRequest());

        dispatcher.restart();

        assertThrows(CancellationException.class, running::join);
        assertThrows(CancellationException.class, queued::join);
        assertEquals(0, dispatcher.openRequests());
    }

    @Test
    @DisplayName("The context keeps working after a restart")
    void restart_thenRunAgain() throws Exception {
        dispatcher.restart();

        LegacyOutcome outcome = dispatcher.runLegacy(legacyRequest()).get(30, TimeUnit.SECONDS);

        assertTrue(outcome.isPerpetual());
    }

    @Test
    @DisplayName("Messages for unknown requests are dropped")
    void route_unknownRequest() {
        assertFalse(dispatcher.route(new ComputeMessage("run-999", MessageType.PROGRESS,
                new ProgressEvent(ProgressEvent.Phase.SIMULATING, 10, "late"))));
    }

    @Test
    @DisplayName("Wire names and the completion each request is answered with")
    void messageTypes() {
        assertEquals("legacy-complete", MessageType.LEGACY_COMPLETE.wireName());
        assertEquals(MessageType.COMPLETE, MessageType.RUN.completion());
        assertEquals(MessageType.GUARDRAILS_COMPLETE, MessageType.GUARDRAILS.completion());
        assertTrue(MessageType.ERROR.isTerminal());
        assertFalse(MessageType.PROGRESS.isTerminal());
        assertThrows(IllegalStateException.class, MessageType.PROGRESS::completion);
    }

    private static ComputeDispatcher dispatcher(PlannerProperties properties) {
        TaxModel taxModel = new TaxModel();
        SimulationEngine engine = new SimulationEngine(taxModel, new HealthcareCostModel(), new ReturnPathFactory());
        return new ComputeDispatcher(
                new BatchOrchestrator(engine, properties),
                new GenerationalWealthModel(taxModel, properties),
                new GuardrailsAnalyzer(properties),
                new RothConversionOptimizer(taxModel),
                properties);
    }

    private static SimulationInputs saver() {
        return SimulationInputs.builder()
                .primaryAge(35)
                .retirementAge(65)
                .filingStatus(FilingStatus.SINGLE)
                .primaryIncome(100_000)
                .taxableBalance(50_000)
                .pretaxBalance(150_000)
                .rothBalance(25_000)
                .expectedReturnPct(9.8)
                .inflationPct(2.6)
                .withdrawalRatePct(3.5)
                .returnMode(ReturnMode.SEEDED_RANDOM)
                .build();
    }

    private static LegacyRequest legacyRequest() {
        return LegacyRequest.builder()
                .fundReal(5_000_000)
                .realReturn(0.04)
                .perBeneficiaryPayout(20_000)
                .cohort(new BeneficiaryCohort(30, 2, 0))
                .build();
    }
}
