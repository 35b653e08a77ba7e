package com.gillianbc.planner.service;

import com.gillianbc.planner.config.PlannerProperties;
import com.gillianbc.planner.model.BatchSummary;
import com.gillianbc.planner.model.PathResult;
import com.gillianbc.planner.model.PercentileBand;
import com.gillianbc.planner.model.ProgressEvent;
import com.gillianbc.planner.model.ReturnMode;
import com.gillianbc.planner.model.RunOutcome;
import com.gillianbc.planner.model.SimulationInputs;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * Runs many independent paths and reduces them to percentile bands and a probability of ruin.
 * <p>
 * Path seeds come from a generator seeded with the base seed, so a batch is repeatable
 * unless the return mode is {@link ReturnMode#UNSEEDED_RANDOM}, which draws a fresh base seed
 * every time.
 */
@Slf4j
@Service
public class BatchOrchestrator {

    private final SimulationEngine engine;
    private final PlannerProperties.Simulation settings;

    public BatchOrchestrator(SimulationEngine engine, PlannerProperties properties) {
        this.engine = engine;
        this.settings = properties.simulation();
    }

    /**
     * @throws com.gillianbc.planner.exception.ValidationException naming the first invalid input
     */
    public void validate(SimulationInputs inputs, int paths) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        if (paths <= 0) {
            throw new IllegalArgumentException("paths must be > 0");
        }
        engine.validate(inputs);
    }

    public BatchSummary runBatch(SimulationInputs inputs, long baseSeed, int paths) {
        return runBatch(inputs, baseSeed, paths, event -> { });
    }

    /**
     * @param progress receives a {@link ProgressEvent.Phase#SIMULATING} event every few paths and
     *                 once the last path has finished
     * @throws CancellationException if the running thread is interrupted; partial results are dropped
     */
    public BatchSummary runBatch(SimulationInputs inputs, long baseSeed, int paths, Consumer<ProgressEvent> progress) {
        Objects.requireNonNull(progress, "progress must not be null");
        validate(inputs, paths);

        long seedUsed = inputs.getReturnMode() == ReturnMode.UNSEEDED_RANDOM ? new Well19937c().nextLong() : baseSeed;
        RandomGenerator seeds = new Well19937c(seedUsed);
        int interval = Math.max(1, settings.progressInterval());

        log.info("Running {} paths, return mode {}, base seed {}", paths, inputs.getReturnMode(), seedUsed);
        List<PathResult> results = new ArrayList<>(paths);
        for (int i = 0; i < paths; i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Batch cancelled after {} of {} paths", i, paths);
                throw new CancellationException("Batch cancelled after " + i + " of " + paths + " paths");
            }
            results.add(engine.runSingleSimulation(inputs, seeds.nextLong()));
            int completed = i + 1;
            if (completed % interval == 0 || completed == paths) {
                progress.accept(new ProgressEvent(ProgressEvent.Phase.SIMULATING, completed * 100 / paths,
                        "Simulated " + completed + " of " + paths + " paths"));
            }
        }

        BatchSummary summary = summarise(results, seedUsed);
        log.info("Batch complete: probability of ruin {}, median terminal real balance {}",
                String.format("%.3f", summary.getProbRuin()),
                String.format("%,.2f", summary.getTerminalReal().getP50()));
        return summary;
    }

    BatchSummary summarise(List<PathResult> results, long seedUsed) {
        int paths = results.size();
        int horizon = results.get(0).getYears().size();
        double trim = settings.trimFraction();

        List<PercentileBand> realBands = new ArrayList<>(horizon);
        List<PercentileBand> nominalBands = new ArrayList<>(horizon);
        double[] real = new double[paths];
        double[] nominal = new double[paths];
        for (int t = 0; t < horizon; t++) {
            for (int p = 0; p < paths; p++) {
                real[p] = results.get(p).realBalance(t);
                nominal[p] = results.get(p).nominalBalance(t);
            }
            realBands.add(Percentiles.band(real, trim));
            nominalBands.add(Percentiles.band(nominal, trim));
        }

        double[] firstYear = new double[paths];
        double[] terminal = new double[paths];
        List<RunOutcome> outcomes = new ArrayList<>(paths);
        int ruined = 0;
        for (int p = 0; p < paths; p++) {
            PathResult path = results.get(p);
            firstYear[p] = path.getFirstYearAfterTaxReal();
            terminal[p] = path.getTerminalReal();
            outcomes.add(path.toOutcome());
            if (path.isRuined()) {
                ruined++;
            }
        }
        PercentileBand firstYearBand = Percentiles.band(firstYear, trim);

        return BatchSummary.builder()
                .realBands(realBands)
                .nominalBands(nominalBands)
                .firstYearAfterTaxP25(firstYearBand.getP25())
                .firstYearAfterTaxP50(firstYearBand.getP50())
                .firstYearAfterTaxP75(firstYearBand.getP75())
                .terminalReal(Percentiles.band(terminal, trim))
                .probRuin((double) ruined / paths)
                .allRuns(outcomes)
                .baseSeed(seedUsed)
                .paths(paths)
                .build();
    }
}
