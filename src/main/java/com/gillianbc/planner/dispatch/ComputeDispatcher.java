package com.gillianbc.planner.dispatch;

import com.gillianbc.planner.config.PlannerProperties;
import com.gillianbc.planner.exception.ComputationException;
import com.gillianbc.planner.exception.SimulationTimeoutException;
import com.gillianbc.planner.exception.ValidationException;
import com.gillianbc.planner.model.BatchSummary;
import com.gillianbc.planner.model.GuardrailsResult;
import com.gillianbc.planner.model.LegacyOutcome;
import com.gillianbc.planner.model.LegacyRequest;
import com.gillianbc.planner.model.ProgressEvent;
import com.gillianbc.planner.model.RothConversionRequest;
import com.gillianbc.planner.model.RothConversionResult;
import com.gillianbc.planner.model.SimulationInputs;
import com.gillianbc.planner.service.BatchOrchestrator;
import com.gillianbc.planner.service.GenerationalWealthModel;
import com.gillianbc.planner.service.GuardrailsAnalyzer;
import com.gillianbc.planner.service.RothConversionOptimizer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs simulations and analyses on one background thread, away from the caller.
 * <p>
 * Each call posts a {@link ComputeRequest} with its own correlation id and returns a future fed by
 * a per-request {@link ResponseChannel}. Requests run one at a time in submission order, and the
 * progress messages of a request always arrive before its result. Cancelling a returned future
 * interrupts the work if it has started; {@link #restart()} discards the context altogether.
 */
@Slf4j
@Service
public class ComputeDispatcher {

    private final BatchOrchestrator batchOrchestrator;
    private final GenerationalWealthModel generationalWealthModel;
    private final GuardrailsAnalyzer guardrailsAnalyzer;
    private final RothConversionOptimizer rothConversionOptimizer;
    private final Duration legacyTimeout;

    private final Map<String, ResponseChannel<?>> channels = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "planner-timeouts");
        thread.setDaemon(true);
        return thread;
    });
    private volatile ExecutorService executor = newContext();

    public ComputeDispatcher(BatchOrchestrator batchOrchestrator, GenerationalWealthModel generationalWealthModel,
                             GuardrailsAnalyzer guardrailsAnalyzer, RothConversionOptimizer rothConversionOptimizer,
                             PlannerProperties properties) {
        this.batchOrchestrator = batchOrchestrator;
        this.generationalWealthModel = generationalWealthModel;
        this.guardrailsAnalyzer = guardrailsAnalyzer;
        this.rothConversionOptimizer = rothConversionOptimizer;
        this.legacyTimeout = properties.dispatcher().legacyTimeout();
    }

    /**
     * @throws ValidationException on the calling thread, before anything is scheduled
     */
    public CompletableFuture<BatchSummary> runBatch(SimulationInputs inputs, long baseSeed, int paths,
                                                    Consumer<ProgressEvent> progress) {
        batchOrchestrator.validate(inputs, paths);
        return submit(MessageType.RUN, inputs, BatchSummary.class, progress,
                sink -> batchOrchestrator.runBatch(inputs, baseSeed, paths, sink), null);
    }

    /**
     * @throws SimulationTimeoutException through the future when the run exceeds the legacy timeout
     */
    public CompletableFuture<LegacyOutcome> runLegacy(LegacyRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return submit(MessageType.LEGACY, request, LegacyOutcome.class, null,
                sink -> generationalWealthModel.simulatePayout(request), legacyTimeout);
    }

    public CompletableFuture<GuardrailsResult> runGuardrails(BatchSummary batch, double spendingReduction) {
        Objects.requireNonNull(batch, "batch must not be null");
        return submit(MessageType.GUARDRAILS, batch, GuardrailsResult.class, null,
                sink -> guardrailsAnalyzer.analyze(batch, spendingReduction), null);
    }

    public CompletableFuture<RothConversionResult> runRothOptimizer(RothConversionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return submit(MessageType.ROTH_OPTIMIZER, request, RothConversionResult.class, null,
                sink -> rothConversionOptimizer.optimize(request), null);
    }

    /**
     * Terminates the background context, failing every open request with a
     * {@link CancellationException}, and starts a fresh one.
     */
    public synchronized void restart() {
        ExecutorService old = executor;
        executor = newContext();
        old.shutdownNow();
        int open = channels.size();
        channels.values().forEach(channel -> channel.fail(new CancellationException("Compute context restarted")));
        channels.clear();
        log.info("Compute context restarted, {} open requests cancelled", open);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        timer.shutdownNow();
        channels.values().forEach(channel -> channel.fail(new CancellationException("Compute context shut down")));
        channels.clear();
    }

    int openRequests() {
        return channels.size();
    }

    /**
     * Routes a message to the channel of its request.
     *
     * @return false when nobody is listening for it any more
     */
    boolean route(ComputeMessage message) {
        ResponseChannel<?> channel = channels.get(message.getRequestId());
        if (channel == null) {
            log.debug("No open channel for {} message {}", message.getType().wireName(), message.getRequestId());
            return false;
        }
        boolean delivered = channel.deliver(message);
        if (message.getType().isTerminal()) {
            channels.remove(message.getRequestId());
        }
        return delivered;
    }

    private <T> CompletableFuture<T> submit(MessageType type, Object params, Class<T> resultType,
                                            Consumer<ProgressEvent> progress, Work<T> work, Duration timeout) {
        ComputeRequest request = new ComputeRequest(nextId(type), type, params);
        ResponseChannel<T> channel = new ResponseChannel<>(request.getRequestId(), type.completion(), resultType, progress);
        channels.put(request.getRequestId(), channel);

        Future<?> task = executor.submit(() -> execute(request, work));
        ScheduledFuture<?> timeoutTask = timeout == null ? null : timer.schedule(() -> {
            if (channel.fail(new SimulationTimeoutException(request.getRequestId(), timeout))) {
                log.warn("Request {} timed out after {}", request.getRequestId(), timeout);
                task.cancel(true);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        CompletableFuture<T> future = channel.future();
        future.whenComplete((result, failure) -> {
            channels.remove(request.getRequestId());
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
            if (future.isCancelled()) {
                task.cancel(true);
            }
        });
        log.debug("Posted {} request {}", type.wireName(), request.getRequestId());
        return future;
    }

    private <T> void execute(ComputeRequest request, Work<T> work) {
        String id = request.getRequestId();
        if (!channels.containsKey(id)) {
            return;
        }
        try {
            T result = work.run(event -> route(new ComputeMessage(id, MessageType.PROGRESS, event)));
            route(new ComputeMessage(id, request.getType().completion(), result));
        } catch (ValidationException | CancellationException ex) {
            route(new ComputeMessage(id, MessageType.ERROR, ex));
        } catch (RuntimeException ex) {
            String reference = "SIM-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
            log.error("{} request failed (ref={}, requestId={}, error={})",
                    request.getType().wireName(), reference, id, ex.getMessage(), ex);
            route(new ComputeMessage(id, MessageType.ERROR,
                    new ComputationException("Simulation failed, error ref " + reference, ex)));
        }
    }

    private String nextId(MessageType type) {
        return type.wireName() + "-" + sequence.incrementAndGet();
    }

    private static ExecutorService newContext() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "planner-compute");
            thread.setDaemon(true);
            return thread;
        });
    }

    @FunctionalInterface
    private interface Work<T> {
        T run(Consumer<ProgressEvent> progress);
    }
}
