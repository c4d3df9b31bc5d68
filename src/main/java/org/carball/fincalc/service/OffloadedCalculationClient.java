package org.carball.fincalc.service;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.config.EngineSettings;
import org.carball.fincalc.engine.StandardMetricsEngine;
import org.carball.fincalc.model.scenario.ScenarioInput;
import org.carball.fincalc.model.scenario.StandardMetricsResult;
import org.carball.fincalc.validation.InputValidator;

import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes long scenarios on a worker pool and short ones inline. Any worker timeout or
 * failure falls back to computing the same scenario synchronously, without retrying the worker.
 */
@Slf4j
public class OffloadedCalculationClient implements AutoCloseable {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    private final StandardMetricsEngine engine;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final int thresholdMonths;
    private final long timeoutMillis;
    private final AtomicInteger fallbackCount = new AtomicInteger();

    public OffloadedCalculationClient() {
        this(EngineSettings.defaults());
    }

    public OffloadedCalculationClient(EngineSettings settings) {
        this(new StandardMetricsEngine(settings), newWorkerPool(settings.getWorkerThreads()), true, settings);
    }

    public OffloadedCalculationClient(StandardMetricsEngine engine, ExecutorService executor, EngineSettings settings) {
        this(engine, executor, false, settings);
    }

    private OffloadedCalculationClient(StandardMetricsEngine engine, ExecutorService executor,
                                       boolean ownsExecutor, EngineSettings settings) {
        this.engine = engine;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.thresholdMonths = settings.getOffloadThresholdMonths();
        this.timeoutMillis = settings.getOffloadTimeoutMillis();
    }

    private static ExecutorService newWorkerPool(int threads) {
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "fincalc-worker-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public boolean shouldOffload(ScenarioInput input) {
        return input.getProjectDuration() >= thresholdMonths;
    }

    public StandardMetricsResult calculate(ScenarioInput input) {
        InputValidator.validate(input);

        if (!shouldOffload(input)) {
            log.debug("Computing {} month scenario synchronously", input.getProjectDuration());
            return engine.calculate(input);
        }

        CalculationRequest request = new CalculationRequest(UUID.randomUUID().toString(), input);
        log.debug("Offloading request {} ({} months)", request.requestId(), input.getProjectDuration());
        Future<CalculationResponse> future = executor.submit(new CalculationWorker(engine, request));

        try {
            CalculationResponse response = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (response.isSuccess()) {
                return response.result();
            }
            log.warn("Worker failed request {}: {}, falling back to sync", request.requestId(), response.error());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Worker timed out after {} ms on request {}, falling back to sync", timeoutMillis, request.requestId());
        } catch (ExecutionException e) {
            log.warn("Worker error on request {}: {}, falling back to sync", request.requestId(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for request {}, falling back to sync", request.requestId());
        }

        fallbackCount.incrementAndGet();
        return engine.calculate(input);
    }

    public int getFallbackCount() {
        return fallbackCount.get();
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }
}
