package com.landdev.cashflow.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Service for recording projection metrics
 */
@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter projectionRunsCounter;
    private final Counter projectionTimeoutsCounter;

    // Timers
    private final Timer projectionTimer;
    private final Timer revolverSolverTimer;

    private final DistributionSummary revolverIterations;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.projectionRunsCounter = Counter.builder("projection.runs")
                .description("Total number of projections computed")
                .register(meterRegistry);

        this.projectionTimeoutsCounter = Counter.builder("projection.timeouts")
                .description("Projections discarded by the caller timeout")
                .register(meterRegistry);

        this.projectionTimer = Timer.builder("projection.duration")
                .description("Projection computation time")
                .register(meterRegistry);

        this.revolverSolverTimer = Timer.builder("revolver.solver.time")
                .description("Revolver sizing and schedule time")
                .register(meterRegistry);

        this.revolverIterations = DistributionSummary.builder("revolver.solver.iterations")
                .description("Interest reserve fixed-point iterations per revolver")
                .register(meterRegistry);
    }

    public void recordProjectionRun() {
        projectionRunsCounter.increment();
    }

    public void recordProjectionFailure(String reason) {
        meterRegistry.counter("projection.failures", "reason", reason).increment();
    }

    public void recordProjectionTimeout() {
        projectionTimeoutsCounter.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordProjection(Timer.Sample sample) {
        sample.stop(projectionTimer);
    }

    public void recordRevolverSolve(Timer.Sample sample, int iterations) {
        sample.stop(revolverSolverTimer);
        revolverIterations.record(iterations);
    }
}
