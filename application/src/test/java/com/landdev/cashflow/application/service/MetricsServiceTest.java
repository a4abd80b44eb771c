package com.landdev.cashflow.application.service;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private MetricsService metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new MetricsService(meterRegistry);
    }

    @Test
    void testCountersAndTimers() {
        metricsService.recordProjectionRun();
        metricsService.recordProjectionTimeout();
        metricsService.recordProjectionFailure("ValidationException");
        Timer.Sample sample = metricsService.startTimer();
        metricsService.recordProjection(sample);

        assertEquals(1.0, meterRegistry.get("projection.runs").counter().count(), 0.0);
        assertEquals(1.0, meterRegistry.get("projection.timeouts").counter().count(), 0.0);
        assertEquals(1.0, meterRegistry.get("projection.failures").tag("reason", "ValidationException")
                .counter().count(), 0.0);
        assertEquals(1L, meterRegistry.get("projection.duration").timer().count());
    }

    @Test
    void testRevolverSolveRecordsIterations() {
        metricsService.recordRevolverSolve(metricsService.startTimer(), 4);
        metricsService.recordRevolverSolve(metricsService.startTimer(), 6);

        assertEquals(2L, meterRegistry.get("revolver.solver.time").timer().count());
        assertEquals(10.0, meterRegistry.get("revolver.solver.iterations").summary().totalAmount(), 0.0);
    }
}
