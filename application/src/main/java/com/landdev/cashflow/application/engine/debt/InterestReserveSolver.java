package com.landdev.cashflow.application.engine.debt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.DoubleUnaryOperator;

/**
 * Fixed-point iteration for revolver interest-reserve sizing.
 * <p>
 * The reserve funds interest, interest depends on the commitment, and the commitment includes the reserve.
 * Starting from an initial guess, reserve(n+1) = f(reserve(n)) until two successive values differ by at most the
 * tolerance or the iteration cap is reached; the last value is used either way.
 */
@Component
public class InterestReserveSolver {

    private static final Logger log = LoggerFactory.getLogger(InterestReserveSolver.class);

    private final int maxIterations;
    private final double tolerance;

    public InterestReserveSolver(@Value("${app.projection.revolver.max-iterations:15}") int maxIterations,
                                 @Value("${app.projection.revolver.convergence-tolerance:1.0}") double tolerance) {
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public Result solve(double initialReserve, DoubleUnaryOperator nextReserve) {
        double reserve = initialReserve;
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            double next = nextReserve.applyAsDouble(reserve);
            if (Math.abs(next - reserve) <= tolerance) {
                log.debug("Interest reserve converged to {} after {} iterations", next, iteration);
                return new Result(next, iteration, true);
            }
            reserve = next;
        }
        log.warn("Interest reserve did not converge within {} iterations, using {}", maxIterations, reserve);
        return new Result(reserve, maxIterations, false);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

    /**
     * Solved reserve
     */
    public static class Result {
        private final double reserve;
        private final int iterations;
        private final boolean converged;

        public Result(double reserve, int iterations, boolean converged) {
            this.reserve = reserve;
            this.iterations = iterations;
            this.converged = converged;
        }

        public double getReserve() {
            return reserve;
        }

        public int getIterations() {
            return iterations;
        }

        public boolean isConverged() {
            return converged;
        }
    }
}
