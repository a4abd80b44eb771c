package com.landdev.cashflow.application.engine;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Internal rate of return of a periodic cash-flow series.
 * <p>
 * The search range is scanned for sign changes of NPV(rate), each refined with Brent's method; when there are
 * several roots the one closest to zero is returned. Returns null when the series has no sign change or no root
 * is found.
 */
@Component
public class IrrSolver {

    private static final Logger log = LoggerFactory.getLogger(IrrSolver.class);
    private static final int SCAN_STEPS = 400;

    private final double lowerBound;
    private final double upperBound;
    private final double tolerance;
    private final int maxEvaluations;

    public IrrSolver(@Value("${app.projection.irr.lower-bound:-0.99}") double lowerBound,
                     @Value("${app.projection.irr.upper-bound:10.0}") double upperBound,
                     @Value("${app.projection.irr.tolerance:1e-10}") double tolerance,
                     @Value("${app.projection.irr.max-iterations:1000}") int maxEvaluations) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.tolerance = tolerance;
        this.maxEvaluations = maxEvaluations;
    }

    public Double solve(double[] cashFlows) {
        if (cashFlows == null || cashFlows.length < 2 || !hasSignChange(cashFlows)) {
            return null;
        }
        UnivariateFunction npv = rate -> npv(rate, cashFlows);

        // Several sign changes can give several roots; the one nearest zero is taken
        Double best = null;
        double step = (upperBound - lowerBound) / SCAN_STEPS;
        double lo = lowerBound;
        double fLo = npv.value(lo);
        for (int i = 1; i <= SCAN_STEPS; i++) {
            double hi = lowerBound + i * step;
            double fHi = npv.value(hi);
            Double root = null;
            if (fLo == 0) {
                root = lo;
            } else if (Double.isFinite(fLo) && Double.isFinite(fHi) && fLo * fHi < 0) {
                root = refine(npv, lo, hi);
            } else if (i == SCAN_STEPS && fHi == 0) {
                root = hi;
            }
            if (root != null && (best == null || Math.abs(root) < Math.abs(best))) {
                best = root;
            }
            lo = hi;
            fLo = fHi;
        }
        if (best == null) {
            log.debug("No IRR bracket found in [{}, {}]", lowerBound, upperBound);
        }
        return best;
    }

    private Double refine(UnivariateFunction npv, double lo, double hi) {
        try {
            return new BrentSolver(tolerance).solve(maxEvaluations, npv, lo, hi);
        } catch (TooManyEvaluationsException | MathIllegalArgumentException e) {
            log.debug("IRR did not converge in [{}, {}]: {}", lo, hi, e.getMessage());
            return null;
        }
    }

    /**
     * Net present value with the first flow undiscounted at t = 0
     */
    public static double npv(double rate, double[] cashFlows) {
        double value = 0;
        double discount = 1.0;
        for (double cashFlow : cashFlows) {
            value += cashFlow / discount;
            discount *= 1.0 + rate;
        }
        return value;
    }

    private static boolean hasSignChange(double[] cashFlows) {
        boolean positive = false;
        boolean negative = false;
        for (double cashFlow : cashFlows) {
            positive |= cashFlow > 0;
            negative |= cashFlow < 0;
        }
        return positive && negative;
    }
}
