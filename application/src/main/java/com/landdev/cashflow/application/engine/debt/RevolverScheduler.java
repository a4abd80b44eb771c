package com.landdev.cashflow.application.engine.debt;

import com.landdev.cashflow.domain.model.LoanPeriod;
import com.landdev.cashflow.domain.model.LoanSchedule;
import com.landdev.cashflow.domain.model.LoanTerms;
import com.landdev.cashflow.domain.model.PeriodCosts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Construction revolver schedule.
 * <p>
 * Sizing: commitment = (project costs over every period + closing + reserve) * LTC / (1 - LTC * fee%), fee = commitment * fee%,
 * reserve solved by {@link InterestReserveSolver} as total interest / (2 - inflator). Without an LTC the stated
 * amount and reserve are used as is.
 * <p>
 * Schedule: the commitment left after reserve, fee and closing funds costs from the last in-term period backwards.
 * Origination (fee + closing) is recognised and capitalised at the start period. Interest accrues on the beginning
 * balance and capitalises; the reserve pays it down to zero without touching the loan balance. Release payments of
 * max(cost per lot * release% * acceleration, minimum) per lot sold are capped at the outstanding balance.
 */
@Component
public class RevolverScheduler {

    private static final Logger log = LoggerFactory.getLogger(RevolverScheduler.class);

    private final InterestReserveSolver reserveSolver;

    public RevolverScheduler(InterestReserveSolver reserveSolver) {
        this.reserveSolver = reserveSolver;
    }

    public LoanSchedule schedule(LoanTerms terms, List<PeriodCosts> periodCosts) {
        int periodCount = periodCosts.size();
        int start = Math.min(terms.getStartPeriod(), periodCount);
        int end = Math.min(start + terms.getTermMonths(), periodCount);

        double baseCosts = 0;
        for (PeriodCosts costs : periodCosts) {
            baseCosts += costs.getTotalCosts();
        }

        double reserve = terms.getInterestReserve();
        int iterations = 0;
        boolean converged = true;
        if (terms.getLoanToCost() > 0) {
            final double costs = baseCosts;
            double divisor = 2.0 - terms.getReserveInflator();
            InterestReserveSolver.Result result = reserveSolver.solve(reserve, current -> {
                Sizing sizing = size(terms, costs, current);
                return run(terms, sizing, periodCosts, start, end).totalInterest / divisor;
            });
            reserve = result.getReserve();
            iterations = result.getIterations();
            converged = result.isConverged();
        }

        Sizing sizing = size(terms, baseCosts, reserve);
        Run run = run(terms, sizing, periodCosts, start, end);

        LoanSchedule schedule = LoanSchedule.builder()
                .loanId(terms.getLoanId())
                .loanName(terms.getLoanName())
                .structureType(terms.getStructureType())
                .startPeriod(start)
                .termMonths(end - start)
                .periods(run.periods)
                .commitment(sizing.commitment)
                .interestReserve(sizing.reserve)
                .originationFee(sizing.fee)
                .closingCosts(terms.getClosingCosts())
                .netProceeds(sizing.commitment - sizing.fee - sizing.reserve - terms.getClosingCosts())
                .peakBalance(run.peakBalance)
                .peakBalancePct(sizing.commitment > 0 ? run.peakBalance / sizing.commitment * 100.0 : 0.0)
                .convergenceIterations(iterations)
                .converged(converged)
                .totalDrawn(run.totalDrawn)
                .totalInterest(run.totalInterest)
                .totalReleasePayments(run.totalRelease)
                .build();

        log.debug("Revolver {}: commitment {}, reserve {}, interest {}, peak balance {}, {} iterations",
                terms.getLoanId(), sizing.commitment, sizing.reserve, run.totalInterest, run.peakBalance, iterations);
        return schedule;
    }

    private Sizing size(LoanTerms terms, double baseCosts, double reserve) {
        double feePct = terms.getOriginationFeePct();
        double commitment;
        if (terms.getLoanToCost() > 0) {
            double ltc = terms.getLoanToCost();
            commitment = (baseCosts + terms.getClosingCosts() + reserve) * ltc / (1.0 - ltc * feePct);
        } else {
            commitment = terms.getLoanAmount();
        }
        return new Sizing(commitment, reserve, commitment * feePct);
    }

    private Run run(LoanTerms terms, Sizing sizing, List<PeriodCosts> periodCosts, int start, int end) {
        int periodCount = periodCosts.size();
        double available = Math.max(sizing.commitment - (sizing.reserve + sizing.fee + terms.getClosingCosts()), 0);

        double[] draws = new double[periodCount];
        double remaining = available;
        for (int p = end - 1; p >= start && remaining > 0; p--) {
            double draw = Math.min(Math.max(periodCosts.get(p).getTotalCosts(), 0), remaining);
            draws[p] = draw;
            remaining -= draw;
        }

        Run run = new Run();
        double monthlyRate = terms.getAnnualRate() / 12.0;
        double balance = 0;
        double reserveBalance = 0;
        double cumulativeDrawn = 0;
        double cumulativeInterest = 0;

        for (int p = 0; p < periodCount; p++) {
            if (p < start || p >= end) {
                run.periods.add(LoanPeriod.builder()
                        .periodIndex(p)
                        .beginningBalance(p >= end ? balance : 0)
                        .endingBalance(p >= end ? balance : 0)
                        .cumulativeDrawn(cumulativeDrawn)
                        .cumulativeInterest(cumulativeInterest)
                        .build());
                continue;
            }

            double beginning = balance;
            double origination = 0;
            if (p == start) {
                origination = sizing.fee + terms.getClosingCosts();
                balance += origination;
                reserveBalance = sizing.reserve;
            }

            double interest = beginning * monthlyRate;
            balance += draws[p] + interest;

            double reserveDraw = Math.min(interest, reserveBalance);
            reserveBalance -= reserveDraw;

            double release = Math.min(releasePayment(terms, periodCosts.get(p)), Math.max(balance, 0));
            balance = Math.max(balance - release, 0);

            cumulativeDrawn += draws[p];
            cumulativeInterest += interest;
            run.totalDrawn += draws[p];
            run.totalInterest += interest;
            run.totalRelease += release;
            run.peakBalance = Math.max(run.peakBalance, balance);

            run.periods.add(LoanPeriod.builder()
                    .periodIndex(p)
                    .beginningBalance(beginning)
                    .draw(draws[p])
                    .interest(interest)
                    .interestReserveDraw(reserveDraw)
                    .releasePayment(release)
                    .originationCost(origination)
                    .endingBalance(balance)
                    .cumulativeDrawn(cumulativeDrawn)
                    .cumulativeInterest(cumulativeInterest)
                    .netCashFlow(draws[p] - interest + reserveDraw - release - origination)
                    .build());
        }
        return run;
    }

    static double releasePayment(LoanTerms terms, PeriodCosts periodCosts) {
        double release = 0;
        for (Map.Entry<Long, Integer> sold : periodCosts.getLotsSoldByProduct().entrySet()) {
            if (sold.getValue() <= 0) {
                continue;
            }
            double costPerLot = periodCosts.getCostPerLotByProduct().getOrDefault(sold.getKey(), 0.0);
            double perLot = Math.max(costPerLot * terms.getReleasePricePct() * terms.getRepaymentAcceleration(),
                    terms.getMinimumRelease());
            release += perLot * sold.getValue();
        }
        return release;
    }

    private static final class Sizing {
        final double commitment;
        final double reserve;
        final double fee;

        Sizing(double commitment, double reserve, double fee) {
            this.commitment = commitment;
            this.reserve = reserve;
            this.fee = fee;
        }
    }

    private static final class Run {
        final List<LoanPeriod> periods = new ArrayList<>();
        double totalDrawn;
        double totalInterest;
        double totalRelease;
        double peakBalance;
    }
}
