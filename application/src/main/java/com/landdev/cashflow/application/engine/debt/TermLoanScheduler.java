package com.landdev.cashflow.application.engine.debt;

import com.landdev.cashflow.domain.model.LoanPeriod;
import com.landdev.cashflow.domain.model.LoanSchedule;
import com.landdev.cashflow.domain.model.LoanTerms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Term loan schedule: funded once at the start period net of fees, interest-only for the IO months (or for the whole
 * term without amortization), then a level payment over the amortization months. A balance left at maturity is paid
 * as a balloon in the final term period. The term is clipped to the projection horizon.
 */
@Component
public class TermLoanScheduler {

    private static final Logger log = LoggerFactory.getLogger(TermLoanScheduler.class);

    public LoanSchedule schedule(LoanTerms terms, int periodCount) {
        int start = terms.getStartPeriod();
        int term = Math.max(Math.min(terms.getTermMonths(), periodCount - start), 0);
        double principal = terms.getLoanAmount();
        double monthlyRate = terms.getAnnualRate() / 12.0;
        int amortizationMonths = terms.getAmortizationMonths();

        double interestOnlyPayment = principal * monthlyRate;
        double amortizingPayment = amortizationMonths > 0 ? payment(monthlyRate, amortizationMonths, principal) : 0.0;

        List<LoanPeriod> periods = new ArrayList<>(periodCount);
        double balance = 0;
        double totalInterest = 0;
        double totalPrincipal = 0;
        double balloonPayment = 0;
        double cumulativeInterest = 0;

        for (int p = 0; p < periodCount; p++) {
            int month = p - start;
            if (month < 0 || month >= term) {
                periods.add(LoanPeriod.builder()
                        .periodIndex(p)
                        .cumulativeDrawn(month < 0 || term == 0 ? 0 : principal)
                        .cumulativeInterest(cumulativeInterest)
                        .build());
                continue;
            }

            double draw = 0;
            double proceeds = 0;
            if (month == 0) {
                balance = principal;
                draw = principal;
                proceeds = terms.getNetProceeds();
            }

            double beginning = balance;
            double interest = balance * monthlyRate;
            double payment;
            double principalPaid;
            if (amortizationMonths == 0 || month < terms.getInterestOnlyMonths()) {
                payment = interest;
                principalPaid = 0;
            } else {
                payment = amortizingPayment;
                principalPaid = payment - interest;
                if (principalPaid > balance) {
                    principalPaid = balance;
                    payment = interest + balance;
                }
            }
            balance -= principalPaid;

            double balloon = 0;
            if (month == term - 1 && balance > 0) {
                balloon = balance;
                balance = 0;
            }

            totalInterest += interest;
            totalPrincipal += principalPaid + balloon;
            balloonPayment += balloon;
            cumulativeInterest += interest;

            periods.add(LoanPeriod.builder()
                    .periodIndex(p)
                    .beginningBalance(beginning)
                    .draw(draw)
                    .interest(interest)
                    .payment(payment)
                    .principal(principalPaid)
                    .balloon(balloon)
                    .endingBalance(balance)
                    .cumulativeDrawn(principal)
                    .cumulativeInterest(cumulativeInterest)
                    .netCashFlow(proceeds - payment - balloon)
                    .build());
        }

        log.debug("Term loan {}: principal {}, {} months from period {}, IO payment {}, amortizing payment {}, balloon {}",
                terms.getLoanId(), principal, term, start, interestOnlyPayment, amortizingPayment, balloonPayment);
        return LoanSchedule.builder()
                .loanId(terms.getLoanId())
                .loanName(terms.getLoanName())
                .structureType(terms.getStructureType())
                .startPeriod(start)
                .termMonths(term)
                .periods(periods)
                .commitment(principal)
                .interestReserve(terms.getInterestReserve())
                .originationFee(principal * terms.getOriginationFeePct())
                .closingCosts(terms.getClosingCosts())
                .netProceeds(terms.getNetProceeds())
                .peakBalance(term > 0 ? principal : 0)
                .interestOnlyPayment(interestOnlyPayment)
                .amortizingPayment(amortizingPayment)
                .totalDrawn(term > 0 ? principal : 0)
                .totalInterest(totalInterest)
                .totalPrincipal(totalPrincipal)
                .balloonPayment(balloonPayment)
                .converged(true)
                .build();
    }

    /**
     * Level annuity payment; straight-line when the rate is zero
     */
    public static double payment(double monthlyRate, int months, double principal) {
        if (months <= 0) {
            return 0.0;
        }
        if (monthlyRate == 0) {
            return principal / months;
        }
        return principal * monthlyRate / (1.0 - Math.pow(1.0 + monthlyRate, -months));
    }
}
