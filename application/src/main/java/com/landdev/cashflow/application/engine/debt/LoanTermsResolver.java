package com.landdev.cashflow.application.engine.debt;

import com.landdev.cashflow.application.engine.PeriodCountResolver;
import com.landdev.cashflow.application.engine.PeriodGenerator;
import com.landdev.cashflow.domain.enums.DrawTriggerType;
import com.landdev.cashflow.domain.enums.StructureType;
import com.landdev.cashflow.domain.exception.UnsupportedConfigurationException;
import com.landdev.cashflow.domain.exception.ValidationException;
import com.landdev.cashflow.domain.model.Loan;
import com.landdev.cashflow.domain.model.LoanTerms;
import com.landdev.cashflow.domain.model.Period;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes a loan record against the projection periods: percentages become fractions,
 * the term resolves to months and the start date to a period index.
 */
@Component
public class LoanTermsResolver {

    private static final Logger log = LoggerFactory.getLogger(LoanTermsResolver.class);

    /**
     * Reject loan configurations the engine does not model. Checked for every loan in scope before any
     * schedule is computed.
     */
    public void checkSupported(Loan loan) {
        if (loan.getTakesOutLoanId() != null) {
            log.warn("Loan {} takes out loan {}, refinancing chains are not supported",
                    loan.getLoanId(), loan.getTakesOutLoanId());
            throw new UnsupportedConfigurationException(String.format(
                    "Loan %d takes out loan %d: loan takeouts are not supported",
                    loan.getLoanId(), loan.getTakesOutLoanId()));
        }
        if (loan.getStructureType() == StructureType.REVOLVER
                && loan.getDrawTriggerType() != null
                && loan.getDrawTriggerType() != DrawTriggerType.COST_INCURRED) {
            log.warn("Revolver {} uses draw trigger {}", loan.getLoanId(), loan.getDrawTriggerType());
            throw new UnsupportedConfigurationException(String.format(
                    "Revolver %d: draw trigger %s is not supported, only COST_INCURRED",
                    loan.getLoanId(), loan.getDrawTriggerType()));
        }
    }

    public LoanTerms resolve(Loan loan, List<Period> periods) {
        checkSupported(loan);
        validate(loan);

        int horizon = periods.size();
        Integer declaredTerm = PeriodCountResolver.termMonths(loan);
        int termMonths = declaredTerm != null ? declaredTerm : horizon;

        double loanAmount = valueOf(loan.getLoanAmount());
        if (loanAmount == 0 && loan.getCommitmentAmount() != null) {
            loanAmount = loan.getCommitmentAmount();
        }
        double feePct = valueOf(loan.getOriginationFeePct()) / 100.0;
        double reserve = valueOf(loan.getInterestReserveAmount());
        double closing = valueOf(loan.getClosingCostAppraisal())
                + valueOf(loan.getClosingCostLegal())
                + valueOf(loan.getClosingCostOther());
        double netProceeds = loan.getNetLoanProceeds() != null
                ? loan.getNetLoanProceeds()
                : loanAmount - loanAmount * feePct - reserve - closing;

        LoanTerms terms = LoanTerms.builder()
                .loanId(loan.getLoanId())
                .loanName(loan.getLoanName() != null ? loan.getLoanName() : "Loan " + loan.getLoanId())
                .structureType(loan.getStructureType())
                .loanAmount(loanAmount)
                .annualRate(valueOf(loan.getInterestRatePct()) / 100.0)
                .startPeriod(PeriodGenerator.periodIndexForDate(periods, loan.getLoanStartDate()))
                .termMonths(termMonths)
                .amortizationMonths(loan.getAmortizationMonths() != null ? loan.getAmortizationMonths() : 0)
                .interestOnlyMonths(loan.getInterestOnlyMonths() != null ? loan.getInterestOnlyMonths() : 0)
                .originationFeePct(feePct)
                .interestReserve(reserve)
                .reserveInflator(loan.getInterestReserveInflator() != null ? loan.getInterestReserveInflator() : 1.0)
                .closingCosts(closing)
                .netProceeds(netProceeds)
                .loanToCost(valueOf(loan.getLoanToCostPct()) / 100.0)
                .drawTriggerType(loan.getDrawTriggerType() != null ? loan.getDrawTriggerType() : DrawTriggerType.COST_INCURRED)
                .releasePricePct(loan.getReleasePricePct() != null ? loan.getReleasePricePct() / 100.0 : 1.0)
                .minimumRelease(valueOf(loan.getMinimumReleaseAmount()))
                .repaymentAcceleration(loan.getRepaymentAcceleration() != null ? loan.getRepaymentAcceleration() : 1.0)
                .build();

        log.debug("Resolved loan {} ({}): start period {}, term {} months, rate {}",
                terms.getLoanId(), terms.getStructureType(), terms.getStartPeriod(), termMonths, terms.getAnnualRate());
        return terms;
    }

    private void validate(Loan loan) {
        List<String> errors = new ArrayList<>();
        if (loan.getStructureType() == null) {
            errors.add("Loan " + loan.getLoanId() + ": structure type is required");
        }
        if (valueOf(loan.getInterestRatePct()) < 0) {
            errors.add("Loan " + loan.getLoanId() + ": interest rate cannot be negative");
        }
        if (loan.getInterestReserveInflator() != null && loan.getInterestReserveInflator() >= 2.0) {
            errors.add("Loan " + loan.getLoanId() + ": interest reserve inflator must be below 2");
        }
        double ltc = valueOf(loan.getLoanToCostPct()) / 100.0;
        double fee = valueOf(loan.getOriginationFeePct()) / 100.0;
        if (ltc * fee >= 1.0) {
            errors.add("Loan " + loan.getLoanId() + ": loan-to-cost and origination fee leave no room for costs");
        }
        if (!errors.isEmpty()) {
            log.warn("Invalid loan {}: {}", loan.getLoanId(), errors);
            throw new ValidationException(errors);
        }
    }

    private static double valueOf(Double value) {
        return value != null ? value : 0.0;
    }
}
