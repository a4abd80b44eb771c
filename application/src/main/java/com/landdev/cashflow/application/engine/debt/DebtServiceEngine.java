package com.landdev.cashflow.application.engine.debt;

import com.landdev.cashflow.domain.enums.StructureType;
import com.landdev.cashflow.domain.model.Loan;
import com.landdev.cashflow.domain.model.LoanSchedule;
import com.landdev.cashflow.domain.model.LoanTerms;
import com.landdev.cashflow.domain.model.Period;
import com.landdev.cashflow.domain.model.PeriodCosts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Computes one schedule per loan. Loans are independent of each other and processed in loan id order.
 */
@Service
public class DebtServiceEngine {

    private static final Logger log = LoggerFactory.getLogger(DebtServiceEngine.class);

    private final LoanTermsResolver termsResolver;
    private final RevolverScheduler revolverScheduler;
    private final TermLoanScheduler termLoanScheduler;

    public DebtServiceEngine(LoanTermsResolver termsResolver,
                             RevolverScheduler revolverScheduler,
                             TermLoanScheduler termLoanScheduler) {
        this.termsResolver = termsResolver;
        this.revolverScheduler = revolverScheduler;
        this.termLoanScheduler = termLoanScheduler;
    }

    public List<LoanSchedule> schedule(List<Loan> loans, List<Period> periods, List<PeriodCosts> periodCosts) {
        List<Loan> ordered = sortByLoanId(loans);
        // Fail before computing anything when one loan in scope is unsupported
        ordered.forEach(termsResolver::checkSupported);

        List<LoanSchedule> schedules = new ArrayList<>(ordered.size());
        for (Loan loan : ordered) {
            schedules.add(schedule(termsResolver.resolve(loan, periods), periodCosts));
        }
        log.debug("Computed {} loan schedules over {} periods", schedules.size(), periods.size());
        return schedules;
    }

    public LoanSchedule schedule(LoanTerms terms, List<PeriodCosts> periodCosts) {
        if (terms.getStructureType() == StructureType.REVOLVER) {
            return revolverScheduler.schedule(terms, periodCosts);
        }
        return termLoanScheduler.schedule(terms, periodCosts.size());
    }

    /**
     * Loans applying to a container filter: project-level loans plus loans assigned to a filtered container.
     * Without a filter every loan applies.
     */
    public static List<Loan> loansInScope(List<Loan> loans, Collection<Long> containerFilter) {
        if (containerFilter == null || containerFilter.isEmpty()) {
            return sortByLoanId(loans);
        }
        return sortByLoanId(loans.stream()
                .filter(loan -> loan.getContainerIds() == null
                        || loan.getContainerIds().isEmpty()
                        || loan.getContainerIds().stream().anyMatch(containerFilter::contains))
                .collect(Collectors.toList()));
    }

    private static List<Loan> sortByLoanId(List<Loan> loans) {
        return loans.stream()
                .sorted(Comparator.comparing(Loan::getLoanId, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }
}
