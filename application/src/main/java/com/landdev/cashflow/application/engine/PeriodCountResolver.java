package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.model.BudgetItem;
import com.landdev.cashflow.domain.model.Loan;
import com.landdev.cashflow.domain.model.ParcelSale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Resolves the projection horizon in months.
 * <p>
 * Horizon = max(latest budget end period, latest sale period, 1). With financing the horizon is first raised to the
 * hold period, then extended to cover loan start + term of every loan in scope, and only then clipped to the hold
 * period, so a short hold period truncates loan tails.
 */
@Component
public class PeriodCountResolver {

    private static final Logger log = LoggerFactory.getLogger(PeriodCountResolver.class);

    public int resolve(List<BudgetItem> budgetItems, List<ParcelSale> sales, List<Loan> loansInScope,
                       LocalDate startDate, Integer holdPeriodMonths, boolean includeFinancing) {
        int count = 1;

        for (BudgetItem item : budgetItems) {
            if (item.getAmount() <= 0) {
                continue;
            }
            count = Math.max(count, budgetEndPeriod(item));
        }
        for (ParcelSale sale : sales) {
            if (sale.getSalePeriod() != null) {
                count = Math.max(count, sale.getSalePeriod());
            }
        }
        int base = count;

        if (includeFinancing) {
            boolean hasHold = holdPeriodMonths != null && holdPeriodMonths > 0;
            if (hasHold) {
                count = Math.max(count, holdPeriodMonths);
            }
            for (Loan loan : loansInScope) {
                Integer term = termMonths(loan);
                if (term == null) {
                    continue;
                }
                int loanStart = PeriodGenerator.monthsFromStart(startDate, loan.getLoanStartDate());
                count = Math.max(count, loanStart + term);
            }
            if (hasHold) {
                count = Math.min(count, holdPeriodMonths);
            }
        }

        log.debug("Resolved period count {} (budget/sales {}, financing {}, hold {})",
                count, base, includeFinancing, holdPeriodMonths);
        return count;
    }

    static int budgetEndPeriod(BudgetItem item) {
        if (item.getEndPeriod() != null && item.getEndPeriod() > 0) {
            return item.getEndPeriod();
        }
        int start = item.getStartPeriod() != null && item.getStartPeriod() > 0 ? item.getStartPeriod() : 1;
        int duration = item.getPeriodsToComplete() != null && item.getPeriodsToComplete() > 0
                ? item.getPeriodsToComplete() : 1;
        return start + duration - 1;
    }

    /**
     * Declared term in months; months take precedence over years. Null when neither is set.
     */
    public static Integer termMonths(Loan loan) {
        if (loan.getLoanTermMonths() != null && loan.getLoanTermMonths() > 0) {
            return loan.getLoanTermMonths();
        }
        if (loan.getLoanTermYears() != null && loan.getLoanTermYears() > 0) {
            return loan.getLoanTermYears() * 12;
        }
        return null;
    }
}
