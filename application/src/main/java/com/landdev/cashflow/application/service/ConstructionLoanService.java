package com.landdev.cashflow.application.service;

import com.landdev.cashflow.application.engine.debt.LoanTermsResolver;
import com.landdev.cashflow.application.engine.debt.RevolverScheduler;
import com.landdev.cashflow.domain.enums.StructureType;
import com.landdev.cashflow.domain.exception.NotFoundException;
import com.landdev.cashflow.domain.exception.ValidationException;
import com.landdev.cashflow.domain.model.Loan;
import com.landdev.cashflow.domain.model.LoanSchedule;
import com.landdev.cashflow.domain.model.LoanTerms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Standalone construction loan view: sizes and schedules one revolver against the whole project
 */
@Service
public class ConstructionLoanService {

    private static final Logger log = LoggerFactory.getLogger(ConstructionLoanService.class);

    private final ProjectionService projectionService;
    private final LoanTermsResolver termsResolver;
    private final RevolverScheduler revolverScheduler;

    public ConstructionLoanService(ProjectionService projectionService,
                                   LoanTermsResolver termsResolver,
                                   RevolverScheduler revolverScheduler) {
        this.projectionService = projectionService;
        this.termsResolver = termsResolver;
        this.revolverScheduler = revolverScheduler;
    }

    public LoanSchedule schedule(Long projectId, Long loanId) {
        ProjectionContext context = projectionService.prepare(projectId, List.of(), true);

        Loan loan = context.getInputs().getLoans().stream()
                .filter(l -> Objects.equals(l.getLoanId(), loanId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Loan", loanId));
        if (loan.getStructureType() != StructureType.REVOLVER) {
            throw new ValidationException("Loan " + loanId + " is not a revolver");
        }

        LoanTerms terms = termsResolver.resolve(loan, context.getPeriods());
        LoanSchedule schedule = revolverScheduler.schedule(terms, context.getPeriodCosts());
        log.info("Construction schedule for loan {} of project {}: commitment {}, net proceeds {}, {} iterations",
                loanId, projectId, schedule.getCommitment(), schedule.getNetProceeds(), schedule.getConvergenceIterations());
        return schedule;
    }
}
