package com.landdev.cashflow.domain.provider;

import com.landdev.cashflow.domain.model.Loan;

import java.util.List;

/**
 * Read-only source of loan master records
 */
public interface LoanProvider {

    /**
     * Get all loans of a project, project-level and container-scoped
     */
    List<Loan> findLoans(Long projectId);
}
