package com.landdev.cashflow.domain.provider;

import com.landdev.cashflow.domain.model.AcquisitionCost;
import com.landdev.cashflow.domain.model.BudgetItem;

import java.util.List;

/**
 * Read-only source of budget line items and land purchase costs
 */
public interface BudgetItemProvider {

    /**
     * Get every budget item of a project, across all containers
     */
    List<BudgetItem> findBudgetItems(Long projectId);

    /**
     * Get the acquisition cost records of a project
     */
    List<AcquisitionCost> findAcquisitionCosts(Long projectId);
}
