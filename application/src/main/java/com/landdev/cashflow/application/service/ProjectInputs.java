package com.landdev.cashflow.application.service;

import com.landdev.cashflow.domain.model.AcquisitionCost;
import com.landdev.cashflow.domain.model.BudgetItem;
import com.landdev.cashflow.domain.model.Container;
import com.landdev.cashflow.domain.model.Loan;
import com.landdev.cashflow.domain.model.ParcelSale;
import com.landdev.cashflow.domain.model.ProjectAssumptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Every input record of one project, fully materialized before the engine runs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectInputs {

    private ProjectAssumptions assumptions;

    @Builder.Default
    private List<BudgetItem> budgetItems = new ArrayList<>();

    @Builder.Default
    private List<AcquisitionCost> acquisitionCosts = new ArrayList<>();

    @Builder.Default
    private List<ParcelSale> parcelSales = new ArrayList<>();

    @Builder.Default
    private List<Loan> loans = new ArrayList<>();

    @Builder.Default
    private List<Container> containers = new ArrayList<>();
}
