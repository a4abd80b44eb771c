package com.landdev.cashflow.application.service;

import com.landdev.cashflow.domain.exception.NotFoundException;
import com.landdev.cashflow.domain.model.ProjectAssumptions;
import com.landdev.cashflow.domain.provider.BudgetItemProvider;
import com.landdev.cashflow.domain.provider.ContainerHierarchyProvider;
import com.landdev.cashflow.domain.provider.LoanProvider;
import com.landdev.cashflow.domain.provider.ParcelSaleProvider;
import com.landdev.cashflow.domain.provider.ProjectAssumptionProvider;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Materializes every input of a project from the read-only providers, behind a circuit breaker
 */
@Service
public class ProjectInputLoader {

    private static final Logger log = LoggerFactory.getLogger(ProjectInputLoader.class);

    private final ProjectAssumptionProvider assumptionProvider;
    private final BudgetItemProvider budgetItemProvider;
    private final ParcelSaleProvider parcelSaleProvider;
    private final LoanProvider loanProvider;
    private final ContainerHierarchyProvider containerProvider;
    private final CircuitBreaker circuitBreaker;

    public ProjectInputLoader(ProjectAssumptionProvider assumptionProvider,
                              BudgetItemProvider budgetItemProvider,
                              ParcelSaleProvider parcelSaleProvider,
                              LoanProvider loanProvider,
                              ContainerHierarchyProvider containerProvider,
                              @Qualifier("projectDataCircuitBreaker") CircuitBreaker circuitBreaker) {
        this.assumptionProvider = assumptionProvider;
        this.budgetItemProvider = budgetItemProvider;
        this.parcelSaleProvider = parcelSaleProvider;
        this.loanProvider = loanProvider;
        this.containerProvider = containerProvider;
        this.circuitBreaker = circuitBreaker;
    }

    public ProjectInputs load(Long projectId) {
        return circuitBreaker.executeSupplier(() -> doLoad(projectId));
    }

    private ProjectInputs doLoad(Long projectId) {
        ProjectAssumptions assumptions = assumptionProvider.findAssumptions(projectId)
                .orElseThrow(() -> {
                    log.warn("Project {} not found", projectId);
                    return new NotFoundException("Project", projectId);
                });

        ProjectInputs inputs = ProjectInputs.builder()
                .assumptions(assumptions)
                .budgetItems(budgetItemProvider.findBudgetItems(projectId))
                .acquisitionCosts(budgetItemProvider.findAcquisitionCosts(projectId))
                .parcelSales(parcelSaleProvider.findParcelSales(projectId))
                .loans(loanProvider.findLoans(projectId))
                .containers(containerProvider.findContainers(projectId))
                .build();

        log.debug("Loaded project {}: {} budget items, {} parcels, {} loans, {} containers",
                projectId, inputs.getBudgetItems().size(), inputs.getParcelSales().size(),
                inputs.getLoans().size(), inputs.getContainers().size());
        return inputs;
    }
}
