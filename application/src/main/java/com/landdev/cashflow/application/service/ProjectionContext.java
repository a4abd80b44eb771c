package com.landdev.cashflow.application.service;

import com.landdev.cashflow.application.engine.ContainerHierarchy;
import com.landdev.cashflow.domain.enums.AnalysisType;
import com.landdev.cashflow.domain.model.AbsorptionSchedule;
import com.landdev.cashflow.domain.model.CostSchedule;
import com.landdev.cashflow.domain.model.Loan;
import com.landdev.cashflow.domain.model.Period;
import com.landdev.cashflow.domain.model.PeriodCosts;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * Intermediate state of one projection run, up to and including the per-period cost context
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectionContext {

    private ProjectInputs inputs;
    private AnalysisType analysisType;
    private Set<Long> containerFilter;
    private boolean includeFinancing;
    private List<Loan> loansInScope;
    private List<Period> periods;
    private CostSchedule costSchedule;
    private AbsorptionSchedule absorption;
    private ContainerHierarchy hierarchy;
    private List<PeriodCosts> periodCosts;
}
