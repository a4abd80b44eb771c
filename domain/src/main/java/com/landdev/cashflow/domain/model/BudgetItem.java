package com.landdev.cashflow.domain.model;

import com.landdev.cashflow.domain.enums.CostCategory;
import com.landdev.cashflow.domain.enums.TimingMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * A funded budget line item
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetItem {

    private Long itemId;

    private String description;

    /**
     * Budget activity, e.g. "Planning" or "Improvements"; drives the display category
     */
    private String activity;

    /**
     * Explicit display category; overrides the activity mapping when present
     */
    private CostCategory category;

    private double amount;

    /**
     * 1-based period the spend starts in
     */
    private Integer startPeriod;

    private Integer periodsToComplete;

    /**
     * Optional 1-based last period, used only to size the projection horizon
     */
    private Integer endPeriod;

    private TimingMethod timingMethod;

    private Double curveSteepness;

    /**
     * Annual escalation as a percentage (3.0 = 3%)
     */
    private Double escalationRate;

    private Long containerId;
}
