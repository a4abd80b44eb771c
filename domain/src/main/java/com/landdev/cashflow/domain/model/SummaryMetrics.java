package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Investment metrics of a projection.
 * IRR, NPV, equity multiple, gross margin and payback are null when undefined.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryMetrics {

    // Revenue
    private double totalGrossRevenue;
    private double totalRevenueDeductions;
    private double totalNetRevenue;
    private double totalCommissions;
    private double totalTransactionCosts;
    private double totalSubdivisionCosts;
    private int totalUnits;

    // Costs
    private double totalCosts;

    @Builder.Default
    private Map<String, Double> costsByCategory = new LinkedHashMap<>();

    private double grossProfit;
    private Double grossMargin;

    private double totalFinancingCashFlow;

    // Cash flow
    private double totalCashIn;
    private double totalCashOut;
    private double netCashFlow;

    /**
     * Annual IRR over calendar-year buckets
     */
    private Double irr;

    private Double npv;

    private Double equityMultiple;

    /**
     * Largest capital commitment, reported as a positive amount
     */
    private double peakEquity;

    /**
     * Period index at which the cumulative cash flow recovers to non-negative
     */
    private Integer paybackPeriod;

    @Builder.Default
    private List<Double> cumulativeCashFlow = new ArrayList<>();

    @Builder.Default
    private Map<Integer, Double> annualCashFlows = new LinkedHashMap<>();
}
