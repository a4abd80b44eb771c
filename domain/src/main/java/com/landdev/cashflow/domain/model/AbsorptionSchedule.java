package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the absorption scheduler: sales grouped by period plus exact totals over included records
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AbsorptionSchedule {

    /**
     * Sorted by sale period
     */
    @Builder.Default
    private List<PeriodSales> periodSales = new ArrayList<>();

    private double totalGrossRevenue;
    private double totalNetRevenue;
    private double totalCommissions;
    private double totalClosingCosts;
    private double totalSubdivisionCosts;
    private int totalUnits;
    private int totalParcels;

    public List<ScheduledSale> allSales() {
        List<ScheduledSale> all = new ArrayList<>();
        periodSales.forEach(ps -> all.addAll(ps.getSales()));
        return all;
    }
}
