package com.landdev.cashflow.domain.model;

import com.landdev.cashflow.domain.enums.CostCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the cost schedule builder
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostSchedule {

    @Builder.Default
    private List<ScheduledCost> costs = new ArrayList<>();

    /**
     * Category totals in display order
     */
    @Builder.Default
    private Map<CostCategory, Double> categorySummary = new LinkedHashMap<>();

    private double totalCosts;

    private double[] periodTotals;

    /**
     * Share of the land purchase allocated to the filtered containers
     */
    private double acquisitionShare;
}
