package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-period cost and lot-sale context consumed by the debt and lotbank engines
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodCosts {

    private int periodIndex;

    private double totalCosts;

    /**
     * Lots sold in this period keyed by product (division) id
     */
    @Builder.Default
    private Map<Long, Integer> lotsSoldByProduct = new LinkedHashMap<>();

    @Builder.Default
    private Map<Long, Double> costPerLotByProduct = new LinkedHashMap<>();

    public int getTotalLotsSold() {
        return lotsSoldByProduct.values().stream().mapToInt(Integer::intValue).sum();
    }
}
