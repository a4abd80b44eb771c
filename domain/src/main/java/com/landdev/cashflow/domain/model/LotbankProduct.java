package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * A division participating in a lotbank deal. Percentages are fractions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotbankProduct {

    private Long productId;

    private String productName;

    private int lotCount;

    private double retailLotPrice;

    private double depositPct;

    private double depositCapPct;

    private double premiumPct;

    /**
     * Lots still optioned at the end of each period; non-increasing and never negative
     */
    private int[] lotsRemainingByPeriod;
}
