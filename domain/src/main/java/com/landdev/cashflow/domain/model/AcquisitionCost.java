package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * One-time land purchase cost record
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcquisitionCost {

    private Long acquisitionId;

    private String description;

    private double amount;

    /**
     * Only records applied to the purchase price enter the cost schedule
     */
    @Builder.Default
    private boolean appliedToPurchase = true;
}
