package com.landdev.cashflow.domain.model;

import com.landdev.cashflow.domain.enums.CostCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * A cost placed across projection periods, inflation applied. Amounts are positive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledCost {

    /**
     * "cost-{itemId}" for budget items, "acquisition" for the land purchase
     */
    private String lineId;

    private Long itemId;

    private String description;

    private CostCategory category;

    private Long containerId;

    private double[] amounts;

    private double total;
}
