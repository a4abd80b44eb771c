package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A display line. Costs and outflows are negative, revenue and inflows positive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItem {

    private String lineId;

    private String category;

    private String subcategory;

    private String description;

    private Long containerId;

    /**
     * Sparse, zero periods omitted
     */
    @Builder.Default
    private List<PeriodAmount> periods = new ArrayList<>();

    private double total;
}
