package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * Node of the division/phase hierarchy.
 * Tier 1 nodes are divisions (products), tier 2 nodes are phases under a division.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Container {

    private Long containerId;

    private Long parentId;

    private int tier;

    private String name;

    // Lotbank pricing, only meaningful on divisions. Percentages are fractions.
    private Double retailLotPrice;
    private Double depositPct;
    private Double depositCapPct;
    private Double premiumPct;

    public boolean isDivision() {
        return tier == 1;
    }
}
