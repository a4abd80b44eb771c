package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * A parcel sale with price escalation applied
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledSale {

    private Long parcelId;
    private String parcelCode;
    private Long containerId;
    private int salePeriod;
    private int periodIndex;
    private int units;
    private double acres;
    private double grossRevenue;
    private double netRevenue;
    private double commissions;
    private double closingCosts;
    private double subdivisionCosts;
}
