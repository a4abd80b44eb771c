package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Sales closing in one period
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodSales {

    private int salePeriod;

    private int periodIndex;

    @Builder.Default
    private List<ScheduledSale> sales = new ArrayList<>();

    private int units;
    private double grossRevenue;
    private double netRevenue;
    private double commissions;
    private double closingCosts;
    private double subdivisionCosts;
}
