package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * Parcel-level sale assumption
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParcelSale {

    private Long parcelId;

    private String parcelCode;

    /**
     * Phase (or division) the parcel belongs to
     */
    private Long containerId;

    /**
     * 1-based period of the sale; absent means unscheduled
     */
    private Integer salePeriod;

    private Double units;

    private Double acres;

    private Double grossRevenue;

    private Double netRevenue;

    private Double commissions;

    /**
     * Legal, closing and title costs
     */
    private Double closingCosts;

    private Double subdivisionCosts;
}
