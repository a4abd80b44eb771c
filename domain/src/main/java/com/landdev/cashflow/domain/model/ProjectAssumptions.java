package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Project-level and DCF assumptions.
 * Rates here are fractions (0.10 = 10%).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectAssumptions {

    private Long projectId;

    private String projectName;

    /**
     * Raw analysis type as stored, e.g. "LOTBANK"; resolved by the engine
     */
    private String analysisType;

    /**
     * Date of the first projection period
     */
    private LocalDate analysisStartDate;

    /**
     * Optional horizon cap in months, applied when financing is included
     */
    private Integer holdPeriodMonths;

    private Double discountRate;

    /**
     * Annual sale price escalation
     */
    private Double priceGrowthRate;

    /**
     * Annual cost inflation for budget items without their own escalation rate
     */
    private Double costInflationRate;

    // Lotbank deal terms
    private Double managementFeePct;
    private Double defaultProvisionPct;
    private Double underwritingFee;
}
