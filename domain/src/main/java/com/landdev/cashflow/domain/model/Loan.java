package com.landdev.cashflow.domain.model;

import com.landdev.cashflow.domain.enums.DrawTriggerType;
import com.landdev.cashflow.domain.enums.StructureType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Loan master record.
 * Percentages are stored as percent values (6.5 = 6.5%).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Loan {

    private Long loanId;

    private String loanName;

    private StructureType structureType;

    private Double loanAmount;

    private Double commitmentAmount;

    private Double interestRatePct;

    private LocalDate loanStartDate;

    private Integer loanTermMonths;

    private Integer loanTermYears;

    private Integer amortizationMonths;

    private Integer interestOnlyMonths;

    // Fees and reserve
    private Double originationFeePct;
    private Double interestReserveAmount;
    private Double interestReserveInflator;
    private Double closingCostAppraisal;
    private Double closingCostLegal;
    private Double closingCostOther;
    private Double netLoanProceeds;

    // Revolver sizing and repayment
    private Double loanToCostPct;
    private DrawTriggerType drawTriggerType;
    private Double releasePricePct;
    private Double minimumReleaseAmount;
    private Double repaymentAcceleration;

    /**
     * Loan refinanced by this one. Not supported.
     */
    private Long takesOutLoanId;

    /**
     * Containers the loan is scoped to; empty means project level
     */
    @Builder.Default
    private List<Long> containerIds = new ArrayList<>();
}
