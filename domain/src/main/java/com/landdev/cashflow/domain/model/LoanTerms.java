package com.landdev.cashflow.domain.model;

import com.landdev.cashflow.domain.enums.DrawTriggerType;
import com.landdev.cashflow.domain.enums.StructureType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * Loan record resolved against the projection periods.
 * Rates and percentages are fractions; periods are 0-based indexes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanTerms {

    private Long loanId;
    private String loanName;
    private StructureType structureType;
    private double loanAmount;
    private double annualRate;
    private int startPeriod;
    private int termMonths;
    private int amortizationMonths;
    private int interestOnlyMonths;
    private double originationFeePct;
    private double interestReserve;
    private double reserveInflator;
    private double closingCosts;
    private double netProceeds;
    private double loanToCost;
    private DrawTriggerType drawTriggerType;
    private double releasePricePct;
    private double minimumRelease;
    private double repaymentAcceleration;
}
