package com.landdev.cashflow.domain.model;

import com.landdev.cashflow.domain.enums.StructureType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Period-by-period schedule of one loan plus its sizing summary
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanSchedule {

    private Long loanId;

    private String loanName;

    private StructureType structureType;

    private int startPeriod;

    private int termMonths;

    /**
     * One entry per projection period, zeros outside the loan term
     */
    @Builder.Default
    private List<LoanPeriod> periods = new ArrayList<>();

    // Revolver sizing
    private double commitment;
    private double interestReserve;
    private double originationFee;
    private double closingCosts;
    private double netProceeds;
    private double peakBalance;
    private double peakBalancePct;
    private int convergenceIterations;
    private boolean converged;

    // Term payments
    private double interestOnlyPayment;
    private double amortizingPayment;

    private double totalDrawn;
    private double totalInterest;
    private double totalPrincipal;
    private double totalReleasePayments;
    private double balloonPayment;

    public double[] netCashFlows() {
        return periods.stream().mapToDouble(LoanPeriod::getNetCashFlow).toArray();
    }
}
