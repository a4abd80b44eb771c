package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;


/**
 * One period of a loan schedule. Amounts are positive; netCashFlow carries the project sign.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanPeriod {

    private int periodIndex;
    private double beginningBalance;
    private double draw;
    private double interest;
    private double interestReserveDraw;
    private double releasePayment;
    private double originationCost;
    private double payment;
    private double principal;
    private double balloon;
    private double endingBalance;
    private double cumulativeDrawn;
    private double cumulativeInterest;
    private double netCashFlow;
}
