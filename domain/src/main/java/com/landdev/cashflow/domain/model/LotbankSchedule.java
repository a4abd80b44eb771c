package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the lotbank engine. Amounts are positive magnitudes; sections apply the sign.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotbankSchedule {

    @Builder.Default
    private List<LotbankProduct> products = new ArrayList<>();

    private double initialDeposit;

    private double[] optionDeposits;

    /**
     * Deposit credits per product id
     */
    @Builder.Default
    private Map<Long, double[]> depositCredits = new LinkedHashMap<>();

    private double[] underwritingFees;

    private double[] managementFees;

    private double[] defaultProvisions;
}
