package com.landdev.cashflow.application.engine.lotbank;

import com.landdev.cashflow.domain.model.LotbankProduct;
import com.landdev.cashflow.domain.model.LotbankSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Option-deposit economics of a lotbank deal.
 * <p>
 * Per product the deposit is min(deposit%, cap%) * price * lots, received at period 0. Each period the credit
 * released back is whatever exceeds cap% * price * lots remaining, and the full outstanding once the product sells
 * out, so deposits net to zero over a sold-out life. Management fee is fee% / 12 of the remaining lot value; the
 * default provision (provision% * initial deposit) is spread in proportion to lots remaining.
 */
@Service
public class LotbankEngine {

    private static final Logger log = LoggerFactory.getLogger(LotbankEngine.class);

    public LotbankSchedule calculate(List<LotbankProduct> products, int periodCount, double managementFeePct,
                                     double defaultProvisionPct, double underwritingFee) {
        double[] optionDeposits = new double[periodCount];
        double[] underwritingFees = new double[periodCount];
        double[] managementFees = new double[periodCount];
        double[] defaultProvisions = new double[periodCount];
        Map<Long, double[]> depositCredits = new LinkedHashMap<>();

        double initialDeposit = 0;
        double[] remainingValue = new double[periodCount];
        double[] remainingLots = new double[periodCount];

        for (LotbankProduct product : products) {
            double price = product.getRetailLotPrice();
            double perLotDeposit = Math.min(product.getDepositPct(), product.getDepositCapPct()) * price;
            double productDeposit = perLotDeposit * product.getLotCount();
            initialDeposit += productDeposit;

            double[] credits = new double[periodCount];
            double outstanding = productDeposit;
            int[] lotsRemaining = product.getLotsRemainingByPeriod();
            for (int p = 0; p < periodCount; p++) {
                int remaining = lotsRemaining[p];
                double credit = remaining == 0
                        ? outstanding
                        : Math.max(0, outstanding - product.getDepositCapPct() * remaining * price);
                credits[p] = credit;
                outstanding -= credit;

                remainingValue[p] += remaining * price;
                remainingLots[p] += remaining;
            }
            depositCredits.put(product.getProductId(), credits);
        }

        optionDeposits[0] = initialDeposit;
        underwritingFees[0] = underwritingFee;

        for (int p = 0; p < periodCount; p++) {
            managementFees[p] = remainingValue[p] * managementFeePct / 12.0;
        }

        double provisionTotal = initialDeposit * defaultProvisionPct;
        double lotPeriods = 0;
        for (double lots : remainingLots) {
            lotPeriods += lots;
        }
        for (int p = 0; p < periodCount; p++) {
            defaultProvisions[p] = lotPeriods > 0
                    ? provisionTotal * remainingLots[p] / lotPeriods
                    : provisionTotal / periodCount;
        }

        log.debug("Lotbank: {} products, initial deposit {}, provision {}, underwriting fee {}",
                products.size(), initialDeposit, provisionTotal, underwritingFee);
        return LotbankSchedule.builder()
                .products(products)
                .initialDeposit(initialDeposit)
                .optionDeposits(optionDeposits)
                .depositCredits(depositCredits)
                .underwritingFees(underwritingFees)
                .managementFees(managementFees)
                .defaultProvisions(defaultProvisions)
                .build();
    }
}
