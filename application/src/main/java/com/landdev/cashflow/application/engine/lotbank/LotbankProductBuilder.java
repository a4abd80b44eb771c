package com.landdev.cashflow.application.engine.lotbank;

import com.landdev.cashflow.application.engine.ContainerHierarchy;
import com.landdev.cashflow.domain.exception.ValidationException;
import com.landdev.cashflow.domain.model.Container;
import com.landdev.cashflow.domain.model.LotbankProduct;
import com.landdev.cashflow.domain.model.PeriodCosts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One lotbank product per division that carries a retail lot price and a deposit percentage.
 * Lot count is what the division sells over the projection; lots remaining fall as sales close.
 */
@Component
public class LotbankProductBuilder {

    private static final Logger log = LoggerFactory.getLogger(LotbankProductBuilder.class);

    public List<LotbankProduct> build(ContainerHierarchy hierarchy, List<PeriodCosts> periodCosts) {
        List<LotbankProduct> products = new ArrayList<>();
        int periodCount = periodCosts.size();

        for (Container division : hierarchy.divisions()) {
            if (division.getRetailLotPrice() == null || division.getDepositPct() == null) {
                continue;
            }
            if (division.getRetailLotPrice() < 0 || division.getDepositPct() < 0) {
                throw new ValidationException("Division " + division.getContainerId()
                        + ": lotbank price and deposit percentage cannot be negative");
            }

            int[] soldByPeriod = new int[periodCount];
            int lotCount = 0;
            for (PeriodCosts costs : periodCosts) {
                int sold = costs.getLotsSoldByProduct().getOrDefault(division.getContainerId(), 0);
                soldByPeriod[costs.getPeriodIndex()] = sold;
                lotCount += sold;
            }
            if (lotCount == 0) {
                log.debug("Division {} has lotbank pricing but no lots sold, skipped", division.getContainerId());
                continue;
            }

            int[] remaining = new int[periodCount];
            int cumulative = 0;
            for (int p = 0; p < periodCount; p++) {
                cumulative += soldByPeriod[p];
                remaining[p] = Math.max(lotCount - cumulative, 0);
            }

            double depositPct = division.getDepositPct();
            products.add(LotbankProduct.builder()
                    .productId(division.getContainerId())
                    .productName(division.getName())
                    .lotCount(lotCount)
                    .retailLotPrice(division.getRetailLotPrice())
                    .depositPct(depositPct)
                    .depositCapPct(division.getDepositCapPct() != null ? division.getDepositCapPct() : depositPct)
                    .premiumPct(division.getPremiumPct() != null ? division.getPremiumPct() : 0.0)
                    .lotsRemainingByPeriod(remaining)
                    .build());
        }

        log.debug("Built {} lotbank products", products.size());
        return products;
    }
}
