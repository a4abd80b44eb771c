package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.model.AbsorptionSchedule;
import com.landdev.cashflow.domain.model.CostSchedule;
import com.landdev.cashflow.domain.model.PeriodCosts;
import com.landdev.cashflow.domain.model.PeriodSales;
import com.landdev.cashflow.domain.model.ScheduledCost;
import com.landdev.cashflow.domain.model.ScheduledSale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the per-period cost and lot-sale context for the debt and lotbank engines.
 * <p>
 * Cost per lot of a product = budget cost of its containers / lots it sells. Products without budget
 * fall back to total project cost / total lots. Lots whose container does not roll up to a division are left out.
 */
@Component
public class PeriodCostsBuilder {

    private static final Logger log = LoggerFactory.getLogger(PeriodCostsBuilder.class);

    public List<PeriodCosts> build(CostSchedule costSchedule, AbsorptionSchedule absorption,
                                   ContainerHierarchy hierarchy, int periodCount) {
        Map<Long, Integer> lotsByProduct = new TreeMap<>();
        for (ScheduledSale sale : absorption.allSales()) {
            long product = hierarchy.divisionOf(sale.getContainerId());
            if (product != ContainerHierarchy.UNASSIGNED_PRODUCT && sale.getUnits() > 0) {
                lotsByProduct.merge(product, sale.getUnits(), Integer::sum);
            }
        }

        Map<Long, Double> costByProduct = new LinkedHashMap<>();
        for (ScheduledCost cost : costSchedule.getCosts()) {
            if (cost.getContainerId() == null) {
                continue;
            }
            long product = hierarchy.divisionOf(cost.getContainerId());
            if (product != ContainerHierarchy.UNASSIGNED_PRODUCT) {
                costByProduct.merge(product, cost.getTotal(), Double::sum);
            }
        }

        int totalLots = lotsByProduct.values().stream().mapToInt(Integer::intValue).sum();
        double fallbackCostPerLot = totalLots > 0 ? costSchedule.getTotalCosts() / totalLots : 0.0;
        Map<Long, Double> costPerLot = new LinkedHashMap<>();
        for (Map.Entry<Long, Integer> entry : lotsByProduct.entrySet()) {
            Double productCost = costByProduct.get(entry.getKey());
            if (productCost != null && productCost > 0 && entry.getValue() > 0) {
                costPerLot.put(entry.getKey(), productCost / entry.getValue());
            } else {
                costPerLot.put(entry.getKey(), fallbackCostPerLot);
            }
        }

        List<PeriodCosts> periodCosts = new ArrayList<>(periodCount);
        double[] totals = costSchedule.getPeriodTotals();
        for (int p = 0; p < periodCount; p++) {
            periodCosts.add(PeriodCosts.builder()
                    .periodIndex(p)
                    .totalCosts(p < totals.length ? totals[p] : 0.0)
                    .costPerLotByProduct(new LinkedHashMap<>(costPerLot))
                    .build());
        }
        for (PeriodSales periodSales : absorption.getPeriodSales()) {
            int p = periodSales.getPeriodIndex();
            if (p < 0 || p >= periodCount) {
                continue;
            }
            Map<Long, Integer> sold = periodCosts.get(p).getLotsSoldByProduct();
            for (ScheduledSale sale : periodSales.getSales()) {
                long product = hierarchy.divisionOf(sale.getContainerId());
                if (product != ContainerHierarchy.UNASSIGNED_PRODUCT && sale.getUnits() > 0) {
                    sold.merge(product, sale.getUnits(), Integer::sum);
                }
            }
        }

        log.debug("Built period costs for {} periods, {} products, {} lots", periodCount, lotsByProduct.size(), totalLots);
        return periodCosts;
    }
}
