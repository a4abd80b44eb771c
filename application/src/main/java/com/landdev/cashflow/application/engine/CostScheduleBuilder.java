package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.enums.CostCategory;
import com.landdev.cashflow.domain.enums.TimingMethod;
import com.landdev.cashflow.domain.model.AcquisitionCost;
import com.landdev.cashflow.domain.model.BudgetItem;
import com.landdev.cashflow.domain.model.CostSchedule;
import com.landdev.cashflow.domain.model.ParcelSale;
import com.landdev.cashflow.domain.model.ScheduledCost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Distributes budget items and the land purchase across projection periods.
 * <p>
 * Placement per item:
 * <ul>
 *   <li>lump, or an effective duration of one period: whole amount in the start period</li>
 *   <li>distributed: amount / periods_to_complete in each period</li>
 *   <li>curve: logistic weights over periods_to_complete, normalized to 1</li>
 * </ul>
 * Each placed amount is inflated by (1 + rate)^(periodIndex / 12). Periods past the horizon are dropped, not grossed
 * up, so totalCosts is the sum of what was actually placed.
 */
@Component
public class CostScheduleBuilder {

    private static final Logger log = LoggerFactory.getLogger(CostScheduleBuilder.class);

    static final double DEFAULT_CURVE_STEEPNESS = 0.5;
    static final String ACQUISITION_LINE_ID = "acquisition";

    /**
     * Build the cost schedule
     * @param items Budget items of the project
     * @param acquisitions Land purchase records
     * @param acquisitionShare Share of the purchase allocated to the filtered containers, 1.0 when unfiltered
     * @param periodCount Projection horizon
     * @param containerFilter Containers to keep, null or empty for all
     * @param inflationRate Portfolio cost inflation (fraction) for items without their own escalation rate
     */
    public CostSchedule build(List<BudgetItem> items, List<AcquisitionCost> acquisitions, double acquisitionShare,
                              int periodCount, Collection<Long> containerFilter, double inflationRate) {
        List<ScheduledCost> costs = new ArrayList<>();
        double[] periodTotals = new double[periodCount];

        ScheduledCost acquisition = scheduleAcquisition(acquisitions, acquisitionShare, periodCount);
        if (acquisition != null) {
            costs.add(acquisition);
        }

        boolean filtered = containerFilter != null && !containerFilter.isEmpty();
        for (BudgetItem item : items) {
            if (item.getAmount() <= 0) {
                continue;
            }
            if (filtered && !containerFilter.contains(item.getContainerId())) {
                continue;
            }
            costs.add(scheduleItem(item, periodCount, inflationRate));
        }

        Map<CostCategory, Double> categorySummary = new LinkedHashMap<>();
        for (CostCategory category : CostCategory.values()) {
            double categoryTotal = 0;
            boolean present = false;
            for (ScheduledCost cost : costs) {
                if (cost.getCategory() == category) {
                    categoryTotal += cost.getTotal();
                    present = true;
                }
            }
            if (present) {
                categorySummary.put(category, categoryTotal);
            }
        }

        double totalCosts = 0;
        for (ScheduledCost cost : costs) {
            double[] amounts = cost.getAmounts();
            for (int p = 0; p < periodCount; p++) {
                periodTotals[p] += amounts[p];
            }
            totalCosts += cost.getTotal();
        }

        log.debug("Scheduled {} cost lines over {} periods, total {}", costs.size(), periodCount, totalCosts);
        return CostSchedule.builder()
                .costs(costs)
                .categorySummary(categorySummary)
                .totalCosts(totalCosts)
                .periodTotals(periodTotals)
                .acquisitionShare(acquisitionShare)
                .build();
    }

    ScheduledCost scheduleItem(BudgetItem item, int periodCount, double inflationRate) {
        int startPeriod = item.getStartPeriod() != null && item.getStartPeriod() > 0 ? item.getStartPeriod() : 1;
        int periodsToComplete = item.getPeriodsToComplete() != null && item.getPeriodsToComplete() > 0
                ? item.getPeriodsToComplete() : 1;
        TimingMethod method = item.getTimingMethod() != null ? item.getTimingMethod() : TimingMethod.DISTRIBUTED;
        double rate = item.getEscalationRate() != null ? item.getEscalationRate() / 100.0 : inflationRate;

        int startIndex = startPeriod - 1;
        int effectiveDuration = Math.min(startPeriod + periodsToComplete - 1, periodCount) - startPeriod + 1;

        double[] amounts = new double[periodCount];
        if (effectiveDuration >= 1) {
            if (method == TimingMethod.LUMP || effectiveDuration == 1) {
                amounts[startIndex] = item.getAmount() * inflationFactor(rate, startIndex);
            } else if (method == TimingMethod.CURVE) {
                double steepness = item.getCurveSteepness() != null && item.getCurveSteepness() > 0
                        ? item.getCurveSteepness() : DEFAULT_CURVE_STEEPNESS;
                double[] weights = curveWeights(periodsToComplete, steepness);
                for (int i = 0; i < effectiveDuration; i++) {
                    int p = startIndex + i;
                    amounts[p] = item.getAmount() * weights[i] * inflationFactor(rate, p);
                }
            } else {
                double perPeriod = item.getAmount() / periodsToComplete;
                for (int i = 0; i < effectiveDuration; i++) {
                    int p = startIndex + i;
                    amounts[p] = perPeriod * inflationFactor(rate, p);
                }
            }
        } else {
            log.warn("Budget item {} starts in period {} beyond the {}-period horizon, nothing placed",
                    item.getItemId(), startPeriod, periodCount);
        }

        return ScheduledCost.builder()
                .lineId("cost-" + item.getItemId())
                .itemId(item.getItemId())
                .description(item.getDescription())
                .category(CostCategory.resolve(item.getCategory(), item.getActivity(), item.getDescription()))
                .containerId(item.getContainerId())
                .amounts(amounts)
                .total(sum(amounts))
                .build();
    }

    private ScheduledCost scheduleAcquisition(List<AcquisitionCost> acquisitions, double share, int periodCount) {
        double purchase = 0;
        for (AcquisitionCost acquisition : acquisitions) {
            if (acquisition.isAppliedToPurchase() && acquisition.getAmount() > 0) {
                purchase += acquisition.getAmount();
            }
        }
        double allocated = purchase * share;
        if (allocated <= 0) {
            return null;
        }

        String description = share < 1.0
                ? String.format("Land Acquisition (%.0f%% allocation)", share * 100)
                : "Land Acquisition";
        double[] amounts = new double[periodCount];
        amounts[0] = allocated;
        return ScheduledCost.builder()
                .lineId(ACQUISITION_LINE_ID)
                .description(description)
                .category(CostCategory.LAND_ACQUISITION)
                .amounts(amounts)
                .total(allocated)
                .build();
    }

    /**
     * Incremental logistic weights for an S-curve over n periods, summing to 1.
     * Points are spread over [-6, 6] and scaled by 2 * steepness.
     */
    public static double[] curveWeights(int n, double steepness) {
        if (n <= 1) {
            return new double[]{1.0};
        }
        double[] cumulative = new double[n];
        for (int i = 0; i < n; i++) {
            double x = ((double) i / (n - 1)) * 12.0 - 6.0;
            x *= steepness * 2.0;
            cumulative[i] = 1.0 / (1.0 + Math.exp(-x));
        }

        double[] weights = new double[n];
        weights[0] = cumulative[0];
        for (int i = 1; i < n; i++) {
            weights[i] = cumulative[i] - cumulative[i - 1];
        }
        double total = sum(weights);
        for (int i = 0; i < n; i++) {
            weights[i] /= total;
        }
        return weights;
    }

    /**
     * Acreage share of the filtered containers; 1.0 without a filter or when the project has no acreage
     */
    public static double acreageShare(List<ParcelSale> parcels, Collection<Long> containerFilter) {
        if (containerFilter == null || containerFilter.isEmpty()) {
            return 1.0;
        }
        double totalAcres = 0;
        double filteredAcres = 0;
        for (ParcelSale parcel : parcels) {
            double acres = parcel.getAcres() != null ? parcel.getAcres() : 0;
            totalAcres += acres;
            if (containerFilter.contains(parcel.getContainerId())) {
                filteredAcres += acres;
            }
        }
        return totalAcres > 0 ? filteredAcres / totalAcres : 1.0;
    }

    static double inflationFactor(double annualRate, int periodIndex) {
        if (annualRate == 0) {
            return 1.0;
        }
        return Math.pow(1.0 + annualRate, periodIndex / 12.0);
    }

    private static double sum(double[] values) {
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total;
    }
}
