package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.enums.CostCategory;
import com.landdev.cashflow.domain.enums.SectionKind;
import com.landdev.cashflow.domain.model.AbsorptionSchedule;
import com.landdev.cashflow.domain.model.CostSchedule;
import com.landdev.cashflow.domain.model.LineItem;
import com.landdev.cashflow.domain.model.Period;
import com.landdev.cashflow.domain.model.PeriodAmount;
import com.landdev.cashflow.domain.model.Section;
import com.landdev.cashflow.domain.model.SummaryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces assembled sections to investment metrics.
 * <p>
 * The net cash-flow vector sums every section except gross revenue and revenue deductions, which are already
 * netted into net revenue. IRR runs over calendar-year buckets (year of each period's start date) and needs at least
 * two of them; NPV discounts the monthly series at (1 + rate)^(1/12) - 1 with period 0 undiscounted.
 */
@Component
public class MetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    private final IrrSolver irrSolver;

    public MetricsAggregator(IrrSolver irrSolver) {
        this.irrSolver = irrSolver;
    }

    public SummaryMetrics aggregate(List<Section> sections, List<Period> periods, CostSchedule costSchedule,
                                    AbsorptionSchedule absorption, double discountRate) {
        double[] netCashFlow = netCashFlow(sections, periods.size());

        Map<Integer, Double> annual = new TreeMap<>();
        for (Period period : periods) {
            annual.merge(period.getStartDate().getYear(), netCashFlow[period.getIndex()], Double::sum);
        }
        Double irr = null;
        if (annual.size() >= 2) {
            irr = irrSolver.solve(annual.values().stream().mapToDouble(Double::doubleValue).toArray());
        }

        Double npv = null;
        if (discountRate > 0) {
            double monthlyRate = Math.pow(1.0 + discountRate, 1.0 / 12.0) - 1.0;
            npv = IrrSolver.npv(monthlyRate, netCashFlow);
        }

        double cashIn = 0;
        double cashOut = 0;
        double cumulative = 0;
        double trough = 0;
        List<Double> cumulativeSeries = new ArrayList<>(netCashFlow.length);
        for (int p = 0; p < netCashFlow.length; p++) {
            double cf = netCashFlow[p];
            if (cf > 0) {
                cashIn += cf;
            } else {
                cashOut += -cf;
            }
            cumulative += cf;
            cumulativeSeries.add(round(cumulative, 2));
            trough = Math.min(trough, cumulative);
        }
        Double equityMultiple = cashOut > 0 ? cashIn / cashOut : null;
        Integer payback = paybackPeriod(netCashFlow);

        double financing = 0;
        for (Section section : sections) {
            if (section.getKind() == SectionKind.FINANCING) {
                financing += section.getSectionTotal();
            }
        }

        double netRevenue = absorption.getTotalNetRevenue();
        double totalCosts = costSchedule.getTotalCosts();
        double grossProfit = netRevenue - totalCosts;
        Map<String, Double> costsByCategory = new LinkedHashMap<>();
        for (Map.Entry<CostCategory, Double> entry : costSchedule.getCategorySummary().entrySet()) {
            costsByCategory.put(entry.getKey().getDisplayName(), round(entry.getValue(), 2));
        }
        Map<Integer, Double> annualRounded = new LinkedHashMap<>();
        annual.forEach((year, amount) -> annualRounded.put(year, round(amount, 2)));

        SummaryMetrics summary = SummaryMetrics.builder()
                .totalGrossRevenue(round(absorption.getTotalGrossRevenue(), 2))
                .totalRevenueDeductions(round(absorption.getTotalCommissions() + absorption.getTotalClosingCosts()
                        + absorption.getTotalSubdivisionCosts(), 2))
                .totalNetRevenue(round(netRevenue, 2))
                .totalCommissions(round(absorption.getTotalCommissions(), 2))
                .totalTransactionCosts(round(absorption.getTotalClosingCosts(), 2))
                .totalSubdivisionCosts(round(absorption.getTotalSubdivisionCosts(), 2))
                .totalUnits(absorption.getTotalUnits())
                .totalCosts(round(totalCosts, 2))
                .costsByCategory(costsByCategory)
                .grossProfit(round(grossProfit, 2))
                .grossMargin(netRevenue > 0 ? round(grossProfit / netRevenue, 6) : null)
                .totalFinancingCashFlow(round(financing, 2))
                .totalCashIn(round(cashIn, 2))
                .totalCashOut(round(cashOut, 2))
                .netCashFlow(round(cashIn - cashOut, 2))
                .irr(irr != null ? round(irr, 6) : null)
                .npv(npv != null ? round(npv, 2) : null)
                .equityMultiple(equityMultiple != null ? round(equityMultiple, 4) : null)
                .peakEquity(round(-trough, 2))
                .paybackPeriod(payback)
                .cumulativeCashFlow(cumulativeSeries)
                .annualCashFlows(annualRounded)
                .build();

        log.debug("Metrics: IRR {}, NPV {}, multiple {}, peak equity {}, payback {}",
                summary.getIrr(), summary.getNpv(), summary.getEquityMultiple(), summary.getPeakEquity(), payback);
        return summary;
    }

    /**
     * Sum of every line in sections that count toward net cash flow, per period
     */
    public static double[] netCashFlow(List<Section> sections, int periodCount) {
        double[] netCashFlow = new double[periodCount];
        for (Section section : sections) {
            if (!section.getKind().isIncludedInNetCashFlow()) {
                continue;
            }
            for (LineItem item : section.getLineItems()) {
                for (PeriodAmount amount : item.getPeriods()) {
                    if (amount.getPeriodIndex() < periodCount) {
                        netCashFlow[amount.getPeriodIndex()] += amount.getAmount();
                    }
                }
            }
        }
        return netCashFlow;
    }

    /**
     * First period at which the cumulative cash flow is non-negative, null when it never is.
     */
    static Integer paybackPeriod(double[] netCashFlow) {
        double cumulative = 0;
        for (int p = 0; p < netCashFlow.length; p++) {
            cumulative += netCashFlow[p];
            if (cumulative >= 0) {
                return p;
            }
        }
        return null;
    }

    static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
