package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.model.AbsorptionSchedule;
import com.landdev.cashflow.domain.model.ParcelSale;
import com.landdev.cashflow.domain.model.PeriodSales;
import com.landdev.cashflow.domain.model.ScheduledSale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns parcel sale assumptions into a period-bucketed absorption schedule.
 * <p>
 * Gross, net, commissions and closing costs escalate by (1 + growth)^((salePeriod - 1) / 12).
 * Subdivision costs are cost based and never escalate.
 */
@Component
public class AbsorptionScheduler {

    private static final Logger log = LoggerFactory.getLogger(AbsorptionScheduler.class);

    public AbsorptionSchedule build(List<ParcelSale> sales, double priceGrowthRate, Collection<Long> containerFilter) {
        boolean filtered = containerFilter != null && !containerFilter.isEmpty();
        Map<Integer, List<ScheduledSale>> bySalePeriod = new TreeMap<>();
        int excluded = 0;

        for (ParcelSale sale : sales) {
            if (filtered && !containerFilter.contains(sale.getContainerId())) {
                continue;
            }
            if (!isSchedulable(sale)) {
                excluded++;
                continue;
            }
            ScheduledSale scheduled = escalate(sale, priceGrowthRate);
            bySalePeriod.computeIfAbsent(scheduled.getSalePeriod(), k -> new ArrayList<>()).add(scheduled);
        }

        AbsorptionSchedule schedule = AbsorptionSchedule.builder().build();
        for (Map.Entry<Integer, List<ScheduledSale>> entry : bySalePeriod.entrySet()) {
            PeriodSales periodSales = PeriodSales.builder()
                    .salePeriod(entry.getKey())
                    .periodIndex(entry.getKey() - 1)
                    .sales(entry.getValue())
                    .build();
            for (ScheduledSale sale : entry.getValue()) {
                periodSales.setUnits(periodSales.getUnits() + sale.getUnits());
                periodSales.setGrossRevenue(periodSales.getGrossRevenue() + sale.getGrossRevenue());
                periodSales.setNetRevenue(periodSales.getNetRevenue() + sale.getNetRevenue());
                periodSales.setCommissions(periodSales.getCommissions() + sale.getCommissions());
                periodSales.setClosingCosts(periodSales.getClosingCosts() + sale.getClosingCosts());
                periodSales.setSubdivisionCosts(periodSales.getSubdivisionCosts() + sale.getSubdivisionCosts());

                schedule.setTotalGrossRevenue(schedule.getTotalGrossRevenue() + sale.getGrossRevenue());
                schedule.setTotalNetRevenue(schedule.getTotalNetRevenue() + sale.getNetRevenue());
                schedule.setTotalCommissions(schedule.getTotalCommissions() + sale.getCommissions());
                schedule.setTotalClosingCosts(schedule.getTotalClosingCosts() + sale.getClosingCosts());
                schedule.setTotalSubdivisionCosts(schedule.getTotalSubdivisionCosts() + sale.getSubdivisionCosts());
                schedule.setTotalUnits(schedule.getTotalUnits() + sale.getUnits());
                schedule.setTotalParcels(schedule.getTotalParcels() + 1);
            }
            schedule.getPeriodSales().add(periodSales);
        }

        log.debug("Scheduled {} parcels across {} sale periods ({} excluded), net revenue {}",
                schedule.getTotalParcels(), schedule.getPeriodSales().size(), excluded, schedule.getTotalNetRevenue());
        return schedule;
    }

    /**
     * A sale needs a sale period, some units or acreage, and both gross and net figures
     */
    static boolean isSchedulable(ParcelSale sale) {
        if (sale.getSalePeriod() == null || sale.getSalePeriod() < 1) {
            return false;
        }
        double units = sale.getUnits() != null ? sale.getUnits() : 0;
        double acres = sale.getAcres() != null ? sale.getAcres() : 0;
        if (units == 0 && acres == 0) {
            return false;
        }
        return sale.getGrossRevenue() != null && sale.getNetRevenue() != null;
    }

    private ScheduledSale escalate(ParcelSale sale, double priceGrowthRate) {
        int salePeriod = sale.getSalePeriod();
        double factor = priceGrowthRate != 0 ? Math.pow(1.0 + priceGrowthRate, (salePeriod - 1) / 12.0) : 1.0;
        int units = sale.getUnits() != null ? (int) sale.getUnits().doubleValue() : 0;

        return ScheduledSale.builder()
                .parcelId(sale.getParcelId())
                .parcelCode(sale.getParcelCode())
                .containerId(sale.getContainerId())
                .salePeriod(salePeriod)
                .periodIndex(salePeriod - 1)
                // Acreage-only parcels count as one unit
                .units(units != 0 ? units : 1)
                .acres(sale.getAcres() != null ? sale.getAcres() : 0)
                .grossRevenue(sale.getGrossRevenue() * factor)
                .netRevenue(sale.getNetRevenue() * factor)
                .commissions(valueOf(sale.getCommissions()) * factor)
                .closingCosts(valueOf(sale.getClosingCosts()) * factor)
                .subdivisionCosts(valueOf(sale.getSubdivisionCosts()))
                .build();
    }

    private static double valueOf(Double value) {
        return value != null ? value : 0.0;
    }
}
