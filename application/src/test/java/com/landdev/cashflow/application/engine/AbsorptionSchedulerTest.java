package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.model.AbsorptionSchedule;
import com.landdev.cashflow.domain.model.ParcelSale;
import com.landdev.cashflow.domain.model.PeriodSales;
import com.landdev.cashflow.domain.model.ScheduledSale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AbsorptionSchedulerTest {

    private static final double DELTA = 1e-6;

    private AbsorptionScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new AbsorptionScheduler();
    }

    private static ParcelSale sale(long id, Long containerId, Integer salePeriod, Double units, double gross, double net) {
        return ParcelSale.builder()
                .parcelId(id)
                .parcelCode("P-" + id)
                .containerId(containerId)
                .salePeriod(salePeriod)
                .units(units)
                .grossRevenue(gross)
                .netRevenue(net)
                .commissions(gross * 0.03)
                .closingCosts(gross * 0.01)
                .subdivisionCosts(5_000.0)
                .build();
    }

    @Test
    void testSalesGroupedBySalePeriod() {
        List<ParcelSale> sales = List.of(
                sale(1, 10L, 6, 10.0, 1_000_000, 960_000),
                sale(2, 10L, 3, 5.0, 500_000, 480_000),
                sale(3, 20L, 6, 8.0, 800_000, 768_000));

        AbsorptionSchedule schedule = scheduler.build(sales, 0.0, null);

        assertEquals(2, schedule.getPeriodSales().size());
        PeriodSales first = schedule.getPeriodSales().get(0);
        assertEquals(3, first.getSalePeriod());
        assertEquals(2, first.getPeriodIndex());
        PeriodSales second = schedule.getPeriodSales().get(1);
        assertEquals(18, second.getUnits());
        assertEquals(1_800_000, second.getGrossRevenue(), DELTA);
        assertEquals(2_300_000, schedule.getTotalGrossRevenue(), DELTA);
        assertEquals(2_208_000, schedule.getTotalNetRevenue(), DELTA);
        assertEquals(23, schedule.getTotalUnits());
        assertEquals(3, schedule.getTotalParcels());
    }

    @Test
    void testPriceGrowthEscalatesRevenueButNotSubdivisionCosts() {
        List<ParcelSale> sales = List.of(sale(1, 10L, 13, 10.0, 1_000_000, 950_000));

        AbsorptionSchedule schedule = scheduler.build(sales, 0.05, null);

        ScheduledSale scheduled = schedule.allSales().get(0);
        assertEquals(1_050_000, scheduled.getGrossRevenue(), 1e-4);
        assertEquals(997_500, scheduled.getNetRevenue(), 1e-4);
        assertEquals(31_500, scheduled.getCommissions(), 1e-4);
        assertEquals(5_000, scheduled.getSubdivisionCosts(), DELTA);
    }

    @Test
    void testIncompleteSalesExcluded() {
        List<ParcelSale> sales = List.of(
                sale(1, 10L, null, 10.0, 1_000_000, 960_000),
                sale(2, 10L, 4, null, 500_000, 480_000),
                ParcelSale.builder().parcelId(3L).salePeriod(4).units(3.0).grossRevenue(300_000.0).build());

        AbsorptionSchedule schedule = scheduler.build(sales, 0.0, null);

        assertTrue(schedule.getPeriodSales().isEmpty());
        assertEquals(0, schedule.getTotalParcels());
    }

    @Test
    void testAcreageOnlyParcelCountsAsOneUnit() {
        ParcelSale parcel = sale(1, 10L, 5, null, 2_000_000, 1_900_000);
        parcel.setAcres(12.5);

        AbsorptionSchedule schedule = scheduler.build(List.of(parcel), 0.0, null);

        assertEquals(1, schedule.getTotalUnits());
        assertEquals(12.5, schedule.allSales().get(0).getAcres(), DELTA);
    }

    @Test
    void testContainerFilter() {
        List<ParcelSale> sales = List.of(
                sale(1, 10L, 6, 10.0, 1_000_000, 960_000),
                sale(2, 20L, 6, 8.0, 800_000, 768_000));

        AbsorptionSchedule schedule = scheduler.build(sales, 0.0, Set.of(20L));

        assertEquals(1, schedule.getTotalParcels());
        assertEquals(800_000, schedule.getTotalGrossRevenue(), DELTA);
    }

    @Test
    void testTotalsMatchEscalatedSales() {
        List<ParcelSale> sales = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            sales.add(sale(i, (long) (i % 3), 1 + (i * 7) % 40, 1.0 + i, 100_000.0 * (i + 1), 95_000.0 * (i + 1)));
        }

        AbsorptionSchedule schedule = scheduler.build(sales, 0.035, null);

        double net = schedule.allSales().stream().mapToDouble(ScheduledSale::getNetRevenue).sum();
        double gross = schedule.getPeriodSales().stream().mapToDouble(PeriodSales::getGrossRevenue).sum();
        assertEquals(net, schedule.getTotalNetRevenue(), 1e-6);
        assertEquals(gross, schedule.getTotalGrossRevenue(), 1e-6);
        for (ScheduledSale sale : schedule.allSales()) {
            assertEquals(0.95, sale.getNetRevenue() / sale.getGrossRevenue(), 1e-12);
        }
    }
}
