package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.enums.CostCategory;
import com.landdev.cashflow.domain.enums.TimingMethod;
import com.landdev.cashflow.domain.model.AcquisitionCost;
import com.landdev.cashflow.domain.model.BudgetItem;
import com.landdev.cashflow.domain.model.CostSchedule;
import com.landdev.cashflow.domain.model.ParcelSale;
import com.landdev.cashflow.domain.model.ScheduledCost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CostScheduleBuilderTest {

    private static final double DELTA = 1e-6;

    private CostScheduleBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new CostScheduleBuilder();
    }

    @Test
    void testLumpSumPlacedInStartPeriod() {
        BudgetItem item = BudgetItem.builder().itemId(1L).description("Entitlements").amount(1_000_000)
                .category(CostCategory.PLANNING_ENGINEERING)
                .startPeriod(3).periodsToComplete(6).timingMethod(TimingMethod.LUMP).build();

        CostSchedule schedule = builder.build(List.of(item), List.of(), 1.0, 12, null, 0.0);

        ScheduledCost cost = schedule.getCosts().get(0);
        assertEquals("cost-1", cost.getLineId());
        assertEquals(1_000_000, cost.getAmounts()[2], DELTA);
        assertEquals(1_000_000, cost.getTotal(), DELTA);
        assertEquals(0, cost.getAmounts()[3], DELTA);
        assertEquals(1_000_000, schedule.getTotalCosts(), DELTA);
    }

    @Test
    void testDistributedEvenly() {
        BudgetItem item = BudgetItem.builder().itemId(2L).amount(120_000)
                .startPeriod(1).periodsToComplete(12).timingMethod(TimingMethod.DISTRIBUTED).build();

        CostSchedule schedule = builder.build(List.of(item), List.of(), 1.0, 12, null, 0.0);

        double[] amounts = schedule.getCosts().get(0).getAmounts();
        for (double amount : amounts) {
            assertEquals(10_000, amount, DELTA);
        }
        assertEquals(120_000, schedule.getTotalCosts(), DELTA);
    }

    @Test
    void testCurveWeightsSumToOneAndPeakInMiddle() {
        double[] weights = CostScheduleBuilder.curveWeights(11, 0.5);

        double total = 0;
        for (double weight : weights) {
            total += weight;
        }
        assertEquals(1.0, total, 1e-12);
        assertTrue(weights[5] > weights[0]);
        assertTrue(weights[5] > weights[10]);
        assertArrayEquals(new double[]{1.0}, CostScheduleBuilder.curveWeights(1, 0.5));
    }

    @Test
    void testCurveItemTotalsAmount() {
        BudgetItem item = BudgetItem.builder().itemId(3L).amount(500_000)
                .startPeriod(2).periodsToComplete(8).timingMethod(TimingMethod.CURVE).build();

        CostSchedule schedule = builder.build(List.of(item), List.of(), 1.0, 12, null, 0.0);

        assertEquals(500_000, schedule.getTotalCosts(), 1e-4);
        assertEquals(0, schedule.getCosts().get(0).getAmounts()[0], DELTA);
    }

    @Test
    void testTruncationDropsAmountPastHorizon() {
        BudgetItem item = BudgetItem.builder().itemId(4L).amount(120_000)
                .startPeriod(7).periodsToComplete(12).timingMethod(TimingMethod.DISTRIBUTED).build();

        CostSchedule schedule = builder.build(List.of(item), List.of(), 1.0, 12, null, 0.0);

        // six of twelve periods fit, the rest is dropped rather than grossed up
        assertEquals(60_000, schedule.getTotalCosts(), DELTA);
        assertEquals(10_000, schedule.getCosts().get(0).getAmounts()[11], DELTA);
    }

    @Test
    void testSingleRemainingPeriodTakesFullAmount() {
        BudgetItem item = BudgetItem.builder().itemId(5L).amount(80_000)
                .startPeriod(12).periodsToComplete(4).timingMethod(TimingMethod.DISTRIBUTED).build();

        CostSchedule schedule = builder.build(List.of(item), List.of(), 1.0, 12, null, 0.0);

        assertEquals(80_000, schedule.getCosts().get(0).getAmounts()[11], DELTA);
    }

    @Test
    void testItemBeyondHorizonPlacesNothing() {
        BudgetItem item = BudgetItem.builder().itemId(6L).amount(80_000).startPeriod(20).build();

        CostSchedule schedule = builder.build(List.of(item), List.of(), 1.0, 12, null, 0.0);

        assertEquals(0, schedule.getTotalCosts(), DELTA);
    }

    @Test
    void testEscalationRateOverridesInflation() {
        BudgetItem item = BudgetItem.builder().itemId(7L).amount(100_000)
                .startPeriod(13).timingMethod(TimingMethod.LUMP).escalationRate(5.0).build();

        CostSchedule schedule = builder.build(List.of(item), List.of(), 1.0, 24, null, 0.02);

        assertEquals(105_000, schedule.getCosts().get(0).getAmounts()[12], 1e-4);
    }

    @Test
    void testPortfolioInflationApplied() {
        BudgetItem item = BudgetItem.builder().itemId(8L).amount(100_000)
                .startPeriod(25).timingMethod(TimingMethod.LUMP).build();

        CostSchedule schedule = builder.build(List.of(item), List.of(), 1.0, 30, null, 0.10);

        assertEquals(121_000, schedule.getCosts().get(0).getAmounts()[24], 1e-4);
    }

    @Test
    void testAcquisitionAllocatedByAcreage() {
        List<ParcelSale> parcels = List.of(
                ParcelSale.builder().parcelId(1L).containerId(10L).acres(30.0).build(),
                ParcelSale.builder().parcelId(2L).containerId(20L).acres(70.0).build());
        List<AcquisitionCost> acquisitions = List.of(
                AcquisitionCost.builder().acquisitionId(1L).amount(1_000_000).appliedToPurchase(true).build(),
                AcquisitionCost.builder().acquisitionId(2L).amount(50_000).appliedToPurchase(false).build());
        double share = CostScheduleBuilder.acreageShare(parcels, Set.of(10L));

        CostSchedule schedule = builder.build(List.of(), acquisitions, share, 12, Set.of(10L), 0.0);

        assertEquals(0.3, share, DELTA);
        ScheduledCost acquisition = schedule.getCosts().get(0);
        assertEquals(CostScheduleBuilder.ACQUISITION_LINE_ID, acquisition.getLineId());
        assertEquals(300_000, acquisition.getAmounts()[0], DELTA);
        assertEquals("Land Acquisition (30% allocation)", acquisition.getDescription());
        assertEquals(300_000, schedule.getCategorySummary().get(CostCategory.LAND_ACQUISITION), DELTA);
    }

    @Test
    void testAcreageShareWithoutFilterOrAcres() {
        List<ParcelSale> parcels = List.of(ParcelSale.builder().parcelId(1L).containerId(10L).build());

        assertEquals(1.0, CostScheduleBuilder.acreageShare(parcels, null), DELTA);
        assertEquals(1.0, CostScheduleBuilder.acreageShare(parcels, Set.of(10L)), DELTA);
    }

    @Test
    void testContainerFilterExcludesItems() {
        List<BudgetItem> items = List.of(
                BudgetItem.builder().itemId(1L).amount(10_000).containerId(10L).build(),
                BudgetItem.builder().itemId(2L).amount(20_000).containerId(20L).build());

        CostSchedule schedule = builder.build(items, List.of(), 1.0, 6, Set.of(20L), 0.0);

        assertEquals(1, schedule.getCosts().size());
        assertEquals(20_000, schedule.getTotalCosts(), DELTA);
    }

    @Test
    void testSingleLumpSumInFirstPeriod() {
        BudgetItem item = BudgetItem.builder().itemId(9L).amount(1_000_000)
                .startPeriod(1).periodsToComplete(1).timingMethod(TimingMethod.LUMP).build();

        CostSchedule schedule = builder.build(List.of(item), List.of(), 1.0, 6, null, 0.0);

        assertEquals(1_000_000, schedule.getPeriodTotals()[0], DELTA);
        for (int p = 1; p < 6; p++) {
            assertEquals(0, schedule.getPeriodTotals()[p], DELTA);
        }
    }

    @Test
    void testCurveWeightsSumToOneForAnySteepness() {
        for (double steepness : new double[]{0.05, 0.25, 0.5, 1.0, 2.5, 10.0}) {
            for (int n = 1; n <= 48; n += 7) {
                double total = 0;
                for (double weight : CostScheduleBuilder.curveWeights(n, steepness)) {
                    total += weight;
                }
                assertEquals(1.0, total, 1e-9, "steepness " + steepness + ", periods " + n);
            }
        }
    }

    @Test
    void testPeriodTotalsSumToTotalCosts() {
        List<BudgetItem> items = new ArrayList<>();
        TimingMethod[] methods = TimingMethod.values();
        for (int i = 0; i < 30; i++) {
            items.add(BudgetItem.builder()
                    .itemId((long) i)
                    .amount(10_000 + 7_919.0 * i)
                    .startPeriod(1 + (i * 5) % 30)
                    .periodsToComplete(1 + (i * 3) % 14)
                    .timingMethod(methods[i % methods.length])
                    .escalationRate(i % 4 == 0 ? 3.5 : null)
                    .build());
        }
        List<AcquisitionCost> acquisitions = List.of(
                AcquisitionCost.builder().acquisitionId(1L).amount(2_000_000).appliedToPurchase(true).build());

        CostSchedule schedule = builder.build(items, acquisitions, 1.0, 24, null, 0.025);

        double periodSum = 0;
        for (double total : schedule.getPeriodTotals()) {
            periodSum += total;
        }
        double categorySum = schedule.getCategorySummary().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(schedule.getTotalCosts(), periodSum, 1e-6);
        assertEquals(schedule.getTotalCosts(), categorySum, 1e-6);
    }
}
