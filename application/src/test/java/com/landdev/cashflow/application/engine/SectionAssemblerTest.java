package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.enums.CostCategory;
import com.landdev.cashflow.domain.enums.SectionKind;
import com.landdev.cashflow.domain.enums.StructureType;
import com.landdev.cashflow.domain.enums.TimingMethod;
import com.landdev.cashflow.domain.model.AbsorptionSchedule;
import com.landdev.cashflow.domain.model.BudgetItem;
import com.landdev.cashflow.domain.model.Container;
import com.landdev.cashflow.domain.model.CostSchedule;
import com.landdev.cashflow.domain.model.LineItem;
import com.landdev.cashflow.domain.model.LoanPeriod;
import com.landdev.cashflow.domain.model.LoanSchedule;
import com.landdev.cashflow.domain.model.LotbankProduct;
import com.landdev.cashflow.domain.model.LotbankSchedule;
import com.landdev.cashflow.domain.model.ParcelSale;
import com.landdev.cashflow.domain.model.PeriodAmount;
import com.landdev.cashflow.domain.model.Section;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SectionAssemblerTest {

    private static final double DELTA = 1e-6;
    private static final int PERIODS = 12;

    private SectionAssembler assembler;
    private ContainerHierarchy hierarchy;
    private CostSchedule costSchedule;
    private AbsorptionSchedule absorption;

    @BeforeEach
    void setUp() {
        assembler = new SectionAssembler();
        hierarchy = new ContainerHierarchy(List.of(
                Container.builder().containerId(10L).tier(1).name("North Village").build()));
        costSchedule = new CostScheduleBuilder().build(List.of(
                        BudgetItem.builder().itemId(1L).description("Grading").amount(120_000)
                                .category(CostCategory.DEVELOPMENT).startPeriod(1).periodsToComplete(12)
                                .timingMethod(TimingMethod.DISTRIBUTED).build(),
                        BudgetItem.builder().itemId(2L).description("Site plan").amount(30_000)
                                .category(CostCategory.PLANNING_ENGINEERING).startPeriod(2)
                                .timingMethod(TimingMethod.LUMP).build()),
                List.of(), 1.0, PERIODS, null, 0.0);
        absorption = new AbsorptionScheduler().build(List.of(
                ParcelSale.builder().parcelId(1L).containerId(10L).salePeriod(10).units(5.0)
                        .grossRevenue(500_000.0).netRevenue(470_000.0).commissions(20_000.0)
                        .closingCosts(10_000.0).build(),
                ParcelSale.builder().parcelId(2L).salePeriod(12).units(2.0)
                        .grossRevenue(200_000.0).netRevenue(190_000.0).commissions(10_000.0).build()),
                0.0, null);
    }

    private static List<String> ids(List<Section> sections) {
        return sections.stream().map(Section::getSectionId).collect(Collectors.toList());
    }

    @Test
    void testSectionOrderWithoutFinancing() {
        List<Section> sections = assembler.assemble(costSchedule, absorption, hierarchy, List.of(), null, PERIODS);

        assertEquals(List.of("cost-planning_engineering", "cost-development", "revenue-gross",
                "revenue-deductions", "revenue-net"), ids(sections));
    }

    @Test
    void testCostLinesAreNegativeAndSparse() {
        List<Section> sections = assembler.assemble(costSchedule, absorption, hierarchy, List.of(), null, PERIODS);

        Section planning = sections.get(0);
        assertEquals(SectionKind.COST, planning.getKind());
        assertEquals("Planning & Engineering", planning.getTitle());
        LineItem line = planning.getLineItems().get(0);
        assertEquals(1, line.getPeriods().size());
        assertEquals(1, line.getPeriods().get(0).getPeriodIndex());
        assertEquals(-30_000, line.getTotal(), DELTA);
        assertEquals(-120_000, sections.get(1).getSectionTotal(), DELTA);
        assertEquals(12, sections.get(1).getSubtotals().size());
    }

    @Test
    void testRevenueLinesPerContainer() {
        List<Section> sections = assembler.assemble(costSchedule, absorption, hierarchy, List.of(), null, PERIODS);

        Section gross = sections.get(2);
        assertEquals(2, gross.getLineItems().size());
        assertEquals("North Village", gross.getLineItems().get(0).getDescription());
        assertEquals("Project Level", gross.getLineItems().get(1).getDescription());
        assertEquals("revenue-gross-project", gross.getLineItems().get(1).getLineId());
        assertEquals(700_000, gross.getSectionTotal(), DELTA);

        Section deductions = sections.get(3);
        assertEquals(2, deductions.getLineItems().size());
        assertEquals(-40_000, deductions.getSectionTotal(), DELTA);

        Section net = sections.get(4);
        assertEquals(660_000, net.getSectionTotal(), DELTA);
        assertEquals(new PeriodAmount(9, 470_000), net.getSubtotals().get(0));
    }

    @Test
    void testFinancingSectionFromLoanNetCashFlows() {
        List<LoanPeriod> loanPeriods = new ArrayList<>();
        for (int p = 0; p < PERIODS; p++) {
            loanPeriods.add(LoanPeriod.builder().periodIndex(p).netCashFlow(p == 0 ? 900_000 : p == 11 ? -950_000 : 0)
                    .build());
        }
        LoanSchedule loan = LoanSchedule.builder().loanId(5L).loanName("Bridge").structureType(StructureType.TERM)
                .periods(loanPeriods).build();

        List<Section> sections = assembler.assemble(costSchedule, absorption, hierarchy, List.of(loan), null, PERIODS);

        Section financing = sections.get(sections.size() - 1);
        assertEquals("financing", financing.getSectionId());
        assertEquals("loan-5", financing.getLineItems().get(0).getLineId());
        assertEquals("TERM", financing.getLineItems().get(0).getSubcategory());
        assertEquals(-50_000, financing.getSectionTotal(), DELTA);
    }

    @Test
    void testLotbankSectionsSigned() {
        double[] deposits = new double[PERIODS];
        deposits[0] = 30_000;
        double[] credits = new double[PERIODS];
        credits[11] = 30_000;
        double[] fees = new double[PERIODS];
        fees[0] = 25_000;
        Map<Long, double[]> creditsByProduct = new LinkedHashMap<>();
        creditsByProduct.put(10L, credits);
        LotbankSchedule lotbank = LotbankSchedule.builder()
                .products(List.of(LotbankProduct.builder().productId(10L).productName("North Village").build()))
                .initialDeposit(30_000)
                .optionDeposits(deposits)
                .depositCredits(creditsByProduct)
                .underwritingFees(fees)
                .managementFees(new double[PERIODS])
                .defaultProvisions(new double[PERIODS])
                .build();

        List<Section> sections = assembler.assemble(costSchedule, absorption, hierarchy, List.of(), lotbank, PERIODS);

        List<String> ids = ids(sections);
        assertTrue(ids.containsAll(List.of("lotbank-option-deposits", "lotbank-deposit-credits",
                "lotbank-underwriting-fee")));
        // all-zero fee series produce no section
        assertFalse(ids.contains("lotbank-management-fees"));
        assertFalse(ids.contains("lotbank-default-provision"));
        Section deposit = sections.get(ids.indexOf("lotbank-option-deposits"));
        assertEquals(30_000, deposit.getSectionTotal(), DELTA);
        Section credit = sections.get(ids.indexOf("lotbank-deposit-credits"));
        assertEquals(-30_000, credit.getSectionTotal(), DELTA);
        assertEquals(10L, credit.getLineItems().get(0).getContainerId());
    }

    @Test
    void testSalesPastHorizonNotShown() {
        AbsorptionSchedule late = new AbsorptionScheduler().build(List.of(
                ParcelSale.builder().parcelId(1L).containerId(10L).salePeriod(20).units(5.0)
                        .grossRevenue(500_000.0).netRevenue(470_000.0).build()), 0.0, null);

        List<Section> sections = assembler.assemble(costSchedule, late, hierarchy, List.of(), null, PERIODS);

        assertEquals(500_000, late.getTotalGrossRevenue(), DELTA);
        assertFalse(ids(sections).contains("revenue-deductions"));
        Section gross = sections.get(ids(sections).indexOf("revenue-gross"));
        assertTrue(gross.getLineItems().get(0).getPeriods().isEmpty());
    }
}
