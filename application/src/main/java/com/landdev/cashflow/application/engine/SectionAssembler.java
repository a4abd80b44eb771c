package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.enums.CostCategory;
import com.landdev.cashflow.domain.enums.SectionKind;
import com.landdev.cashflow.domain.model.AbsorptionSchedule;
import com.landdev.cashflow.domain.model.CostSchedule;
import com.landdev.cashflow.domain.model.LineItem;
import com.landdev.cashflow.domain.model.LoanSchedule;
import com.landdev.cashflow.domain.model.LotbankProduct;
import com.landdev.cashflow.domain.model.LotbankSchedule;
import com.landdev.cashflow.domain.model.PeriodAmount;
import com.landdev.cashflow.domain.model.ScheduledCost;
import com.landdev.cashflow.domain.model.ScheduledSale;
import com.landdev.cashflow.domain.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * Groups every schedule of a run into display sections, in this order:
 * cost categories, gross revenue, revenue deductions, net revenue, financing, then the lotbank sections.
 * Sections without lines are left out.
 */
@Component
public class SectionAssembler {

    private static final Logger log = LoggerFactory.getLogger(SectionAssembler.class);

    static final String PARCEL_SALES = "Parcel Sales";
    static final String REVENUE_DEDUCTIONS = "Revenue Deductions";

    public List<Section> assemble(CostSchedule costSchedule, AbsorptionSchedule absorption, ContainerHierarchy hierarchy,
                                  List<LoanSchedule> loanSchedules, LotbankSchedule lotbank, int periodCount) {
        List<Section> sections = new ArrayList<>();

        addCostSections(sections, costSchedule);
        addRevenueSections(sections, absorption, hierarchy, periodCount);
        addFinancingSection(sections, loanSchedules);
        if (lotbank != null) {
            addLotbankSections(sections, lotbank);
        }

        log.debug("Assembled {} sections", sections.size());
        return sections;
    }

    private void addCostSections(List<Section> sections, CostSchedule costSchedule) {
        for (CostCategory category : costSchedule.getCategorySummary().keySet()) {
            List<LineItem> lines = new ArrayList<>();
            for (ScheduledCost cost : costSchedule.getCosts()) {
                if (cost.getCategory() == category) {
                    lines.add(line(cost.getLineId(), category.getDisplayName(), null, cost.getDescription(),
                            cost.getContainerId(), cost.getAmounts(), -1));
                }
            }
            addSection(sections, "cost-" + category.name().toLowerCase(Locale.ROOT), SectionKind.COST,
                    category.getDisplayName(), lines);
        }
    }

    private void addRevenueSections(List<Section> sections, AbsorptionSchedule absorption,
                                    ContainerHierarchy hierarchy, int periodCount) {
        Map<Long, List<ScheduledSale>> byContainer = new TreeMap<>(Comparator.nullsLast(Comparator.naturalOrder()));
        for (ScheduledSale sale : absorption.allSales()) {
            byContainer.computeIfAbsent(sale.getContainerId(), k -> new ArrayList<>()).add(sale);
        }

        List<LineItem> gross = new ArrayList<>();
        List<LineItem> net = new ArrayList<>();
        for (Map.Entry<Long, List<ScheduledSale>> entry : byContainer.entrySet()) {
            Long containerId = entry.getKey();
            String suffix = containerId != null ? containerId.toString() : "project";
            String label = hierarchy.label(containerId);
            gross.add(line("revenue-gross-" + suffix, "Revenue", PARCEL_SALES, label, containerId,
                    byPeriod(entry.getValue(), ScheduledSale::getGrossRevenue, periodCount), 1));
            net.add(line("revenue-net-" + suffix, "Revenue", "Net Revenue", label, containerId,
                    byPeriod(entry.getValue(), ScheduledSale::getNetRevenue, periodCount), 1));
        }

        List<ScheduledSale> all = absorption.allSales();
        List<LineItem> deductions = new ArrayList<>();
        if (absorption.getTotalCommissions() > 0) {
            deductions.add(line("deduction-commissions", REVENUE_DEDUCTIONS, "Commissions", "Commissions", null,
                    byPeriod(all, ScheduledSale::getCommissions, periodCount), -1));
        }
        if (absorption.getTotalClosingCosts() > 0) {
            deductions.add(line("deduction-transaction", REVENUE_DEDUCTIONS, "Transaction Costs", "Transaction Costs",
                    null, byPeriod(all, ScheduledSale::getClosingCosts, periodCount), -1));
        }
        if (absorption.getTotalSubdivisionCosts() > 0) {
            deductions.add(line("deduction-subdivision", REVENUE_DEDUCTIONS, "Subdivision Costs", "Subdivision Costs",
                    null, byPeriod(all, ScheduledSale::getSubdivisionCosts, periodCount), -1));
        }

        addSection(sections, "revenue-gross", SectionKind.REVENUE_GROSS, "Gross Revenue", gross);
        addSection(sections, "revenue-deductions", SectionKind.REVENUE_DEDUCTION, REVENUE_DEDUCTIONS, deductions);
        addSection(sections, "revenue-net", SectionKind.REVENUE_NET, "Net Revenue", net);
    }

    private void addFinancingSection(List<Section> sections, List<LoanSchedule> loanSchedules) {
        List<LineItem> lines = new ArrayList<>();
        for (LoanSchedule loan : loanSchedules) {
            lines.add(line("loan-" + loan.getLoanId(), "Financing", loan.getStructureType().name(),
                    loan.getLoanName(), null, loan.netCashFlows(), 1));
        }
        addSection(sections, "financing", SectionKind.FINANCING, "Financing", lines);
    }

    private void addLotbankSections(List<Section> sections, LotbankSchedule lotbank) {
        addSection(sections, "lotbank-option-deposits", SectionKind.LOTBANK_OPTION_DEPOSIT, "Option Deposits",
                single("lotbank-option-deposits", "Option Deposits", lotbank.getOptionDeposits(), 1));

        List<LineItem> credits = new ArrayList<>();
        for (LotbankProduct product : lotbank.getProducts()) {
            double[] amounts = lotbank.getDepositCredits().get(product.getProductId());
            if (amounts != null) {
                credits.add(line("lotbank-deposit-credit-" + product.getProductId(), "Lotbank", "Deposit Credits",
                        product.getProductName(), product.getProductId(), amounts, -1));
            }
        }
        addSection(sections, "lotbank-deposit-credits", SectionKind.LOTBANK_DEPOSIT_CREDIT, "Deposit Credits", credits);

        addSection(sections, "lotbank-underwriting-fee", SectionKind.LOTBANK_UNDERWRITING_FEE, "Underwriting Fee",
                single("lotbank-underwriting-fee", "Underwriting Fee", lotbank.getUnderwritingFees(), -1));
        addSection(sections, "lotbank-management-fees", SectionKind.LOTBANK_MANAGEMENT_FEE, "Management Fees",
                single("lotbank-management-fees", "Management Fees", lotbank.getManagementFees(), -1));
        addSection(sections, "lotbank-default-provision", SectionKind.LOTBANK_DEFAULT_PROVISION, "Default Provision",
                single("lotbank-default-provision", "Default Provision", lotbank.getDefaultProvisions(), -1));
    }

    private List<LineItem> single(String lineId, String description, double[] amounts, int sign) {
        LineItem item = line(lineId, "Lotbank", description, description, null, amounts, sign);
        return item.getPeriods().isEmpty() ? List.of() : List.of(item);
    }

    private void addSection(List<Section> sections, String sectionId, SectionKind kind, String title,
                            List<LineItem> lines) {
        if (lines.isEmpty()) {
            return;
        }
        Map<Integer, Double> byPeriod = new TreeMap<>();
        double sectionTotal = 0;
        for (LineItem item : lines) {
            for (PeriodAmount amount : item.getPeriods()) {
                byPeriod.merge(amount.getPeriodIndex(), amount.getAmount(), Double::sum);
            }
            sectionTotal += item.getTotal();
        }
        List<PeriodAmount> subtotals = new ArrayList<>();
        byPeriod.forEach((period, amount) -> {
            if (amount != 0) {
                subtotals.add(new PeriodAmount(period, amount));
            }
        });

        sections.add(Section.builder()
                .sectionId(sectionId)
                .kind(kind)
                .title(title)
                .lineItems(lines)
                .subtotals(subtotals)
                .sectionTotal(sectionTotal)
                .build());
    }

    static LineItem line(String lineId, String category, String subcategory, String description, Long containerId,
                         double[] amounts, int sign) {
        List<PeriodAmount> periods = new ArrayList<>();
        double total = 0;
        for (int p = 0; p < amounts.length; p++) {
            if (amounts[p] != 0) {
                double amount = sign * amounts[p];
                periods.add(new PeriodAmount(p, amount));
                total += amount;
            }
        }
        return LineItem.builder()
                .lineId(lineId)
                .category(category)
                .subcategory(subcategory)
                .description(description)
                .containerId(containerId)
                .periods(periods)
                .total(total)
                .build();
    }

    /**
     * Sales outside the horizon are not shown
     */
    private static double[] byPeriod(List<ScheduledSale> sales, ToDoubleFunction<ScheduledSale> field, int periodCount) {
        double[] amounts = new double[periodCount];
        for (ScheduledSale sale : sales) {
            int p = sale.getPeriodIndex();
            if (p >= 0 && p < periodCount) {
                amounts[p] += field.applyAsDouble(sale);
            }
        }
        return amounts;
    }
}
