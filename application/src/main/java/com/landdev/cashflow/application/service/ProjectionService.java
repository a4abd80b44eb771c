package com.landdev.cashflow.application.service;

import com.landdev.cashflow.application.engine.AbsorptionScheduler;
import com.landdev.cashflow.application.engine.ContainerHierarchy;
import com.landdev.cashflow.application.engine.CostScheduleBuilder;
import com.landdev.cashflow.application.engine.MetricsAggregator;
import com.landdev.cashflow.application.engine.PeriodCostsBuilder;
import com.landdev.cashflow.application.engine.PeriodCountResolver;
import com.landdev.cashflow.application.engine.PeriodGenerator;
import com.landdev.cashflow.application.engine.SectionAssembler;
import com.landdev.cashflow.application.engine.debt.DebtServiceEngine;
import com.landdev.cashflow.application.engine.debt.LoanTermsResolver;
import com.landdev.cashflow.application.engine.lotbank.AnalysisTypeResolver;
import com.landdev.cashflow.application.engine.lotbank.LotbankEngine;
import com.landdev.cashflow.application.engine.lotbank.LotbankProductBuilder;
import com.landdev.cashflow.domain.enums.AnalysisType;
import com.landdev.cashflow.domain.exception.ProjectionException;
import com.landdev.cashflow.domain.model.AbsorptionSchedule;
import com.landdev.cashflow.domain.model.BudgetItem;
import com.landdev.cashflow.domain.model.CostSchedule;
import com.landdev.cashflow.domain.model.Loan;
import com.landdev.cashflow.domain.model.LoanSchedule;
import com.landdev.cashflow.domain.model.LotbankProduct;
import com.landdev.cashflow.domain.model.LotbankSchedule;
import com.landdev.cashflow.domain.model.ParcelSale;
import com.landdev.cashflow.domain.model.Period;
import com.landdev.cashflow.domain.model.PeriodCosts;
import com.landdev.cashflow.domain.model.ProjectAssumptions;
import com.landdev.cashflow.domain.model.Projection;
import com.landdev.cashflow.domain.model.Section;
import com.landdev.cashflow.domain.model.SummaryMetrics;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Engine entry point: project(projectId, containerIds, includeFinancing) -> Projection.
 * <p>
 * Inputs are fully loaded first; the computation itself is synchronous, deterministic and side-effect free.
 */
@Service
public class ProjectionService {

    private static final Logger log = LoggerFactory.getLogger(ProjectionService.class);

    private final ProjectInputLoader inputLoader;
    private final AnalysisTypeResolver analysisTypeResolver;
    private final PeriodCountResolver periodCountResolver;
    private final PeriodGenerator periodGenerator;
    private final CostScheduleBuilder costScheduleBuilder;
    private final AbsorptionScheduler absorptionScheduler;
    private final PeriodCostsBuilder periodCostsBuilder;
    private final LoanTermsResolver loanTermsResolver;
    private final DebtServiceEngine debtServiceEngine;
    private final LotbankProductBuilder lotbankProductBuilder;
    private final LotbankEngine lotbankEngine;
    private final SectionAssembler sectionAssembler;
    private final MetricsAggregator metricsAggregator;
    private final MetricsService metricsService;
    private final CorrelationIdService correlationIdService;
    private final TimeLimiter timeLimiter;
    private final LocalDate defaultStartDate;
    private final double defaultDiscountRate;

    public ProjectionService(ProjectInputLoader inputLoader,
                             AnalysisTypeResolver analysisTypeResolver,
                             PeriodCountResolver periodCountResolver,
                             PeriodGenerator periodGenerator,
                             CostScheduleBuilder costScheduleBuilder,
                             AbsorptionScheduler absorptionScheduler,
                             PeriodCostsBuilder periodCostsBuilder,
                             LoanTermsResolver loanTermsResolver,
                             DebtServiceEngine debtServiceEngine,
                             LotbankProductBuilder lotbankProductBuilder,
                             LotbankEngine lotbankEngine,
                             SectionAssembler sectionAssembler,
                             MetricsAggregator metricsAggregator,
                             MetricsService metricsService,
                             CorrelationIdService correlationIdService,
                             @Qualifier("projectionTimeLimiter") TimeLimiter timeLimiter,
                             @Value("${app.projection.default-start-date:2025-01-01}") String defaultStartDate,
                             @Value("${app.projection.default-discount-rate:0.10}") double defaultDiscountRate) {
        this.inputLoader = inputLoader;
        this.analysisTypeResolver = analysisTypeResolver;
        this.periodCountResolver = periodCountResolver;
        this.periodGenerator = periodGenerator;
        this.costScheduleBuilder = costScheduleBuilder;
        this.absorptionScheduler = absorptionScheduler;
        this.periodCostsBuilder = periodCostsBuilder;
        this.loanTermsResolver = loanTermsResolver;
        this.debtServiceEngine = debtServiceEngine;
        this.lotbankProductBuilder = lotbankProductBuilder;
        this.lotbankEngine = lotbankEngine;
        this.sectionAssembler = sectionAssembler;
        this.metricsAggregator = metricsAggregator;
        this.metricsService = metricsService;
        this.correlationIdService = correlationIdService;
        this.timeLimiter = timeLimiter;
        this.defaultStartDate = LocalDate.parse(defaultStartDate);
        this.defaultDiscountRate = defaultDiscountRate;
    }

    /**
     * Project the monthly cash flows of a project
     * @param projectId Project to project
     * @param containerIds Optional container filter; null or empty for the whole project
     * @param includeFinancing Whether loans are scheduled and shown
     */
    public Projection project(Long projectId, Collection<Long> containerIds, boolean includeFinancing) {
        Timer.Sample sample = metricsService.startTimer();
        long started = System.nanoTime();
        try {
            ProjectionContext context = prepare(projectId, containerIds, includeFinancing);
            List<Period> periods = context.getPeriods();
            int periodCount = periods.size();
            ProjectAssumptions assumptions = context.getInputs().getAssumptions();

            List<LoanSchedule> loanSchedules = new ArrayList<>();
            if (includeFinancing && !context.getLoansInScope().isEmpty()) {
                Timer.Sample debtSample = metricsService.startTimer();
                loanSchedules = debtServiceEngine.schedule(context.getLoansInScope(), periods, context.getPeriodCosts());
                int iterations = loanSchedules.stream().mapToInt(LoanSchedule::getConvergenceIterations).sum();
                metricsService.recordRevolverSolve(debtSample, iterations);
            }

            LotbankSchedule lotbank = null;
            if (context.getAnalysisType().isLotbank()) {
                List<LotbankProduct> products = lotbankProductBuilder.build(context.getHierarchy(), context.getPeriodCosts());
                if (!products.isEmpty()) {
                    lotbank = lotbankEngine.calculate(products, periodCount,
                            valueOf(assumptions.getManagementFeePct()),
                            valueOf(assumptions.getDefaultProvisionPct()),
                            valueOf(assumptions.getUnderwritingFee()));
                } else {
                    log.info("Project {} is a lotbank deal but no division carries lotbank pricing", projectId);
                }
            }

            List<Section> sections = sectionAssembler.assemble(context.getCostSchedule(), context.getAbsorption(),
                    context.getHierarchy(), loanSchedules, lotbank, periodCount);

            double discountRate = assumptions.getDiscountRate() != null ? assumptions.getDiscountRate() : defaultDiscountRate;
            SummaryMetrics summary = metricsAggregator.aggregate(sections, periods, context.getCostSchedule(),
                    context.getAbsorption(), discountRate);

            Projection projection = Projection.builder()
                    .projectId(projectId)
                    .projectName(assumptions.getProjectName())
                    .analysisType(context.getAnalysisType().name())
                    .startDate(periods.get(0).getStartDate())
                    .endDate(periods.get(periodCount - 1).getEndDate())
                    .totalPeriods(periodCount)
                    .discountRate(discountRate)
                    .includeFinancing(includeFinancing)
                    .containerIds(new ArrayList<>(context.getContainerFilter()))
                    .periods(periods)
                    .sections(sections)
                    .summary(summary)
                    .loanSchedules(loanSchedules)
                    .build();

            metricsService.recordProjectionRun();
            log.info("Projected project {} ({} periods, {} sections, financing {}) in {} ms",
                    projectId, periodCount, sections.size(), includeFinancing, (System.nanoTime() - started) / 1_000_000);
            return projection;
        } catch (ProjectionException e) {
            metricsService.recordProjectionFailure(e.getClass().getSimpleName());
            throw e;
        } finally {
            metricsService.recordProjection(sample);
        }
    }

    /**
     * Same as {@link #project} but discarded once the configured timeout elapses
     * @throws TimeoutException when the run does not finish in time
     */
    public Projection projectWithTimeout(Long projectId, Collection<Long> containerIds, boolean includeFinancing)
            throws TimeoutException {
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(
                    correlationIdService.withCurrentContext(() -> project(projectId, containerIds, includeFinancing))));
        } catch (TimeoutException e) {
            log.warn("Projection of project {} timed out", projectId);
            metricsService.recordProjectionTimeout();
            throw e;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Projection of project " + projectId + " failed", e);
        }
    }

    /**
     * Load inputs and build everything up to the per-period cost context
     */
    ProjectionContext prepare(Long projectId, Collection<Long> containerIds, boolean includeFinancing) {
        ProjectInputs inputs = inputLoader.load(projectId);
        ProjectAssumptions assumptions = inputs.getAssumptions();
        AnalysisType analysisType = analysisTypeResolver.resolve(assumptions.getAnalysisType());

        Set<Long> filter = containerIds != null ? new LinkedHashSet<>(containerIds) : new LinkedHashSet<>();
        List<Loan> loansInScope = includeFinancing
                ? DebtServiceEngine.loansInScope(inputs.getLoans(), filter)
                : List.of();
        loansInScope.forEach(loanTermsResolver::checkSupported);

        LocalDate startDate = assumptions.getAnalysisStartDate() != null
                ? assumptions.getAnalysisStartDate() : defaultStartDate;
        int periodCount = periodCountResolver.resolve(
                filterBudget(inputs.getBudgetItems(), filter),
                filterSales(inputs.getParcelSales(), filter),
                loansInScope, startDate, assumptions.getHoldPeriodMonths(), includeFinancing);
        List<Period> periods = periodGenerator.generate(startDate, periodCount);

        CostSchedule costSchedule = costScheduleBuilder.build(inputs.getBudgetItems(), inputs.getAcquisitionCosts(),
                CostScheduleBuilder.acreageShare(inputs.getParcelSales(), filter), periodCount, filter,
                valueOf(assumptions.getCostInflationRate()));
        AbsorptionSchedule absorption = absorptionScheduler.build(inputs.getParcelSales(),
                valueOf(assumptions.getPriceGrowthRate()), filter);

        ContainerHierarchy hierarchy = new ContainerHierarchy(inputs.getContainers());
        List<PeriodCosts> periodCosts = periodCostsBuilder.build(costSchedule, absorption, hierarchy, periodCount);

        return ProjectionContext.builder()
                .inputs(inputs)
                .analysisType(analysisType)
                .containerFilter(filter)
                .includeFinancing(includeFinancing)
                .loansInScope(loansInScope)
                .periods(periods)
                .costSchedule(costSchedule)
                .absorption(absorption)
                .hierarchy(hierarchy)
                .periodCosts(periodCosts)
                .build();
    }

    private static List<BudgetItem> filterBudget(List<BudgetItem> items, Set<Long> filter) {
        if (filter.isEmpty()) {
            return items;
        }
        return items.stream().filter(item -> filter.contains(item.getContainerId())).collect(Collectors.toList());
    }

    private static List<ParcelSale> filterSales(List<ParcelSale> sales, Set<Long> filter) {
        if (filter.isEmpty()) {
            return sales;
        }
        return sales.stream().filter(sale -> filter.contains(sale.getContainerId())).collect(Collectors.toList());
    }

    private static double valueOf(Double value) {
        return value != null ? value : 0.0;
    }
}
