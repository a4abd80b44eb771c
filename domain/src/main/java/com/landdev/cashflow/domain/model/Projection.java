package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of one projection run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Projection {

    public static final String PERIOD_TYPE_MONTH = "month";

    private Long projectId;

    private String projectName;

    private String analysisType;

    @Builder.Default
    private String periodType = PERIOD_TYPE_MONTH;

    private LocalDate startDate;

    private LocalDate endDate;

    private int totalPeriods;

    private double discountRate;

    private boolean includeFinancing;

    @Builder.Default
    private List<Long> containerIds = new ArrayList<>();

    @Builder.Default
    private List<Period> periods = new ArrayList<>();

    /**
     * In display order
     */
    @Builder.Default
    private List<Section> sections = new ArrayList<>();

    private SummaryMetrics summary;

    @Builder.Default
    private List<LoanSchedule> loanSchedules = new ArrayList<>();
}
