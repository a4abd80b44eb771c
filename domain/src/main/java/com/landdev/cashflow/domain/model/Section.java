package com.landdev.cashflow.domain.model;

import com.landdev.cashflow.domain.enums.SectionKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Named group of line items with per-period subtotals (zero periods omitted)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Section {

    private String sectionId;

    private SectionKind kind;

    private String title;

    @Builder.Default
    private List<LineItem> lineItems = new ArrayList<>();

    @Builder.Default
    private List<PeriodAmount> subtotals = new ArrayList<>();

    private double sectionTotal;
}
