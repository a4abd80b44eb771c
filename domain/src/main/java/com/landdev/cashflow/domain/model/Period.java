package com.landdev.cashflow.domain.model;


import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One monthly calculation period of a projection
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Period {

    /**
     * 0-based position in the projection
     */
    private int index;

    /**
     * 1-based position, the unit budget items and parcel sales are keyed by
     */
    private int sequence;

    private LocalDate startDate;

    /**
     * Last day of the calendar month containing startDate
     */
    private LocalDate endDate;

    /**
     * Display label, e.g. "Jan 2025"
     */
    private String label;
}
