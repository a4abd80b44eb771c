package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.exception.ValidationException;
import com.landdev.cashflow.domain.model.Period;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the ordered monthly periods of a projection
 */
@Component
public class PeriodGenerator {

    private static final Logger log = LoggerFactory.getLogger(PeriodGenerator.class);
    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);

    /**
     * Generate periodCount consecutive months starting at startDate
     * @param startDate Start of the first period
     * @param periodCount Number of periods, at least 1
     */
    public List<Period> generate(LocalDate startDate, int periodCount) {
        if (startDate == null) {
            throw new ValidationException("Projection start date is required");
        }
        if (periodCount < 1) {
            throw new ValidationException("Period count must be at least 1, was " + periodCount);
        }

        List<Period> periods = new ArrayList<>(periodCount);
        for (int i = 0; i < periodCount; i++) {
            LocalDate periodStart = startDate.plusMonths(i);
            periods.add(Period.builder()
                    .index(i)
                    .sequence(i + 1)
                    .startDate(periodStart)
                    .endDate(YearMonth.from(periodStart).atEndOfMonth())
                    .label(periodStart.format(LABEL_FORMAT))
                    .build());
        }
        log.debug("Generated {} periods from {} to {}", periodCount, startDate, periods.get(periodCount - 1).getEndDate());
        return periods;
    }

    /**
     * Index of the first period whose end date is on or after the date.
     * A null date maps to period 0, a date past the horizon to the last period.
     */
    public static int periodIndexForDate(List<Period> periods, LocalDate date) {
        if (date == null || periods.isEmpty()) {
            return 0;
        }
        for (Period period : periods) {
            if (!period.getEndDate().isBefore(date)) {
                return period.getIndex();
            }
        }
        return periods.size() - 1;
    }

    /**
     * Whole months from the projection start to the date, never negative
     */
    public static int monthsFromStart(LocalDate startDate, LocalDate date) {
        if (date == null) {
            return 0;
        }
        int months = (date.getYear() - startDate.getYear()) * 12 + date.getMonthValue() - startDate.getMonthValue();
        return Math.max(months, 0);
    }
}
