package com.landdev.cashflow.application.engine;

import com.landdev.cashflow.domain.exception.ValidationException;
import com.landdev.cashflow.domain.model.Period;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeriodGeneratorTest {

    private PeriodGenerator periodGenerator;

    @BeforeEach
    void setUp() {
        periodGenerator = new PeriodGenerator();
    }

    @Test
    void testGenerateConsecutiveMonths() {
        List<Period> periods = periodGenerator.generate(LocalDate.of(2025, 1, 1), 14);

        assertEquals(14, periods.size());
        assertEquals(0, periods.get(0).getIndex());
        assertEquals(1, periods.get(0).getSequence());
        assertEquals(LocalDate.of(2025, 1, 31), periods.get(0).getEndDate());
        assertEquals("Jan 2025", periods.get(0).getLabel());
        assertEquals(LocalDate.of(2025, 2, 28), periods.get(1).getEndDate());
        assertEquals("Feb 2026", periods.get(13).getLabel());
        for (int i = 0; i < periods.size(); i++) {
            assertEquals(i, periods.get(i).getIndex());
        }
    }

    @Test
    void testGenerateRejectsZeroPeriods() {
        assertThrows(ValidationException.class, () -> periodGenerator.generate(LocalDate.of(2025, 1, 1), 0));
    }

    @Test
    void testGenerateRejectsMissingStartDate() {
        assertThrows(ValidationException.class, () -> periodGenerator.generate(null, 12));
    }

    @Test
    void testPeriodIndexForDate() {
        List<Period> periods = periodGenerator.generate(LocalDate.of(2025, 1, 1), 12);

        assertEquals(0, PeriodGenerator.periodIndexForDate(periods, null));
        assertEquals(0, PeriodGenerator.periodIndexForDate(periods, LocalDate.of(2024, 6, 1)));
        assertEquals(5, PeriodGenerator.periodIndexForDate(periods, LocalDate.of(2025, 6, 15)));
        assertEquals(11, PeriodGenerator.periodIndexForDate(periods, LocalDate.of(2030, 1, 1)));
    }

    @Test
    void testMonthsFromStart() {
        LocalDate start = LocalDate.of(2025, 1, 1);

        assertEquals(5, PeriodGenerator.monthsFromStart(start, LocalDate.of(2025, 6, 1)));
        assertEquals(12, PeriodGenerator.monthsFromStart(start, LocalDate.of(2026, 1, 20)));
        assertEquals(0, PeriodGenerator.monthsFromStart(start, LocalDate.of(2024, 3, 1)));
        assertEquals(0, PeriodGenerator.monthsFromStart(start, null));
    }
}
