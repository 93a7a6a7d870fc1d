package com.eduanalytics.infrastructure.persistence.entity;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class TimeDimensionEntityTest {

    @Test
    void testForDate_CalendarAttributes() {
        TimeDimensionEntity row = TimeDimensionEntity.forDate(LocalDate.of(2024, 9, 14));

        assertEquals(2024, row.getYear());
        assertEquals(3, row.getQuarter());
        assertEquals(9, row.getMonth());
        assertEquals("September", row.getMonthName());
        assertEquals(14, row.getDay());
        assertEquals(6, row.getDayOfWeek());
        assertEquals("Saturday", row.getDayName());
        assertTrue(row.isWeekend());
        assertFalse(row.isHoliday());
        assertEquals("Fall", row.getSemester());
        assertEquals("2024-2025", row.getAcademicYear());
    }

    @Test
    void testForDate_AcademicYearBeforeAugust() {
        TimeDimensionEntity row = TimeDimensionEntity.forDate(LocalDate.of(2024, 7, 31));

        assertEquals("2023-2024", row.getAcademicYear());
        assertEquals("Summer", row.getSemester());
    }

    @Test
    void testForDate_FixedHolidays() {
        assertTrue(TimeDimensionEntity.forDate(LocalDate.of(2024, 1, 1)).isHoliday());
        assertTrue(TimeDimensionEntity.forDate(LocalDate.of(2024, 7, 4)).isHoliday());
        assertTrue(TimeDimensionEntity.forDate(LocalDate.of(2024, 12, 25)).isHoliday());
        assertFalse(TimeDimensionEntity.forDate(LocalDate.of(2024, 12, 24)).isHoliday());
    }

    @Test
    void testForDate_SemesterBoundaries() {
        assertEquals("Spring", TimeDimensionEntity.forDate(LocalDate.of(2024, 5, 31)).getSemester());
        assertEquals("Summer", TimeDimensionEntity.forDate(LocalDate.of(2024, 6, 1)).getSemester());
        assertEquals("Fall", TimeDimensionEntity.forDate(LocalDate.of(2024, 9, 1)).getSemester());
    }
}
