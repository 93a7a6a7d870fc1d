package com.eduanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Time dimension: one row per calendar date.
 *
 * All attributes are derived from the date once, at creation, and never recomputed.
 */
@Entity
@Table(name = "dim_time", indexes = {
    @Index(name = "idx_time_date_unique", columnList = "calendar_date", unique = true),
    @Index(name = "idx_time_year_month", columnList = "year,month"),
    @Index(name = "idx_time_academic_year", columnList = "academic_year")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeDimensionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "time_id")
    private Long timeId;

    @Column(name = "calendar_date", nullable = false)
    private LocalDate calendarDate;

    @Column(nullable = false)
    private Integer year;

    @Column(nullable = false)
    private Integer quarter;

    @Column(nullable = false)
    private Integer month;

    @Column(nullable = false, length = 20)
    private String monthName;

    @Column(nullable = false)
    private Integer day;

    // ISO numbering, 1 = Monday
    @Column(nullable = false)
    private Integer dayOfWeek;

    @Column(nullable = false, length = 20)
    private String dayName;

    @Column(name = "is_weekend", nullable = false)
    private boolean weekend;

    @Column(name = "is_holiday", nullable = false)
    private boolean holiday;

    @Column(length = 20)
    private String semester;

    @Column(name = "academic_year", length = 20)
    private String academicYear;

    public static TimeDimensionEntity forDate(LocalDate date) {
        int year = date.getYear();
        int month = date.getMonthValue();
        DayOfWeek dow = date.getDayOfWeek();

        return TimeDimensionEntity.builder()
                .calendarDate(date)
                .year(year)
                .quarter((month - 1) / 3 + 1)
                .month(month)
                .monthName(date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .day(date.getDayOfMonth())
                .dayOfWeek(dow.getValue())
                .dayName(dow.getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .weekend(dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY)
                .holiday(isHoliday(date))
                .semester(semesterOf(month))
                .academicYear(month >= Month.AUGUST.getValue()
                        ? year + "-" + (year + 1)
                        : (year - 1) + "-" + year)
                .build();
    }

    // Fixed-date holidays only
    private static boolean isHoliday(LocalDate date) {
        Month month = date.getMonth();
        int day = date.getDayOfMonth();
        return (month == Month.JANUARY && day == 1)
                || (month == Month.JULY && day == 4)
                || (month == Month.DECEMBER && day == 25);
    }

    private static String semesterOf(int month) {
        if (month <= 5) {
            return "Spring";
        }
        if (month <= 8) {
            return "Summer";
        }
        return "Fall";
    }
}
