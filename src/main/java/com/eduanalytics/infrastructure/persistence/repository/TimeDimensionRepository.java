package com.eduanalytics.infrastructure.persistence.repository;

import com.eduanalytics.infrastructure.persistence.entity.TimeDimensionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface TimeDimensionRepository extends JpaRepository<TimeDimensionEntity, Long> {

    Optional<TimeDimensionEntity> findByCalendarDate(LocalDate calendarDate);

    @Query("SELECT t.calendarDate FROM TimeDimensionEntity t " +
           "WHERE t.calendarDate BETWEEN :startDate AND :endDate")
    List<LocalDate> findDatesBetween(@Param("startDate") LocalDate startDate,
                                     @Param("endDate") LocalDate endDate);

    @Query("SELECT MIN(t.calendarDate) FROM TimeDimensionEntity t")
    Optional<LocalDate> findMinDate();

    @Query("SELECT MAX(t.calendarDate) FROM TimeDimensionEntity t")
    Optional<LocalDate> findMaxDate();

    /**
     * Inserts a row unless its date already exists. Concurrent writers of the same date
     * both succeed; only one of them reports the row.
     *
     * @return 1 if inserted, 0 if the date was already present
     */
    default int insertIfAbsent(TimeDimensionEntity row) {
        return insertRow(row.getCalendarDate(), row.getYear(), row.getQuarter(), row.getMonth(),
                row.getMonthName(), row.getDay(), row.getDayOfWeek(), row.getDayName(),
                row.isWeekend(), row.isHoliday(), row.getSemester(), row.getAcademicYear());
    }

    @Modifying
    @Query(value = "INSERT INTO dim_time (calendar_date, year, quarter, month, month_name, day, " +
                   "day_of_week, day_name, is_weekend, is_holiday, semester, academic_year) " +
                   "VALUES (:calendarDate, :year, :quarter, :month, :monthName, :day, " +
                   ":dayOfWeek, :dayName, :weekend, :holiday, :semester, :academicYear) " +
                   "ON CONFLICT (calendar_date) DO NOTHING",
           nativeQuery = true)
    int insertRow(@Param("calendarDate") LocalDate calendarDate,
                  @Param("year") Integer year,
                  @Param("quarter") Integer quarter,
                  @Param("month") Integer month,
                  @Param("monthName") String monthName,
                  @Param("day") Integer day,
                  @Param("dayOfWeek") Integer dayOfWeek,
                  @Param("dayName") String dayName,
                  @Param("weekend") boolean weekend,
                  @Param("holiday") boolean holiday,
                  @Param("semester") String semester,
                  @Param("academicYear") String academicYear);
}
