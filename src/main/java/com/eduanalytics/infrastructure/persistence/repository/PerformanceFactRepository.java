package com.eduanalytics.infrastructure.persistence.repository;

import com.eduanalytics.domain.model.CourseLevel;
import com.eduanalytics.domain.model.PerformanceAggregate;
import com.eduanalytics.domain.service.PerformanceScoring;
import com.eduanalytics.infrastructure.persistence.entity.PerformanceFactEntity;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for performance facts.
 *
 * Date filters apply to the fact's time dimension date. Aggregates are grouped in the
 * database; these queries are expensive and their callers cache the combined results.
 */
@Repository
public interface PerformanceFactRepository extends JpaRepository<PerformanceFactEntity, Long> {

    // The final score decides when present, otherwise the stored flag
    String PASSED_COUNT =
            "SUM(CASE WHEN f.finalScore >= " + PerformanceScoring.PASS_THRESHOLD +
            " OR (f.finalScore IS NULL AND f.passed = true) THEN 1 ELSE 0 END)";

    String AGGREGATES =
            "COUNT(f), AVG(f.gradePoints), AVG(f.finalScore), SUM(f.creditsEarned), " + PASSED_COUNT;

    String DATE_RANGE =
            "(:startDate IS NULL OR t.calendarDate >= :startDate) AND " +
            "(:endDate IS NULL OR t.calendarDate <= :endDate)";

    @Query("SELECT new com.eduanalytics.domain.model.PerformanceAggregate(s.studentId, " + AGGREGATES + ") " +
           "FROM PerformanceFactEntity f " +
           "JOIN f.student s JOIN f.course c JOIN f.timeDimension t WHERE " +
           "(:studentId IS NULL OR s.studentId = :studentId) AND " +
           "(:courseId IS NULL OR c.courseId = :courseId) AND " + DATE_RANGE + " " +
           "GROUP BY s.studentId " +
           "ORDER BY s.studentId ASC")
    List<PerformanceAggregate> aggregateByStudent(
            @Param("studentId") Long studentId,
            @Param("courseId") Long courseId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Query("SELECT new com.eduanalytics.domain.model.PerformanceAggregate(c.courseId, " + AGGREGATES + ") " +
           "FROM PerformanceFactEntity f " +
           "JOIN f.student s JOIN f.course c JOIN f.timeDimension t WHERE " +
           "(:studentId IS NULL OR s.studentId = :studentId) AND " +
           "(:courseId IS NULL OR c.courseId = :courseId) AND " +
           "(:departmentId IS NULL OR c.department.departmentId = :departmentId) AND " +
           "(:level IS NULL OR c.level = :level) AND " + DATE_RANGE + " " +
           "GROUP BY c.courseId " +
           "ORDER BY c.courseId ASC")
    List<PerformanceAggregate> aggregateByCourse(
            @Param("studentId") Long studentId,
            @Param("courseId") Long courseId,
            @Param("departmentId") Long departmentId,
            @Param("level") CourseLevel level,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    /**
     * Facts of the students affiliated with each department through their major.
     */
    @Query("SELECT new com.eduanalytics.domain.model.PerformanceAggregate(d.departmentId, " + AGGREGATES + ") " +
           "FROM PerformanceFactEntity f JOIN f.student s JOIN f.timeDimension t, DepartmentEntity d WHERE " +
           DepartmentAffiliation.MAJOR_IN_DEPARTMENT + " AND " +
           "(:departmentId IS NULL OR d.departmentId = :departmentId) AND " + DATE_RANGE + " " +
           "GROUP BY d.departmentId " +
           "ORDER BY d.departmentId ASC")
    List<PerformanceAggregate> aggregateByDepartment(
            @Param("departmentId") Long departmentId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Query("SELECT AVG(f.gradePoints) FROM PerformanceFactEntity f JOIN f.timeDimension t WHERE " + DATE_RANGE)
    Double averageGradePointsBetween(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    /**
     * Time-series aggregation: period label, fact count, mean grade points.
     *
     * pattern is a TO_CHAR pattern producing sortable labels.
     */
    @Query(value = "SELECT " +
           "TO_CHAR(t.calendar_date, :pattern) AS period, " +
           "COUNT(*) AS records, " +
           "AVG(f.grade_points) AS average " +
           "FROM student_performance_fact f " +
           "JOIN dim_time t ON t.time_id = f.time_id " +
           "WHERE (CAST(:studentId AS BIGINT) IS NULL OR f.student_id = :studentId) " +
           "AND (CAST(:courseId AS BIGINT) IS NULL OR f.course_id = :courseId) " +
           "AND (CAST(:startDate AS DATE) IS NULL OR t.calendar_date >= :startDate) " +
           "AND (CAST(:endDate AS DATE) IS NULL OR t.calendar_date <= :endDate) " +
           "GROUP BY 1 " +
           "ORDER BY 1 ASC",
           nativeQuery = true)
    List<Object[]> aggregateTrend(
            @Param("pattern") String pattern,
            @Param("studentId") Long studentId,
            @Param("courseId") Long courseId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @EntityGraph(attributePaths = {"timeDimension"})
    List<PerformanceFactEntity> findByStudentStudentIdOrderByFactIdAsc(Long studentId);

    @EntityGraph(attributePaths = {"timeDimension"})
    List<PerformanceFactEntity> findByCourseCourseIdOrderByFactIdAsc(Long courseId);

    @Query("SELECT AVG(f.gradePoints) FROM PerformanceFactEntity f WHERE f.student.studentId = :studentId")
    Double averageGradePoints(@Param("studentId") Long studentId);

    @Query("SELECT COALESCE(SUM(f.creditsEarned), 0) FROM PerformanceFactEntity f WHERE f.student.studentId = :studentId")
    Long sumCreditsEarned(@Param("studentId") Long studentId);
}
