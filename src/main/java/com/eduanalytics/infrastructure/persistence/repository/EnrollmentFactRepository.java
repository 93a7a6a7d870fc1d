package com.eduanalytics.infrastructure.persistence.repository;

import com.eduanalytics.domain.model.CourseLevel;
import com.eduanalytics.domain.model.EnrollmentAggregate;
import com.eduanalytics.infrastructure.persistence.entity.EnrollmentFactEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for enrollment facts. Date filters apply to the enrollment date.
 */
@Repository
public interface EnrollmentFactRepository extends JpaRepository<EnrollmentFactEntity, Long> {

    String AGGREGATES =
            "COUNT(f), " +
            "SUM(CASE WHEN f.dropped = true THEN 1 ELSE 0 END), " +
            "SUM(CASE WHEN f.completed = true THEN 1 ELSE 0 END), " +
            "SUM(CASE WHEN f.dropped = false AND f.completed = false THEN 1 ELSE 0 END)";

    String DATE_RANGE =
            "(:startDate IS NULL OR f.enrollmentDate >= :startDate) AND " +
            "(:endDate IS NULL OR f.enrollmentDate <= :endDate)";

    @Query("SELECT new com.eduanalytics.domain.model.EnrollmentAggregate(s.studentId, " + AGGREGATES + ") " +
           "FROM EnrollmentFactEntity f JOIN f.student s JOIN f.course c WHERE " +
           "(:studentId IS NULL OR s.studentId = :studentId) AND " +
           "(:courseId IS NULL OR c.courseId = :courseId) AND " + DATE_RANGE + " " +
           "GROUP BY s.studentId " +
           "ORDER BY s.studentId ASC")
    List<EnrollmentAggregate> aggregateByStudent(
            @Param("studentId") Long studentId,
            @Param("courseId") Long courseId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    @Query("SELECT new com.eduanalytics.domain.model.EnrollmentAggregate(c.courseId, " + AGGREGATES + ") " +
           "FROM EnrollmentFactEntity f JOIN f.student s JOIN f.course c WHERE " +
           "(:studentId IS NULL OR s.studentId = :studentId) AND " +
           "(:courseId IS NULL OR c.courseId = :courseId) AND " +
           "(:departmentId IS NULL OR c.department.departmentId = :departmentId) AND " +
           "(:level IS NULL OR c.level = :level) AND " + DATE_RANGE + " " +
           "GROUP BY c.courseId " +
           "ORDER BY c.courseId ASC")
    List<EnrollmentAggregate> aggregateByCourse(
            @Param("studentId") Long studentId,
            @Param("courseId") Long courseId,
            @Param("departmentId") Long departmentId,
            @Param("level") CourseLevel level,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    /**
     * Time-series aggregation: period label, enrollment count, percentage completed.
     *
     * departmentId keeps the enrollments in that department's courses.
     */
    @Query(value = "SELECT " +
           "TO_CHAR(f.enrollment_date, :pattern) AS period, " +
           "COUNT(*) AS records, " +
           "AVG(CASE WHEN f.is_completed THEN 100.0 ELSE 0.0 END) AS average " +
           "FROM enrollment_fact f " +
           "JOIN dim_course c ON c.course_id = f.course_id " +
           "WHERE (CAST(:studentId AS BIGINT) IS NULL OR f.student_id = :studentId) " +
           "AND (CAST(:courseId AS BIGINT) IS NULL OR f.course_id = :courseId) " +
           "AND (CAST(:departmentId AS BIGINT) IS NULL OR c.department_id = :departmentId) " +
           "AND (CAST(:startDate AS DATE) IS NULL OR f.enrollment_date >= :startDate) " +
           "AND (CAST(:endDate AS DATE) IS NULL OR f.enrollment_date <= :endDate) " +
           "GROUP BY 1 " +
           "ORDER BY 1 ASC",
           nativeQuery = true)
    List<Object[]> aggregateTrend(
            @Param("pattern") String pattern,
            @Param("studentId") Long studentId,
            @Param("courseId") Long courseId,
            @Param("departmentId") Long departmentId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    List<EnrollmentFactEntity> findByStudentStudentIdOrderByEnrollmentDateDesc(Long studentId);

    List<EnrollmentFactEntity> findByCourseCourseIdOrderByEnrollmentDateDesc(Long courseId);
}
