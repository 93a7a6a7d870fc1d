package com.eduanalytics.domain.service;

import com.eduanalytics.domain.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MetricsAggregator.
 *
 * Inputs are the grouped results the repositories return, so no store is involved.
 */
class MetricsAggregatorTest {

    private MetricsAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new MetricsAggregator();
    }

    @Test
    void testPerformanceMetrics_PassRateFromPassedCount() {
        // Given
        List<PerformanceAggregate> groups = List.of(new PerformanceAggregate(1L, 2L, 2.75, 72.0, 7L, 1L));

        // When
        List<PerformanceMetrics> result = aggregator.performanceMetrics(groups);

        // Then
        assertEquals(1, result.size());
        PerformanceMetrics metrics = result.get(0);
        assertEquals(1L, metrics.getStudentId());
        assertEquals(50.0, metrics.getPassRate(), 0.0001);
        assertEquals(2.75, metrics.getGpa(), 0.0001);
        assertEquals(7, metrics.getCreditsCompleted());
        assertEquals(2, metrics.getCoursesTaken());
        assertEquals(72.0, metrics.getAverageGrade(), 0.0001);
    }

    @Test
    void testPerformanceMetrics_NullAveragesAndSumsAreZero() {
        List<PerformanceMetrics> result = aggregator.performanceMetrics(
                List.of(new PerformanceAggregate(3L, 1L, null, null, null, null)));

        assertEquals(0.0, result.get(0).getGpa());
        assertEquals(0, result.get(0).getCreditsCompleted());
        assertEquals(0.0, result.get(0).getPassRate());
    }

    @Test
    void testPerformanceMetrics_KeepsStoreOrder() {
        List<PerformanceAggregate> groups = List.of(
                new PerformanceAggregate(3L, 1L, 2.0, 65.0, 3L, 1L),
                new PerformanceAggregate(7L, 1L, 3.0, 70.0, 3L, 1L));

        List<PerformanceMetrics> result = aggregator.performanceMetrics(groups);

        assertEquals(List.of(3L, 7L), result.stream().map(PerformanceMetrics::getStudentId).toList());
    }

    @Test
    void testPerformanceMetrics_EmptyInput() {
        assertTrue(aggregator.performanceMetrics(List.of()).isEmpty());
    }

    @Test
    void testOverall_EmptyIsZeroValued() {
        PerformanceMetrics overall = aggregator.overall(List.of());

        assertEquals(0L, overall.getStudentId());
        assertEquals(0.0, overall.getPassRate());
        assertEquals(0, overall.getCoursesTaken());
    }

    @Test
    void testEnrollmentStats_RetentionZeroWhenNoStudents() {
        EnrollmentStats stats = aggregator.enrollmentStats(List.of(), 0);

        assertEquals(0, stats.getTotalStudents());
        assertEquals(0.0, stats.getRetentionRate());
    }

    @Test
    void testEnrollmentStats_StatusPartitionAndNewEnrollments() {
        // Given
        List<StatusCount> byStatus = List.of(
                new StatusCount(StudentStatus.ACTIVE, 2L),
                new StatusCount(StudentStatus.GRADUATED, 1L),
                new StatusCount(StudentStatus.DROPPED, 1L));

        // When
        EnrollmentStats stats = aggregator.enrollmentStats(byStatus, 2);

        // Then
        assertEquals(4, stats.getTotalStudents());
        assertEquals(2, stats.getActiveStudents());
        assertEquals(1, stats.getGraduatedStudents());
        assertEquals(2, stats.getNewEnrollments());
        assertEquals(50.0, stats.getRetentionRate(), 0.0001);
    }

    @Test
    void testCourseStats_CompletionRateIsPlaceholder() {
        // Given - Optics has enrollments but no graded records
        List<CourseSnapshot> courses = List.of(
                new CourseSnapshot(10L, "Mechanics", 1L, CourseLevel.UNDERGRADUATE),
                new CourseSnapshot(11L, "Optics", 1L, CourseLevel.GRADUATE));
        List<PerformanceAggregate> performance = List.of(new PerformanceAggregate(10L, 2L, 2.75, 72.0, 6L, 1L));
        List<EnrollmentAggregate> enrollments = List.of(
                new EnrollmentAggregate(10L, 2L, 0L, 1L, 1L),
                new EnrollmentAggregate(11L, 1L, 1L, 0L, 0L));

        // When
        List<CourseStats> stats = aggregator.courseStats(courses, performance, enrollments);

        // Then
        assertEquals(2, stats.size());
        CourseStats mechanics = stats.get(0);
        assertEquals(2, mechanics.getTotalEnrollments());
        assertEquals(72.0, mechanics.getAverageGrade(), 0.0001);
        assertEquals(50.0, mechanics.getPassRate(), 0.0001);
        assertEquals(MetricsAggregator.PLACEHOLDER_COMPLETION_RATE, mechanics.getCompletionRate());

        CourseStats optics = stats.get(1);
        assertEquals(1, optics.getTotalEnrollments());
        assertEquals(0.0, optics.getAverageGrade());
        assertEquals(0.0, optics.getPassRate());
    }

    @Test
    void testDepartmentStats_CountsJoinedByDepartmentId() {
        // Given - History has no students and no graded records
        List<DepartmentSnapshot> departments = List.of(
                new DepartmentSnapshot(1L, "Physics"),
                new DepartmentSnapshot(2L, "History"));
        List<GroupCount> courses = List.of(new GroupCount(1L, 2L), new GroupCount(2L, 1L));
        List<GroupCount> students = List.of(new GroupCount(1L, 1L));
        List<PerformanceAggregate> performance = List.of(new PerformanceAggregate(1L, 1L, 3.0, 80.0, 3L, 1L));

        // When
        List<DepartmentStats> stats = aggregator.departmentStats(departments, courses, students, performance);

        // Then
        assertEquals(2, stats.size());
        DepartmentStats physics = stats.get(0);
        assertEquals(2, physics.getTotalCourses());
        assertEquals(1, physics.getTotalStudents());
        assertEquals(3.0, physics.getAverageGpa(), 0.0001);
        assertEquals(MetricsAggregator.PLACEHOLDER_GRADUATION_RATE, physics.getGraduationRate());

        DepartmentStats history = stats.get(1);
        assertEquals(1, history.getTotalCourses());
        assertEquals(0, history.getTotalStudents());
        assertEquals(0.0, history.getAverageGpa());
    }

    @Test
    void testTrendPoints_NativeNumberTypesMapped() {
        List<Object[]> rows = List.of(
                new Object[]{"2024-01", 2L, 3.0},
                new Object[]{"2024-02", 4, new BigDecimal("62.5")},
                new Object[]{"2024-03", 1L, null});

        List<TrendPoint> points = aggregator.trendPoints(rows);

        assertEquals(List.of("2024-01", "2024-02", "2024-03"), points.stream().map(TrendPoint::getPeriod).toList());
        assertEquals(4, points.get(1).getCount());
        assertEquals(62.5, points.get(1).getAverage(), 0.0001);
        assertEquals(0.0, points.get(2).getAverage());
    }

    @Test
    void testStudentStatistics_NoFactsIsZeroValued() {
        StudentStatistics statistics = aggregator.studentStatistics(5L, null, null);

        assertEquals(5L, statistics.getStudentId());
        assertEquals(0, statistics.getTotalCourses());
        assertEquals(0, statistics.getTotalEnrollments());
        assertEquals(0.0, statistics.getPassRate());
    }

    @Test
    void testCourseStatistics_ActiveAndCompletedFromGroup() {
        CourseStatistics statistics = aggregator.courseStatistics(10L,
                new PerformanceAggregate(10L, 4L, 3.0, 75.0, 12L, 3L),
                new EnrollmentAggregate(10L, 6L, 1L, 2L, 3L));

        assertEquals(6, statistics.getTotalEnrollments());
        assertEquals(3, statistics.getActiveEnrollments());
        assertEquals(2, statistics.getCompletedEnrollments());
        assertEquals(3, statistics.getPassedStudents());
        assertEquals(75.0, statistics.getPassRate(), 0.0001);
    }

    @Test
    void testInstitutionalKpis_PlaceholdersAndComputedValues() {
        EnrollmentStats enrollment = EnrollmentStats.builder().retentionRate(80.0).build();

        InstitutionalKpis kpis = aggregator.institutionalKpis(enrollment, 2.5, 4.2);

        assertEquals(80.0, kpis.getRetentionRate());
        assertEquals(2.5, kpis.getAverageGpa(), 0.0001);
        assertEquals(4.2, kpis.getStudentSatisfaction());
        assertEquals(78.5, kpis.getGraduationRate());
        assertEquals(15.2, kpis.getFacultyRatio());
        assertEquals(87.3, kpis.getBudgetUtilization());
    }

    @Test
    void testInstitutionalKpis_NoGradedRecordsMeansZeroGpa() {
        InstitutionalKpis kpis = aggregator.institutionalKpis(EnrollmentStats.builder().build(), null, 0.0);

        assertEquals(0.0, kpis.getAverageGpa());
    }
}
