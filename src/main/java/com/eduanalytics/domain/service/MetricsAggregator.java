package com.eduanalytics.domain.service;

import com.eduanalytics.domain.model.*;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns the grouped results of the store into the metric payloads.
 *
 * Grouping happens in the repositories; this class fills in the rates, the placeholder values
 * and the institution-wide means. Empty input yields empty lists or zero-valued aggregates.
 */
@Component
public class MetricsAggregator {

    /**
     * Course completion is not tracked yet; every course reports this constant.
     */
    public static final double PLACEHOLDER_COMPLETION_RATE = 100.0;

    /**
     * Graduation outcomes per department are not tracked yet; every department reports this constant.
     */
    public static final double PLACEHOLDER_GRADUATION_RATE = 85.0;

    // Institutional KPIs without a data source yet
    public static final double PLACEHOLDER_INSTITUTION_GRADUATION_RATE = 78.5;
    public static final double PLACEHOLDER_FACULTY_RATIO = 15.2;
    public static final double PLACEHOLDER_BUDGET_UTILIZATION = 87.3;

    private static final PerformanceAggregate NO_PERFORMANCE = new PerformanceAggregate(null, 0L, null, null, 0L, 0L);
    private static final EnrollmentAggregate NO_ENROLLMENTS = new EnrollmentAggregate(null, 0L, 0L, 0L, 0L);

    /**
     * One record per student group, in the order the store returned them.
     */
    public List<PerformanceMetrics> performanceMetrics(List<PerformanceAggregate> perStudent) {
        return perStudent.stream()
                .map(group -> PerformanceMetrics.builder()
                        .studentId(group.getGroupId())
                        .gpa(orZero(group.getAverageGradePoints()))
                        .creditsCompleted(orZero(group.getCreditsEarned()))
                        .coursesTaken(orZero(group.getRecords()))
                        .averageGrade(orZero(group.getAverageFinalScore()))
                        .passRate(passRate(group))
                        .build())
                .toList();
    }

    /**
     * Institution-wide entry: unweighted means of the per-student rates, sums of the counts.
     */
    public PerformanceMetrics overall(List<PerformanceMetrics> perStudent) {
        if (perStudent.isEmpty()) {
            return PerformanceMetrics.builder().studentId(0).build();
        }
        return PerformanceMetrics.builder()
                .studentId(0)
                .gpa(perStudent.stream().mapToDouble(PerformanceMetrics::getGpa).average().orElse(0))
                .creditsCompleted(perStudent.stream().mapToLong(PerformanceMetrics::getCreditsCompleted).sum())
                .coursesTaken(perStudent.stream().mapToLong(PerformanceMetrics::getCoursesTaken).sum())
                .averageGrade(perStudent.stream().mapToDouble(PerformanceMetrics::getAverageGrade).average().orElse(0))
                .passRate(perStudent.stream().mapToDouble(PerformanceMetrics::getPassRate).average().orElse(0))
                .build();
    }

    /**
     * @param newEnrollments already 0 when the filter carries no date bound
     */
    public EnrollmentStats enrollmentStats(List<StatusCount> byStatus, long newEnrollments) {
        Map<StudentStatus, Long> counts = new EnumMap<>(StudentStatus.class);
        byStatus.forEach(c -> counts.merge(c.getStatus(), orZero(c.getCount()), Long::sum));

        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        long active = counts.getOrDefault(StudentStatus.ACTIVE, 0L);

        return EnrollmentStats.builder()
                .totalStudents(total)
                .activeStudents(active)
                .graduatedStudents(counts.getOrDefault(StudentStatus.GRADUATED, 0L))
                .newEnrollments(newEnrollments)
                .retentionRate(percentage(active, total))
                .build();
    }

    /**
     * One entry per course, including courses without facts.
     */
    public List<CourseStats> courseStats(List<CourseSnapshot> courses,
                                         List<PerformanceAggregate> performance,
                                         List<EnrollmentAggregate> enrollments) {
        Map<Long, PerformanceAggregate> graded = byGroup(performance, PerformanceAggregate::getGroupId);
        Map<Long, EnrollmentAggregate> enrolled = byGroup(enrollments, EnrollmentAggregate::getGroupId);

        return courses.stream()
                .map(course -> {
                    PerformanceAggregate perf = graded.getOrDefault(course.getCourseId(), NO_PERFORMANCE);
                    return CourseStats.builder()
                            .courseId(course.getCourseId())
                            .courseName(course.getCourseName())
                            .totalEnrollments(orZero(enrolled.getOrDefault(course.getCourseId(), NO_ENROLLMENTS).getRecords()))
                            .averageGrade(orZero(perf.getAverageFinalScore()))
                            .passRate(passRate(perf))
                            .completionRate(PLACEHOLDER_COMPLETION_RATE)
                            .build();
                })
                .toList();
    }

    public List<DepartmentStats> departmentStats(List<DepartmentSnapshot> departments,
                                                 List<GroupCount> coursesPerDepartment,
                                                 List<GroupCount> studentsPerDepartment,
                                                 List<PerformanceAggregate> performance) {
        Map<Long, GroupCount> courses = byGroup(coursesPerDepartment, GroupCount::getGroupId);
        Map<Long, GroupCount> students = byGroup(studentsPerDepartment, GroupCount::getGroupId);
        Map<Long, PerformanceAggregate> graded = byGroup(performance, PerformanceAggregate::getGroupId);

        return departments.stream()
                .map(department -> {
                    Long departmentId = department.getDepartmentId();
                    return DepartmentStats.builder()
                            .departmentId(departmentId)
                            .departmentName(department.getDepartmentName())
                            .totalCourses(count(courses.get(departmentId)))
                            .totalStudents(count(students.get(departmentId)))
                            .averageGpa(orZero(graded.getOrDefault(departmentId, NO_PERFORMANCE).getAverageGradePoints()))
                            .graduationRate(PLACEHOLDER_GRADUATION_RATE)
                            .build();
                })
                .toList();
    }

    /**
     * Rows of a native trend query: period label, count, average.
     */
    public List<TrendPoint> trendPoints(List<Object[]> rows) {
        List<TrendPoint> points = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            points.add(TrendPoint.builder()
                    .period(String.valueOf(row[0]))
                    .count(row[1] != null ? ((Number) row[1]).longValue() : 0)
                    .average(row[2] != null ? ((Number) row[2]).doubleValue() : 0.0)
                    .build());
        }
        return points;
    }

    /**
     * @param performance the student's group, or null when the student has no performance facts
     * @param enrollments the student's group, or null when the student has no enrollments
     */
    public StudentStatistics studentStatistics(long studentId,
                                               PerformanceAggregate performance,
                                               EnrollmentAggregate enrollments) {
        PerformanceAggregate perf = performance != null ? performance : NO_PERFORMANCE;
        EnrollmentAggregate enr = enrollments != null ? enrollments : NO_ENROLLMENTS;
        return StudentStatistics.builder()
                .studentId(studentId)
                .totalCourses(orZero(perf.getRecords()))
                .averageGradePoints(orZero(perf.getAverageGradePoints()))
                .totalCredits(orZero(perf.getCreditsEarned()))
                .passedCourses(orZero(perf.getPassedRecords()))
                .totalEnrollments(orZero(enr.getRecords()))
                .droppedEnrollments(orZero(enr.getDroppedRecords()))
                .passRate(passRate(perf))
                .build();
    }

    public CourseStatistics courseStatistics(long courseId,
                                             PerformanceAggregate performance,
                                             EnrollmentAggregate enrollments) {
        PerformanceAggregate perf = performance != null ? performance : NO_PERFORMANCE;
        EnrollmentAggregate enr = enrollments != null ? enrollments : NO_ENROLLMENTS;
        return CourseStatistics.builder()
                .courseId(courseId)
                .totalEnrollments(orZero(enr.getRecords()))
                .activeEnrollments(orZero(enr.getActiveRecords()))
                .completedEnrollments(orZero(enr.getCompletedRecords()))
                .gradedRecords(orZero(perf.getRecords()))
                .averageGradePoints(orZero(perf.getAverageGradePoints()))
                .averageFinalScore(orZero(perf.getAverageFinalScore()))
                .passedStudents(orZero(perf.getPassedRecords()))
                .passRate(passRate(perf))
                .build();
    }

    public InstitutionalKpis institutionalKpis(EnrollmentStats enrollmentStats,
                                               Double averageGpa,
                                               double studentSatisfaction) {
        return InstitutionalKpis.builder()
                .retentionRate(enrollmentStats.getRetentionRate())
                .graduationRate(PLACEHOLDER_INSTITUTION_GRADUATION_RATE)
                .averageGpa(orZero(averageGpa))
                .studentSatisfaction(studentSatisfaction)
                .facultyRatio(PLACEHOLDER_FACULTY_RATIO)
                .budgetUtilization(PLACEHOLDER_BUDGET_UTILIZATION)
                .build();
    }

    static double passRate(PerformanceAggregate group) {
        return percentage(orZero(group.getPassedRecords()), orZero(group.getRecords()));
    }

    static double percentage(long part, long total) {
        return total > 0 ? part * 100.0 / total : 0.0;
    }

    private static long count(GroupCount group) {
        return group != null ? orZero(group.getCount()) : 0;
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private static <T> Map<Long, T> byGroup(List<T> groups, Function<T, Long> key) {
        return groups.stream()
                .filter(g -> key.apply(g) != null)
                .collect(Collectors.toMap(key, Function.identity(), (a, b) -> a));
    }
}
