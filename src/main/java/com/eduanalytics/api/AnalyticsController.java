package com.eduanalytics.api;

import com.eduanalytics.domain.model.*;
import com.eduanalytics.domain.service.AnalyticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST API for warehouse aggregates.
 *
 * Endpoints:
 * - GET /api/v1/analytics/performance - Per-student performance metrics
 * - GET /api/v1/analytics/enrollment - Enrollment statistics (cached)
 * - GET /api/v1/analytics/courses - Per-course statistics
 * - GET /api/v1/analytics/departments - Per-department statistics
 * - GET /api/v1/analytics/dashboard - Combined dashboard payload (cached)
 * - GET /api/v1/analytics/kpis - Institutional KPIs (cached)
 * - GET /api/v1/analytics/trends/performance - Grade point trend
 * - GET /api/v1/analytics/trends/enrollment - Enrollment completion trend
 *
 * Dates are ISO (yyyy-MM-dd) and inclusive on both ends.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @GetMapping("/performance")
    public ResponseEntity<List<PerformanceMetrics>> performance(
            @RequestParam(name = "student_id", required = false) Long studentId,
            @RequestParam(name = "course_id", required = false) Long courseId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        AnalyticsFilter filter = AnalyticsFilter.builder()
                .studentId(studentId)
                .courseId(courseId)
                .startDate(startDate)
                .endDate(endDate)
                .build();
        return ResponseEntity.ok(analyticsService.performanceMetrics(filter));
    }

    @GetMapping("/enrollment")
    public ResponseEntity<EnrollmentStats> enrollment(
            @RequestParam(name = "department_id", required = false) Long departmentId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        return ResponseEntity.ok(analyticsService.enrollmentStats(dateFilter(departmentId, startDate, endDate)));
    }

    @GetMapping("/courses")
    public ResponseEntity<List<CourseStats>> courses(
            @RequestParam(name = "department_id", required = false) Long departmentId,
            @RequestParam(required = false) String level,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        AnalyticsFilter filter = AnalyticsFilter.builder()
                .departmentId(departmentId)
                .level(CourseLevel.fromToken(level))
                .startDate(startDate)
                .endDate(endDate)
                .build();
        return ResponseEntity.ok(analyticsService.courseStats(filter));
    }

    @GetMapping("/departments")
    public ResponseEntity<List<DepartmentStats>> departments(
            @RequestParam(name = "department_id", required = false) Long departmentId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        return ResponseEntity.ok(analyticsService.departmentStats(dateFilter(departmentId, startDate, endDate)));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardData> dashboard(
            @RequestParam(name = "department_id", required = false) Long departmentId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Dashboard: departmentId={}, startDate={}, endDate={}", departmentId, startDate, endDate);
        return ResponseEntity.ok(analyticsService.dashboard(dateFilter(departmentId, startDate, endDate)));
    }

    @GetMapping("/kpis")
    public ResponseEntity<InstitutionalKpis> kpis(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        return ResponseEntity.ok(analyticsService.institutionalKpis(dateFilter(null, startDate, endDate)));
    }

    /**
     * Unknown periods fall back to monthly.
     */
    @GetMapping("/trends/performance")
    public ResponseEntity<TrendSeries> performanceTrend(
            @RequestParam(required = false) String period,
            @RequestParam(name = "student_id", required = false) Long studentId,
            @RequestParam(name = "course_id", required = false) Long courseId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        AnalyticsFilter filter = AnalyticsFilter.builder()
                .studentId(studentId)
                .courseId(courseId)
                .startDate(startDate)
                .endDate(endDate)
                .build();
        return ResponseEntity.ok(analyticsService.performanceTrend(filter, TrendPeriod.fromToken(period)));
    }

    @GetMapping("/trends/enrollment")
    public ResponseEntity<TrendSeries> enrollmentTrend(
            @RequestParam(required = false) String period,
            @RequestParam(name = "course_id", required = false) Long courseId,
            @RequestParam(name = "department_id", required = false) Long departmentId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        AnalyticsFilter filter = AnalyticsFilter.builder()
                .courseId(courseId)
                .departmentId(departmentId)
                .startDate(startDate)
                .endDate(endDate)
                .build();
        return ResponseEntity.ok(analyticsService.enrollmentTrend(filter, TrendPeriod.fromToken(period)));
    }

    private static AnalyticsFilter dateFilter(Long departmentId, LocalDate startDate, LocalDate endDate) {
        return AnalyticsFilter.builder()
                .departmentId(departmentId)
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }
}
