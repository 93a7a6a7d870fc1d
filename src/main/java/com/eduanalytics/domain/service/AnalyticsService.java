package com.eduanalytics.domain.service;

import com.eduanalytics.domain.model.*;
import com.eduanalytics.infrastructure.cache.QueryCacheService;
import com.eduanalytics.infrastructure.document.repository.FeedbackRepository;
import com.eduanalytics.infrastructure.persistence.repository.*;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Aggregate reads over the warehouse.
 *
 * Query Flow:
 * 1. Group the filtered facts in the store (JPQL GROUP BY, native TO_CHAR buckets,
 *    MongoDB aggregation pipelines for feedback)
 * 2. Hand the groups to MetricsAggregator for rates and placeholders
 *
 * Single-payload aggregates (enrollment stats, dashboard, KPIs) go through the Redis cache
 * first, keyed by their filter values. List aggregates are always computed.
 *
 * Cached data may be stale up to its TTL; loads through the ETL pipeline evict the cache
 * when they finish.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    private final PerformanceFactRepository performanceFactRepository;
    private final EnrollmentFactRepository enrollmentFactRepository;
    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final DepartmentRepository departmentRepository;
    private final FeedbackRepository feedbackRepository;
    private final MetricsAggregator metricsAggregator;
    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Value("${app.cache.ttl.enrollment-stats:300}")
    private long enrollmentStatsTtl = 300;

    @Value("${app.cache.ttl.dashboard:3600}")
    private long dashboardTtl = 3600;

    @Value("${app.cache.ttl.kpis:3600}")
    private long kpisTtl = 3600;

    /**
     * Filters: student, course, date range (time dimension date).
     */
    @Transactional(readOnly = true)
    public List<PerformanceMetrics> performanceMetrics(AnalyticsFilter filter) {
        return timed("performance", () -> metricsAggregator.performanceMetrics(
                performanceFactRepository.aggregateByStudent(
                        filter.getStudentId(), filter.getCourseId(), filter.getStartDate(), filter.getEndDate())));
    }

    /**
     * Filters: department (major to course-name match), date range (new enrollments only).
     */
    @Transactional(readOnly = true)
    public EnrollmentStats enrollmentStats(AnalyticsFilter filter) {
        String key = cacheService.generateCacheKey("enrollment",
                filter.getDepartmentId(), filter.getStartDate(), filter.getEndDate());
        return cached("enrollment", key, EnrollmentStats.class, enrollmentStatsTtl,
                () -> computeEnrollmentStats(filter));
    }

    /**
     * Filters: department, level, date range.
     */
    @Transactional(readOnly = true)
    public List<CourseStats> courseStats(AnalyticsFilter filter) {
        return timed("courses", () -> computeCourseStats(filter));
    }

    /**
     * Filters: department, date range (performance rows).
     */
    @Transactional(readOnly = true)
    public List<DepartmentStats> departmentStats(AnalyticsFilter filter) {
        return timed("departments", () -> computeDepartmentStats(filter));
    }

    @Transactional(readOnly = true)
    public DashboardData dashboard(AnalyticsFilter filter) {
        String key = cacheService.generateCacheKey("dashboard",
                filter.getDepartmentId(), filter.getStartDate(), filter.getEndDate());
        return cached("dashboard", key, DashboardData.class, dashboardTtl, () -> {
            AnalyticsFilter dates = AnalyticsFilter.builder()
                    .startDate(filter.getStartDate())
                    .endDate(filter.getEndDate())
                    .build();
            List<PerformanceMetrics> perStudent = metricsAggregator.performanceMetrics(
                    performanceFactRepository.aggregateByStudent(null, null, dates.getStartDate(), dates.getEndDate()));

            return DashboardData.builder()
                    .performanceMetrics(metricsAggregator.overall(perStudent))
                    .enrollmentStats(computeEnrollmentStats(filter))
                    .courseStats(computeCourseStats(filter))
                    .departmentStats(computeDepartmentStats(dates))
                    .build();
        });
    }

    @Transactional(readOnly = true)
    public InstitutionalKpis institutionalKpis(AnalyticsFilter filter) {
        String key = cacheService.generateCacheKey("kpis", filter.getStartDate(), filter.getEndDate());
        return cached("kpis", key, InstitutionalKpis.class, kpisTtl, () -> {
            AnalyticsFilter dates = AnalyticsFilter.builder()
                    .startDate(filter.getStartDate())
                    .endDate(filter.getEndDate())
                    .build();
            double satisfaction = feedbackRepository.averageRating(FeedbackFilter.builder()
                    .startDate(filter.getStartDate())
                    .endDate(filter.getEndDate())
                    .build());
            return metricsAggregator.institutionalKpis(
                    computeEnrollmentStats(dates),
                    performanceFactRepository.averageGradePointsBetween(filter.getStartDate(), filter.getEndDate()),
                    satisfaction);
        });
    }

    @Transactional(readOnly = true)
    public TrendSeries performanceTrend(AnalyticsFilter filter, TrendPeriod period) {
        List<TrendPoint> points = timed("trend_performance",
                () -> metricsAggregator.trendPoints(performanceFactRepository.aggregateTrend(period.sqlPattern(),
                        filter.getStudentId(), filter.getCourseId(), filter.getStartDate(), filter.getEndDate())));
        return TrendSeries.builder().metric("performance").period(period).trends(points).build();
    }

    /**
     * Filters: course, department (courses of the department), date range (enrollment date).
     */
    @Transactional(readOnly = true)
    public TrendSeries enrollmentTrend(AnalyticsFilter filter, TrendPeriod period) {
        List<TrendPoint> points = timed("trend_enrollment",
                () -> metricsAggregator.trendPoints(enrollmentFactRepository.aggregateTrend(period.sqlPattern(),
                        filter.getStudentId(), filter.getCourseId(), filter.getDepartmentId(),
                        filter.getStartDate(), filter.getEndDate())));
        return TrendSeries.builder().metric("enrollment").period(period).trends(points).build();
    }

    private EnrollmentStats computeEnrollmentStats(AnalyticsFilter filter) {
        long newEnrollments = filter.hasDateBound()
                ? studentRepository.countEnrolledBetween(
                        filter.getDepartmentId(), filter.getStartDate(), filter.getEndDate())
                : 0;
        return metricsAggregator.enrollmentStats(
                studentRepository.countByStatus(filter.getDepartmentId()), newEnrollments);
    }

    private List<CourseStats> computeCourseStats(AnalyticsFilter filter) {
        return metricsAggregator.courseStats(
                courseRepository.findSnapshots(filter.getDepartmentId(), filter.getLevel(), filter.getCourseId()),
                performanceFactRepository.aggregateByCourse(filter.getStudentId(), filter.getCourseId(),
                        filter.getDepartmentId(), filter.getLevel(), filter.getStartDate(), filter.getEndDate()),
                enrollmentFactRepository.aggregateByCourse(filter.getStudentId(), filter.getCourseId(),
                        filter.getDepartmentId(), filter.getLevel(), filter.getStartDate(), filter.getEndDate()));
    }

    private List<DepartmentStats> computeDepartmentStats(AnalyticsFilter filter) {
        List<DepartmentSnapshot> departments = departmentRepository.findSnapshots();
        if (filter.getDepartmentId() != null) {
            departments = departments.stream()
                    .filter(d -> Objects.equals(d.getDepartmentId(), filter.getDepartmentId()))
                    .toList();
        }
        if (departments.isEmpty()) {
            return List.of();
        }
        return metricsAggregator.departmentStats(
                departments,
                courseRepository.countByDepartment(),
                studentRepository.countByDepartment(),
                performanceFactRepository.aggregateByDepartment(
                        filter.getDepartmentId(), filter.getStartDate(), filter.getEndDate()));
    }

    private <T> T cached(String type, String cacheKey, Class<T> valueType, long ttlSeconds, Supplier<T> compute) {
        Optional<T> cached = cacheService.get(cacheKey, valueType);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", cacheKey);
            Counter.builder("analytics.cache")
                    .tag("type", type)
                    .tag("result", "hit")
                    .register(meterRegistry)
                    .increment();
            return cached.get();
        }

        log.debug("Cache miss for {}", cacheKey);
        Counter.builder("analytics.cache")
                .tag("type", type)
                .tag("result", "miss")
                .register(meterRegistry)
                .increment();

        T value = timed(type, compute);
        cacheService.set(cacheKey, value, ttlSeconds);
        return value;
    }

    private <T> T timed(String type, Supplier<T> query) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        T result = query.get();

        sample.stop(Timer.builder("analytics.query.latency")
                .tag("type", type)
                .register(meterRegistry));
        log.info("Aggregate {} computed in {} ms", type, System.currentTimeMillis() - startTime);
        return result;
    }
}
