package com.eduanalytics.infrastructure.store;

import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.OptimizationReport;
import com.eduanalytics.domain.model.QueryPlanAnalysis;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.regex.Pattern;

/**
 * PostgreSQL tuning for the warehouse schema: indexes, materialized views, query plans
 * and catalog statistics.
 *
 * Every DDL statement is idempotent (IF NOT EXISTS).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseOptimizer {

    static final long BLOAT_DEAD_TUPLE_THRESHOLD = 1000;

    static final List<String> MATERIALIZED_VIEWS = List.of(
            "mv_student_performance_summary",
            "mv_course_performance_summary",
            "mv_department_statistics",
            "mv_monthly_enrollment_trends");

    // Statements that write, or that EXPLAIN ANALYZE would otherwise execute with side effects
    private static final Pattern FORBIDDEN_KEYWORDS = Pattern.compile(
            "\\b(insert|update|delete|merge|into|drop|alter|create|truncate|grant|revoke|copy)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, List<String>> INDEX_GROUPS = indexGroups();

    private static final Map<String, List<String>> VIEW_DEFINITIONS = viewDefinitions();

    private final DataStoreContext dataStoreContext;
    private final ObjectMapper objectMapper;

    /**
     * Creates the index groups in order.
     *
     * @return group -> "created"; on failure the map ends with an "error" entry and the
     *         remaining groups are skipped
     */
    public Map<String, String> createOptimizedIndexes() {
        Map<String, String> results = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> group : INDEX_GROUPS.entrySet()) {
            try {
                group.getValue().forEach(sql -> dataStoreContext.relational().execute(sql));
                results.put(group.getKey(), "created");
                log.info("Index group {} created ({} statements)", group.getKey(), group.getValue().size());
            } catch (DataAccessException e) {
                log.error("Failed to create index group {}: {}", group.getKey(), e.getMessage());
                results.put("error", "Failed to create " + group.getKey() + ": " + e.getMostSpecificCause().getMessage());
                break;
            }
        }
        return results;
    }

    public Map<String, String> createMaterializedViews() {
        Map<String, String> results = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> view : VIEW_DEFINITIONS.entrySet()) {
            try {
                view.getValue().forEach(sql -> dataStoreContext.relational().execute(sql));
                results.put(view.getKey(), "created");
                log.info("Materialized view {} created", view.getKey());
            } catch (DataAccessException e) {
                log.error("Failed to create materialized view {}: {}", view.getKey(), e.getMessage());
                results.put("error", "Failed to create " + view.getKey() + ": " + e.getMostSpecificCause().getMessage());
                break;
            }
        }
        return results;
    }

    /**
     * Refreshes each view independently; one failing view does not stop the others.
     */
    public Map<String, String> refreshMaterializedViews() {
        Map<String, String> results = new LinkedHashMap<>();
        for (String view : MATERIALIZED_VIEWS) {
            try {
                dataStoreContext.relational().execute("REFRESH MATERIALIZED VIEW " + view);
                results.put(view, "refreshed");
            } catch (DataAccessException e) {
                log.warn("Failed to refresh materialized view {}: {}", view, e.getMessage());
                results.put(view, "failed: " + e.getMostSpecificCause().getMessage());
            }
        }
        return results;
    }

    /**
     * Runs EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON) for a single read-only SELECT.
     */
    @Transactional(readOnly = true)
    public QueryPlanAnalysis analyzeQuery(String query) {
        String select = requireSingleSelect(query);
        String json = dataStoreContext.relational()
                .queryForObject("EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON) " + select, String.class);

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable query plan: " + e.getOriginalMessage(), e);
        }

        JsonNode entry = root.isArray() ? root.path(0) : root;
        JsonNode plan = entry.path("Plan");
        return QueryPlanAnalysis.builder()
                .query(select)
                .executionTime(entry.path("Execution Time").asDouble())
                .planningTime(entry.path("Planning Time").asDouble())
                .totalCost(plan.path("Total Cost").asDouble())
                .plan(plan)
                .build();
    }

    public List<Map<String, Object>> indexUsageStats() {
        return dataStoreContext.relational().queryForList("""
                SELECT schemaname, relname AS tablename, indexrelname AS indexname,
                       idx_tup_read, idx_tup_fetch, idx_scan,
                       idx_tup_read / NULLIF(idx_scan, 0) AS avg_tuples_per_scan
                FROM pg_stat_user_indexes
                WHERE schemaname = 'public'
                ORDER BY idx_scan DESC
                """);
    }

    public List<Map<String, Object>> tableStats() {
        return dataStoreContext.relational().queryForList("""
                SELECT schemaname, relname AS tablename,
                       n_tup_ins AS inserts, n_tup_upd AS updates, n_tup_del AS deletes,
                       n_live_tup AS live_tuples, n_dead_tup AS dead_tuples,
                       last_vacuum, last_autovacuum, last_analyze, last_autoanalyze
                FROM pg_stat_user_tables
                WHERE schemaname = 'public'
                ORDER BY n_live_tup DESC
                """);
    }

    public List<Map<String, Object>> unusedIndexes() {
        return dataStoreContext.relational().queryForList("""
                SELECT schemaname, relname AS tablename, indexrelname AS indexname, idx_scan,
                       pg_size_pretty(pg_relation_size(indexrelid)) AS index_size
                FROM pg_stat_user_indexes
                WHERE schemaname = 'public' AND idx_scan = 0
                ORDER BY pg_relation_size(indexrelid) DESC
                """);
    }

    public List<Map<String, Object>> bloatedTables() {
        return dataStoreContext.relational().queryForList("""
                SELECT schemaname, relname AS tablename, n_dead_tup, n_live_tup,
                       ROUND((n_dead_tup::numeric / NULLIF(n_live_tup + n_dead_tup, 0)) * 100, 2) AS bloat_percentage
                FROM pg_stat_user_tables
                WHERE schemaname = 'public' AND n_dead_tup > ?
                ORDER BY bloat_percentage DESC NULLS LAST
                """, BLOAT_DEAD_TUPLE_THRESHOLD);
    }

    public OptimizationReport recommendations() {
        List<OptimizationReport.Recommendation> recommendations = new ArrayList<>();

        List<Map<String, Object>> unused = unusedIndexes();
        if (!unused.isEmpty()) {
            recommendations.add(OptimizationReport.Recommendation.builder()
                    .type("unused_indexes")
                    .message("Consider removing unused indexes to save space")
                    .details(unused)
                    .build());
        }

        List<Map<String, Object>> bloated = bloatedTables();
        if (!bloated.isEmpty()) {
            recommendations.add(OptimizationReport.Recommendation.builder()
                    .type("table_bloat")
                    .message("Consider running VACUUM on bloated tables")
                    .details(bloated)
                    .build());
        }

        return OptimizationReport.builder()
                .recommendations(recommendations)
                .totalRecommendations(recommendations.size())
                .build();
    }

    static String requireSingleSelect(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query is required");
        }
        String trimmed = query.trim();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        if (trimmed.contains(";")) {
            throw new ValidationException("Only a single statement can be analyzed");
        }
        if (!trimmed.regionMatches(true, 0, "select", 0, 6)
                || (trimmed.length() > 6 && Character.isLetterOrDigit(trimmed.charAt(6)))) {
            throw new ValidationException("Only SELECT statements can be analyzed");
        }
        if (FORBIDDEN_KEYWORDS.matcher(trimmed).find()) {
            throw new ValidationException("Only read-only SELECT statements can be analyzed");
        }
        return trimmed;
    }

    private static Map<String, List<String>> indexGroups() {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        groups.put("student_indexes", List.of(
                "CREATE INDEX IF NOT EXISTS idx_student_email ON dim_student(email)",
                "CREATE INDEX IF NOT EXISTS idx_student_status ON dim_student(status)",
                "CREATE INDEX IF NOT EXISTS idx_student_major ON dim_student(major)",
                "CREATE INDEX IF NOT EXISTS idx_student_enrollment_date ON dim_student(enrollment_date)",
                "CREATE INDEX IF NOT EXISTS idx_student_gpa ON dim_student(gpa)",
                "CREATE INDEX IF NOT EXISTS idx_student_status_major ON dim_student(status, major)",
                "CREATE INDEX IF NOT EXISTS idx_student_enrollment_status ON dim_student(enrollment_date, status)"));
        groups.put("course_indexes", List.of(
                "CREATE INDEX IF NOT EXISTS idx_course_level ON dim_course(level)",
                "CREATE INDEX IF NOT EXISTS idx_course_department ON dim_course(department_id)",
                "CREATE INDEX IF NOT EXISTS idx_course_active ON dim_course(is_active)",
                "CREATE INDEX IF NOT EXISTS idx_course_dept_level ON dim_course(department_id, level)",
                "CREATE INDEX IF NOT EXISTS idx_course_active_dept ON dim_course(is_active, department_id)"));
        groups.put("performance_indexes", List.of(
                "CREATE INDEX IF NOT EXISTS idx_perf_student ON student_performance_fact(student_id)",
                "CREATE INDEX IF NOT EXISTS idx_perf_course ON student_performance_fact(course_id)",
                "CREATE INDEX IF NOT EXISTS idx_perf_instructor ON student_performance_fact(instructor_id)",
                "CREATE INDEX IF NOT EXISTS idx_perf_time ON student_performance_fact(time_id)",
                "CREATE INDEX IF NOT EXISTS idx_perf_grade_points ON student_performance_fact(grade_points)",
                "CREATE INDEX IF NOT EXISTS idx_perf_is_pass ON student_performance_fact(is_pass)",
                "CREATE INDEX IF NOT EXISTS idx_perf_student_time ON student_performance_fact(student_id, time_id)",
                "CREATE INDEX IF NOT EXISTS idx_perf_course_time ON student_performance_fact(course_id, time_id)",
                "CREATE INDEX IF NOT EXISTS idx_perf_student_course ON student_performance_fact(student_id, course_id)",
                "CREATE INDEX IF NOT EXISTS idx_perf_course_pass ON student_performance_fact(course_id, is_pass)"));
        groups.put("enrollment_indexes", List.of(
                "CREATE INDEX IF NOT EXISTS idx_enroll_student ON enrollment_fact(student_id)",
                "CREATE INDEX IF NOT EXISTS idx_enroll_course ON enrollment_fact(course_id)",
                "CREATE INDEX IF NOT EXISTS idx_enroll_time ON enrollment_fact(time_id)",
                "CREATE INDEX IF NOT EXISTS idx_enroll_date ON enrollment_fact(enrollment_date)",
                "CREATE INDEX IF NOT EXISTS idx_enroll_student_course ON enrollment_fact(student_id, course_id)",
                "CREATE INDEX IF NOT EXISTS idx_enroll_course_dropped ON enrollment_fact(course_id, is_dropped)"));
        groups.put("time_indexes", List.of(
                "CREATE INDEX IF NOT EXISTS idx_time_year_month ON dim_time(year, month)",
                "CREATE INDEX IF NOT EXISTS idx_time_year_quarter ON dim_time(year, quarter)",
                "CREATE INDEX IF NOT EXISTS idx_time_semester_year ON dim_time(semester, academic_year)"));
        groups.put("composite_indexes", List.of(
                "CREATE INDEX IF NOT EXISTS idx_perf_analysis ON student_performance_fact(student_id, course_id, time_id, is_pass)",
                "CREATE INDEX IF NOT EXISTS idx_perf_grades ON student_performance_fact(course_id, grade_points, letter_grade)",
                "CREATE INDEX IF NOT EXISTS idx_enroll_analysis ON enrollment_fact(student_id, course_id, time_id, is_dropped, is_completed)",
                "CREATE INDEX IF NOT EXISTS idx_time_analysis ON dim_time(year, quarter, month, semester)",
                "CREATE INDEX IF NOT EXISTS idx_student_analysis ON dim_student(status, major, enrollment_date, gpa)"));
        groups.put("partial_indexes", List.of(
                "CREATE INDEX IF NOT EXISTS idx_student_active ON dim_student(student_id) WHERE status = 'ACTIVE'",
                "CREATE INDEX IF NOT EXISTS idx_course_active_only ON dim_course(course_id) WHERE is_active = true",
                "CREATE INDEX IF NOT EXISTS idx_perf_passed ON student_performance_fact(student_id, course_id) WHERE is_pass = true"));
        return Collections.unmodifiableMap(groups);
    }

    // Pass rates use NULLIF so a course or department without graded rows yields NULL, not a division error
    private static Map<String, List<String>> viewDefinitions() {
        Map<String, List<String>> views = new LinkedHashMap<>();
        views.put("mv_student_performance_summary", List.of("""
                CREATE MATERIALIZED VIEW IF NOT EXISTS mv_student_performance_summary AS
                SELECT s.student_id, s.student_number, s.first_name, s.last_name, s.major,
                       COUNT(pf.fact_id) AS total_courses,
                       AVG(pf.grade_points) AS avg_gpa,
                       SUM(pf.credits_earned) AS total_credits,
                       COUNT(CASE WHEN pf.is_pass THEN 1 END) AS passed_courses,
                       ROUND(COUNT(CASE WHEN pf.is_pass THEN 1 END)::numeric / NULLIF(COUNT(pf.fact_id), 0) * 100, 2) AS pass_rate
                FROM dim_student s
                LEFT JOIN student_performance_fact pf ON s.student_id = pf.student_id
                GROUP BY s.student_id, s.student_number, s.first_name, s.last_name, s.major
                """,
                "CREATE INDEX IF NOT EXISTS idx_mv_student_perf_student_id ON mv_student_performance_summary(student_id)",
                "CREATE INDEX IF NOT EXISTS idx_mv_student_perf_major ON mv_student_performance_summary(major)"));
        views.put("mv_course_performance_summary", List.of("""
                CREATE MATERIALIZED VIEW IF NOT EXISTS mv_course_performance_summary AS
                SELECT c.course_id, c.course_code, c.course_name, c.credits, c.level,
                       COUNT(pf.fact_id) AS total_students,
                       AVG(pf.grade_points) AS avg_grade_points,
                       AVG(pf.final_score) AS avg_final_score,
                       COUNT(CASE WHEN pf.is_pass THEN 1 END) AS passed_students,
                       ROUND(COUNT(CASE WHEN pf.is_pass THEN 1 END)::numeric / NULLIF(COUNT(pf.fact_id), 0) * 100, 2) AS pass_rate
                FROM dim_course c
                LEFT JOIN student_performance_fact pf ON c.course_id = pf.course_id
                GROUP BY c.course_id, c.course_code, c.course_name, c.credits, c.level
                """,
                "CREATE INDEX IF NOT EXISTS idx_mv_course_perf_course_id ON mv_course_performance_summary(course_id)",
                "CREATE INDEX IF NOT EXISTS idx_mv_course_perf_level ON mv_course_performance_summary(level)"));
        views.put("mv_department_statistics", List.of("""
                CREATE MATERIALIZED VIEW IF NOT EXISTS mv_department_statistics AS
                SELECT d.department_id, d.department_name,
                       COUNT(DISTINCT c.course_id) AS total_courses,
                       COUNT(DISTINCT s.student_id) AS total_students,
                       AVG(pf.grade_points) AS avg_gpa,
                       COUNT(CASE WHEN pf.is_pass THEN 1 END) AS passed_courses,
                       ROUND(COUNT(CASE WHEN pf.is_pass THEN 1 END)::numeric / NULLIF(COUNT(pf.fact_id), 0) * 100, 2) AS pass_rate
                FROM dim_department d
                LEFT JOIN dim_course c ON d.department_id = c.department_id
                LEFT JOIN dim_student s ON s.major = c.course_name
                LEFT JOIN student_performance_fact pf ON s.student_id = pf.student_id
                GROUP BY d.department_id, d.department_name
                """,
                "CREATE INDEX IF NOT EXISTS idx_mv_dept_stats_dept_id ON mv_department_statistics(department_id)"));
        views.put("mv_monthly_enrollment_trends", List.of("""
                CREATE MATERIALIZED VIEW IF NOT EXISTS mv_monthly_enrollment_trends AS
                SELECT t.year, t.month, t.month_name, t.semester,
                       COUNT(DISTINCT ef.student_id) AS total_enrollments,
                       COUNT(DISTINCT ef.course_id) AS unique_courses,
                       COUNT(CASE WHEN ef.is_dropped = false THEN 1 END) AS active_enrollments,
                       COUNT(CASE WHEN ef.is_dropped = true THEN 1 END) AS dropped_enrollments
                FROM dim_time t
                LEFT JOIN enrollment_fact ef ON t.time_id = ef.time_id
                GROUP BY t.year, t.month, t.month_name, t.semester
                """,
                "CREATE INDEX IF NOT EXISTS idx_mv_enroll_trends_year_month ON mv_monthly_enrollment_trends(year, month)"));
        return Collections.unmodifiableMap(views);
    }
}
