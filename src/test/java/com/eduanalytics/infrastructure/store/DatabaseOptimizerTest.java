package com.eduanalytics.infrastructure.store;

import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.OptimizationReport;
import com.eduanalytics.domain.model.QueryPlanAnalysis;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DatabaseOptimizer.
 *
 * JdbcTemplate is mocked; the SQL itself is exercised against PostgreSQL only.
 */
@ExtendWith(MockitoExtension.class)
class DatabaseOptimizerTest {

    @Mock
    private DataStoreContext dataStoreContext;

    @Mock
    private JdbcTemplate jdbcTemplate;

    private DatabaseOptimizer optimizer;

    @BeforeEach
    void setUp() {
        optimizer = new DatabaseOptimizer(dataStoreContext, new ObjectMapper());
    }

    @Test
    void testCreateOptimizedIndexes_AllGroupsInOrder() {
        // Given
        when(dataStoreContext.relational()).thenReturn(jdbcTemplate);

        // When
        Map<String, String> results = optimizer.createOptimizedIndexes();

        // Then
        assertEquals(List.of("student_indexes", "course_indexes", "performance_indexes", "enrollment_indexes",
                "time_indexes", "composite_indexes", "partial_indexes"), List.copyOf(results.keySet()));
        assertTrue(results.values().stream().allMatch("created"::equals));
    }

    @Test
    void testCreateOptimizedIndexes_FailureStopsRemainingGroups() {
        // Given
        when(dataStoreContext.relational()).thenReturn(jdbcTemplate);
        failOn("CREATE INDEX IF NOT EXISTS idx_course_level", "relation \"dim_course\" does not exist");

        // When
        Map<String, String> results = optimizer.createOptimizedIndexes();

        // Then
        assertEquals("created", results.get("student_indexes"));
        assertFalse(results.containsKey("course_indexes"));
        assertEquals("Failed to create course_indexes: relation \"dim_course\" does not exist", results.get("error"));
        verify(jdbcTemplate, never()).execute(contains("student_performance_fact"));
    }

    @Test
    void testRefreshMaterializedViews_OneFailureDoesNotStopOthers() {
        // Given
        when(dataStoreContext.relational()).thenReturn(jdbcTemplate);
        failOn("REFRESH MATERIALIZED VIEW mv_course_performance_summary",
                "relation \"mv_course_performance_summary\" does not exist");

        // When
        Map<String, String> results = optimizer.refreshMaterializedViews();

        // Then
        assertEquals(4, results.size());
        assertEquals("refreshed", results.get("mv_student_performance_summary"));
        assertTrue(results.get("mv_course_performance_summary").startsWith("failed: "));
        assertEquals("refreshed", results.get("mv_monthly_enrollment_trends"));
    }

    @Test
    void testAnalyzeQuery_ReadsPlanSummary() {
        // Given
        String plan = """
                [{"Plan": {"Node Type": "Seq Scan", "Total Cost": 12.5},
                  "Planning Time": 0.08, "Execution Time": 0.42}]
                """;
        when(dataStoreContext.relational()).thenReturn(jdbcTemplate);
        when(jdbcTemplate.queryForObject(
                "EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON) SELECT * FROM dim_student", String.class))
                .thenReturn(plan);

        // When
        QueryPlanAnalysis analysis = optimizer.analyzeQuery("  SELECT * FROM dim_student;  ");

        // Then
        assertEquals("SELECT * FROM dim_student", analysis.getQuery());
        assertEquals(0.42, analysis.getExecutionTime());
        assertEquals(0.08, analysis.getPlanningTime());
        assertEquals(12.5, analysis.getTotalCost());
        assertEquals("Seq Scan", analysis.getPlan().path("Node Type").asText());
    }

    @Test
    void testAnalyzeQuery_RejectsWritesBeforeTouchingDatabase() {
        assertThrows(ValidationException.class, () -> optimizer.analyzeQuery("DELETE FROM dim_student"));
        assertThrows(ValidationException.class,
                () -> optimizer.analyzeQuery("SELECT 1; DROP TABLE dim_student"));
        verifyNoInteractions(dataStoreContext);
    }

    @Test
    void testRequireSingleSelect() {
        assertEquals("select created_at, last_update from dim_student",
                DatabaseOptimizer.requireSingleSelect("select created_at, last_update from dim_student;"));

        assertThrows(ValidationException.class, () -> DatabaseOptimizer.requireSingleSelect(" "));
        assertThrows(ValidationException.class, () -> DatabaseOptimizer.requireSingleSelect("selective_view"));
        assertThrows(ValidationException.class,
                () -> DatabaseOptimizer.requireSingleSelect("SELECT * INTO backup FROM dim_student"));
        assertThrows(ValidationException.class,
                () -> DatabaseOptimizer.requireSingleSelect("WITH d AS (DELETE FROM dim_student RETURNING *) SELECT * FROM d"));
    }

    @Test
    void testRecommendations_OnlyNonEmptyFindings() {
        // Given
        when(dataStoreContext.relational()).thenReturn(jdbcTemplate);
        when(jdbcTemplate.queryForList(contains("idx_scan = 0")))
                .thenReturn(List.of(Map.of("indexname", "idx_student_gpa", "idx_scan", 0L)));
        when(jdbcTemplate.queryForList(contains("n_dead_tup > ?"), eq(1000L))).thenReturn(List.of());

        // When
        OptimizationReport report = optimizer.recommendations();

        // Then
        assertEquals(1, report.getTotalRecommendations());
        assertEquals("unused_indexes", report.getRecommendations().get(0).getType());
    }

    private void failOn(String statementPrefix, String message) {
        doAnswer(inv -> {
            String sql = inv.getArgument(0);
            if (sql.startsWith(statementPrefix)) {
                throw new BadSqlGrammarException("execute", sql, new SQLException(message));
            }
            return null;
        }).when(jdbcTemplate).execute(anyString());
    }
}
