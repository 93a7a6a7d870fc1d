package com.eduanalytics.api;

import com.eduanalytics.domain.model.OptimizationReport;
import com.eduanalytics.domain.model.QueryAnalysisRequest;
import com.eduanalytics.domain.model.QueryPlanAnalysis;
import com.eduanalytics.infrastructure.store.DatabaseOptimizer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * PostgreSQL tuning endpoints.
 *
 * Endpoints:
 * - POST /api/v1/admin/optimization/indexes - Create the optimized index groups
 * - POST /api/v1/admin/optimization/materialized-views - Create the summary views
 * - POST /api/v1/admin/optimization/materialized-views/refresh - Refresh every view
 * - POST /api/v1/admin/optimization/explain - EXPLAIN ANALYZE a SELECT
 * - GET /api/v1/admin/optimization/index-usage - Index scan statistics
 * - GET /api/v1/admin/optimization/table-stats - Table tuple statistics
 * - GET /api/v1/admin/optimization/recommendations - Unused indexes and bloated tables
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/optimization")
@RequiredArgsConstructor
public class OptimizationController {

    private final DatabaseOptimizer databaseOptimizer;

    @PostMapping("/indexes")
    public ResponseEntity<Map<String, String>> createIndexes() {
        log.info("Creating optimized indexes");
        return ResponseEntity.ok(databaseOptimizer.createOptimizedIndexes());
    }

    @PostMapping("/materialized-views")
    public ResponseEntity<Map<String, String>> createMaterializedViews() {
        log.info("Creating materialized views");
        return ResponseEntity.ok(databaseOptimizer.createMaterializedViews());
    }

    @PostMapping("/materialized-views/refresh")
    public ResponseEntity<Map<String, String>> refreshMaterializedViews() {
        return ResponseEntity.ok(databaseOptimizer.refreshMaterializedViews());
    }

    @PostMapping("/explain")
    public ResponseEntity<QueryPlanAnalysis> explain(@Valid @RequestBody QueryAnalysisRequest request) {
        return ResponseEntity.ok(databaseOptimizer.analyzeQuery(request.getQuery()));
    }

    @GetMapping("/index-usage")
    public ResponseEntity<List<Map<String, Object>>> indexUsage() {
        return ResponseEntity.ok(databaseOptimizer.indexUsageStats());
    }

    @GetMapping("/table-stats")
    public ResponseEntity<List<Map<String, Object>>> tableStats() {
        return ResponseEntity.ok(databaseOptimizer.tableStats());
    }

    @GetMapping("/recommendations")
    public ResponseEntity<OptimizationReport> recommendations() {
        return ResponseEntity.ok(databaseOptimizer.recommendations());
    }
}
