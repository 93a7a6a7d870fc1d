package com.eduanalytics.api;

import com.eduanalytics.domain.model.*;
import com.eduanalytics.domain.service.FactService;
import com.eduanalytics.domain.service.TimeDimensionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Fact ingestion and time dimension maintenance.
 *
 * Endpoints:
 * - POST /api/v1/warehouse/facts/performance - Record a graded outcome
 * - POST /api/v1/warehouse/facts/enrollment - Record an enrollment
 * - POST /api/v1/warehouse/facts/attendance - Record a class attendance
 * - POST /api/v1/warehouse/time - Generate time dimension rows for a date range
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/warehouse")
@RequiredArgsConstructor
public class WarehouseController {

    private final FactService factService;
    private final TimeDimensionService timeDimensionService;

    @PostMapping("/facts/performance")
    public ResponseEntity<PerformanceFactResponse> recordPerformance(@Valid @RequestBody PerformanceFactRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(factService.recordPerformance(request));
    }

    @PostMapping("/facts/enrollment")
    public ResponseEntity<EnrollmentFactResponse> recordEnrollment(@Valid @RequestBody EnrollmentFactRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(factService.recordEnrollment(request));
    }

    @PostMapping("/facts/attendance")
    public ResponseEntity<AttendanceFactResponse> recordAttendance(@Valid @RequestBody AttendanceFactRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(factService.recordAttendance(request));
    }

    @PostMapping("/time")
    public ResponseEntity<TimeRangeResult> generateTimeRange(@RequestBody(required = false) TimeRangeRequest request) {
        TimeRangeRequest range = request != null ? request : new TimeRangeRequest();
        log.info("Generate time dimension: {} to {}", range.getStartDate(), range.getEndDate());
        return ResponseEntity.ok(timeDimensionService.generateRangeOrDefault(range.getStartDate(), range.getEndDate()));
    }
}
