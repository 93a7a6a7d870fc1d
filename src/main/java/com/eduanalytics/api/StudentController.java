package com.eduanalytics.api;

import com.eduanalytics.domain.model.*;
import com.eduanalytics.domain.service.StudentService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for the student dimension.
 *
 * Endpoints:
 * - GET /api/v1/students - Paged list with search / status / major filters
 * - GET /api/v1/students/{id} - Single student
 * - POST /api/v1/students - Create
 * - PUT /api/v1/students/{id} - Partial update
 * - DELETE /api/v1/students/{id} - Soft delete (status becomes dropped)
 * - GET /api/v1/students/{id}/performance - Performance facts
 * - GET /api/v1/students/{id}/courses - Enrollment facts
 * - GET /api/v1/students/{id}/statistics - Per-student statistics
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/students")
@RequiredArgsConstructor
public class StudentController {

    private final StudentService studentService;

    @GetMapping
    public ResponseEntity<PageResponse<StudentResponse>> list(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String major) {

        return ResponseEntity.ok(studentService.list(page, size, search, StudentStatus.fromToken(status), major));
    }

    @GetMapping("/{studentId}")
    public ResponseEntity<StudentResponse> get(@PathVariable Long studentId) {
        return ResponseEntity.ok(studentService.get(studentId));
    }

    @PostMapping
    public ResponseEntity<StudentResponse> create(@Valid @RequestBody StudentCreateRequest request) {
        log.info("Create student: {}", request.getStudentNumber());
        return ResponseEntity.status(HttpStatus.CREATED).body(studentService.create(request));
    }

    @PutMapping("/{studentId}")
    public ResponseEntity<StudentResponse> update(@PathVariable Long studentId,
                                                  @Valid @RequestBody StudentUpdateRequest request) {
        return ResponseEntity.ok(studentService.update(studentId, request));
    }

    @DeleteMapping("/{studentId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable Long studentId) {
        studentService.delete(studentId);
        return ResponseEntity.ok(Map.of("message", "Student " + studentId + " marked as dropped"));
    }

    @GetMapping("/{studentId}/performance")
    public ResponseEntity<List<PerformanceFactResponse>> performance(@PathVariable Long studentId) {
        return ResponseEntity.ok(studentService.performance(studentId));
    }

    @GetMapping("/{studentId}/courses")
    public ResponseEntity<List<EnrollmentFactResponse>> courses(@PathVariable Long studentId) {
        return ResponseEntity.ok(studentService.enrollments(studentId));
    }

    @GetMapping("/{studentId}/statistics")
    public ResponseEntity<StudentStatistics> statistics(@PathVariable Long studentId) {
        return ResponseEntity.ok(studentService.statistics(studentId));
    }
}
