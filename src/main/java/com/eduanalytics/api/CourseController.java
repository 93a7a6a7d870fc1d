package com.eduanalytics.api;

import com.eduanalytics.domain.model.*;
import com.eduanalytics.domain.service.CourseService;
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
 * REST API for the course dimension. DELETE deactivates the course.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/courses")
@RequiredArgsConstructor
public class CourseController {

    private final CourseService courseService;

    @GetMapping
    public ResponseEntity<PageResponse<CourseResponse>> list(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String level,
            @RequestParam(name = "department_id", required = false) Long departmentId,
            @RequestParam(name = "is_active", required = false) Boolean isActive) {

        return ResponseEntity.ok(courseService.list(page, size, search, CourseLevel.fromToken(level),
                departmentId, isActive));
    }

    @GetMapping("/{courseId}")
    public ResponseEntity<CourseResponse> get(@PathVariable Long courseId) {
        return ResponseEntity.ok(courseService.get(courseId));
    }

    @PostMapping
    public ResponseEntity<CourseResponse> create(@Valid @RequestBody CourseCreateRequest request) {
        log.info("Create course: {}", request.getCourseCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(courseService.create(request));
    }

    @PutMapping("/{courseId}")
    public ResponseEntity<CourseResponse> update(@PathVariable Long courseId,
                                                 @Valid @RequestBody CourseUpdateRequest request) {
        return ResponseEntity.ok(courseService.update(courseId, request));
    }

    @DeleteMapping("/{courseId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable Long courseId) {
        courseService.delete(courseId);
        return ResponseEntity.ok(Map.of("message", "Course " + courseId + " deactivated"));
    }

    @GetMapping("/{courseId}/enrollments")
    public ResponseEntity<List<EnrollmentFactResponse>> enrollments(@PathVariable Long courseId) {
        return ResponseEntity.ok(courseService.enrollments(courseId));
    }

    @GetMapping("/{courseId}/performance")
    public ResponseEntity<List<PerformanceFactResponse>> performance(@PathVariable Long courseId) {
        return ResponseEntity.ok(courseService.performance(courseId));
    }

    @GetMapping("/{courseId}/prerequisites")
    public ResponseEntity<List<CourseResponse>> prerequisites(@PathVariable Long courseId) {
        return ResponseEntity.ok(courseService.prerequisites(courseId));
    }

    @GetMapping("/{courseId}/statistics")
    public ResponseEntity<CourseStatistics> statistics(@PathVariable Long courseId) {
        return ResponseEntity.ok(courseService.statistics(courseId));
    }
}
