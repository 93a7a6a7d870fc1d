package com.eduanalytics.api;

import com.eduanalytics.domain.model.*;
import com.eduanalytics.domain.service.FeedbackService;
import com.eduanalytics.infrastructure.document.model.FeedbackDocument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * REST API for student feedback documents and their analytics.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/feedback")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackService feedbackService;

    @GetMapping
    public ResponseEntity<PageResponse<FeedbackDocument>> list(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size,
            @RequestParam(name = "student_id", required = false) Long studentId,
            @RequestParam(name = "course_id", required = false) Long courseId,
            @RequestParam(name = "feedback_type", required = false) String feedbackType,
            @RequestParam(name = "min_rating", required = false) @Min(1) @Max(5) Integer minRating,
            @RequestParam(name = "max_rating", required = false) @Min(1) @Max(5) Integer maxRating,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        FeedbackFilter filter = FeedbackFilter.builder()
                .studentId(studentId)
                .courseId(courseId)
                .feedbackType(feedbackType)
                .minRating(minRating)
                .maxRating(maxRating)
                .startDate(startDate)
                .endDate(endDate)
                .build();
        return ResponseEntity.ok(feedbackService.list(page, size, filter));
    }

    @GetMapping("/{feedbackId}")
    public ResponseEntity<FeedbackDocument> get(@PathVariable String feedbackId) {
        return ResponseEntity.ok(feedbackService.get(feedbackId));
    }

    @PostMapping
    public ResponseEntity<FeedbackDocument> create(@Valid @RequestBody FeedbackRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(feedbackService.create(request));
    }

    @PostMapping("/bulk-import")
    public ResponseEntity<Map<String, Integer>> bulkImport(@RequestBody List<@Valid FeedbackRequest> requests) {
        log.info("Feedback bulk import: {} documents", requests.size());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("imported", feedbackService.bulkImport(requests)));
    }

    @GetMapping("/analytics/sentiment")
    public ResponseEntity<List<SentimentBucket>> sentiment(
            @RequestParam(name = "course_id", required = false) Long courseId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        return ResponseEntity.ok(feedbackService.sentiment(filter(courseId, startDate, endDate)));
    }

    @GetMapping("/analytics/trends")
    public ResponseEntity<TrendSeries> trends(
            @RequestParam(required = false) String period,
            @RequestParam(name = "course_id", required = false) Long courseId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        return ResponseEntity.ok(feedbackService.trends(filter(courseId, startDate, endDate), TrendPeriod.fromToken(period)));
    }

    @GetMapping("/analytics/ratings")
    public ResponseEntity<RatingDistribution> ratings(
            @RequestParam(name = "course_id", required = false) Long courseId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        return ResponseEntity.ok(feedbackService.ratings(filter(courseId, startDate, endDate)));
    }

    @GetMapping("/tags/popular")
    public ResponseEntity<List<TagCount>> popularTags(
            @RequestParam(required = false) Integer limit,
            @RequestParam(name = "course_id", required = false) Long courseId) {

        return ResponseEntity.ok(feedbackService.popularTags(filter(courseId, null, null), limit));
    }

    private static FeedbackFilter filter(Long courseId, LocalDate startDate, LocalDate endDate) {
        return FeedbackFilter.builder()
                .courseId(courseId)
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }
}
