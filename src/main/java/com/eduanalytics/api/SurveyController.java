package com.eduanalytics.api;

import com.eduanalytics.domain.model.SurveyResponseRequest;
import com.eduanalytics.domain.model.SurveySummary;
import com.eduanalytics.domain.service.SurveyService;
import com.eduanalytics.infrastructure.document.model.SurveyResponseDocument;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/surveys")
@RequiredArgsConstructor
public class SurveyController {

    private final SurveyService surveyService;

    @PostMapping
    public ResponseEntity<SurveyResponseDocument> record(@Valid @RequestBody SurveyResponseRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(surveyService.record(request));
    }

    @GetMapping("/{surveyId}")
    public ResponseEntity<List<SurveyResponseDocument>> responses(@PathVariable String surveyId) {
        return ResponseEntity.ok(surveyService.responses(surveyId));
    }

    @GetMapping("/{surveyId}/summary")
    public ResponseEntity<SurveySummary> summary(@PathVariable String surveyId) {
        return ResponseEntity.ok(surveyService.summary(surveyId));
    }
}
