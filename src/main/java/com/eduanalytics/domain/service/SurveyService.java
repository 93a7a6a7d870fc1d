package com.eduanalytics.domain.service;

import com.eduanalytics.domain.model.SurveyResponseRequest;
import com.eduanalytics.domain.model.SurveySummary;
import com.eduanalytics.infrastructure.document.model.SurveyResponseDocument;
import com.eduanalytics.infrastructure.document.repository.SurveyResponseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class SurveyService {

    private final SurveyResponseRepository surveyResponseRepository;

    public SurveyResponseDocument record(SurveyResponseRequest request) {
        SurveyResponseDocument saved = surveyResponseRepository.save(SurveyResponseDocument.builder()
                .surveyId(request.getSurveyId())
                .studentId(request.getStudentId())
                .responses(new HashMap<>(request.getResponses()))
                .completionPercentage(request.getCompletionPercentage())
                .timeSpentSeconds(request.getTimeSpentSeconds())
                .deviceType(request.getDeviceType())
                .createdAt(Instant.now())
                .build());
        log.debug("Stored survey response {} for survey {}", saved.getId(), saved.getSurveyId());
        return saved;
    }

    public List<SurveyResponseDocument> responses(String surveyId) {
        return surveyResponseRepository.findBySurveyIdOrderByCreatedAtDesc(surveyId);
    }

    public SurveySummary summary(String surveyId) {
        List<SurveyResponseDocument> responses = responses(surveyId);
        return SurveySummary.builder()
                .surveyId(surveyId)
                .totalResponses(responses.size())
                .averageCompletion(responses.stream()
                        .map(SurveyResponseDocument::getCompletionPercentage)
                        .filter(Objects::nonNull)
                        .mapToDouble(Double::doubleValue)
                        .average()
                        .orElse(0.0))
                .averageTimeSpentSeconds(responses.stream()
                        .map(SurveyResponseDocument::getTimeSpentSeconds)
                        .filter(Objects::nonNull)
                        .mapToInt(Integer::intValue)
                        .average()
                        .orElse(0.0))
                .build();
    }
}
