package com.eduanalytics.infrastructure.document.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "survey_responses")
public class SurveyResponseDocument {

    @Id
    private String id;

    @Indexed
    private String surveyId;

    @Indexed
    private Long studentId;

    // question id -> answer, shape varies per survey
    @Builder.Default
    private Map<String, Object> responses = new HashMap<>();

    private Double completionPercentage;

    private Integer timeSpentSeconds;

    private String deviceType;

    private Instant createdAt;
}
