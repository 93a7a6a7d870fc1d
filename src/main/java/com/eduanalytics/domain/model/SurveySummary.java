package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SurveySummary {

    private String surveyId;
    private long totalResponses;
    private double averageCompletion;
    private double averageTimeSpentSeconds;
}
