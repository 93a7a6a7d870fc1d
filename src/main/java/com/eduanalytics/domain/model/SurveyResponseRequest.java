package com.eduanalytics.domain.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SurveyResponseRequest {

    @NotBlank
    private String surveyId;

    @NotNull
    private Long studentId;

    @NotNull
    private Map<String, Object> responses;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double completionPercentage;

    @PositiveOrZero
    private Integer timeSpentSeconds;

    private String deviceType;
}
