package com.eduanalytics.domain.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {

    @NotNull
    private Long studentId;

    @NotNull
    private Long courseId;

    @NotBlank
    private String feedbackType;

    @NotNull
    @Min(1)
    @Max(5)
    private Integer rating;

    private String comment;

    // opaque label from an upstream annotator
    private String sentiment;

    private List<String> tags;
}
