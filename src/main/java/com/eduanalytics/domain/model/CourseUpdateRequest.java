package com.eduanalytics.domain.model;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseUpdateRequest {

    private String courseName;
    private String courseDescription;

    @Min(0)
    private Integer credits;

    private String prerequisites;
    private Boolean isActive;
}
