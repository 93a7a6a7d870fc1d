package com.eduanalytics.domain.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseCreateRequest {

    @NotBlank
    @Size(max = 20)
    private String courseCode;

    @NotBlank
    private String courseName;

    private String courseDescription;

    @NotNull
    @Min(0)
    private Integer credits;

    @NotNull
    private CourseLevel level;

    @NotNull
    private Long departmentId;

    private String prerequisites;
}
