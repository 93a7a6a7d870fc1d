package com.eduanalytics.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentRequest {

    @NotBlank
    @Size(max = 10)
    private String departmentCode;

    @NotBlank
    private String departmentName;

    private Long schoolId;

    @PositiveOrZero
    private Double budget;
}
