package com.eduanalytics.domain.model;

import com.eduanalytics.infrastructure.persistence.entity.DepartmentEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentResponse {

    private Long departmentId;
    private String departmentCode;
    private String departmentName;
    private Long schoolId;
    private Double budget;
    private Boolean isActive;

    public static DepartmentResponse from(DepartmentEntity entity) {
        return DepartmentResponse.builder()
                .departmentId(entity.getDepartmentId())
                .departmentCode(entity.getDepartmentCode())
                .departmentName(entity.getDepartmentName())
                .schoolId(entity.getSchool() != null ? entity.getSchool().getSchoolId() : null)
                .budget(entity.getBudget())
                .isActive(entity.isActive())
                .build();
    }
}
