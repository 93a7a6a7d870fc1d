package com.eduanalytics.domain.model;

import com.eduanalytics.infrastructure.persistence.entity.SchoolEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchoolResponse {

    private Long schoolId;
    private String schoolCode;
    private String schoolName;
    private String deanName;
    private Boolean isActive;

    public static SchoolResponse from(SchoolEntity entity) {
        return SchoolResponse.builder()
                .schoolId(entity.getSchoolId())
                .schoolCode(entity.getSchoolCode())
                .schoolName(entity.getSchoolName())
                .deanName(entity.getDeanName())
                .isActive(entity.isActive())
                .build();
    }
}
