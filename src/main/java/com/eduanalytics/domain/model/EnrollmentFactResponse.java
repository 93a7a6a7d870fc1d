package com.eduanalytics.domain.model;

import com.eduanalytics.infrastructure.persistence.entity.EnrollmentFactEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrollmentFactResponse {

    private Long factId;
    private Long studentId;
    private Long courseId;
    private LocalDate enrollmentDate;
    private LocalDate dropDate;
    private Boolean isDropped;
    private Boolean isCompleted;
    private Integer waitlistPosition;
    private Instant createdAt;

    public static EnrollmentFactResponse from(EnrollmentFactEntity entity) {
        return EnrollmentFactResponse.builder()
                .factId(entity.getFactId())
                .studentId(entity.getStudent().getStudentId())
                .courseId(entity.getCourse().getCourseId())
                .enrollmentDate(entity.getEnrollmentDate())
                .dropDate(entity.getDropDate())
                .isDropped(entity.isDropped())
                .isCompleted(entity.isCompleted())
                .waitlistPosition(entity.getWaitlistPosition())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
