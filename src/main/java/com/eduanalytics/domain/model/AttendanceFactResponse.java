package com.eduanalytics.domain.model;

import com.eduanalytics.infrastructure.persistence.entity.AttendanceFactEntity;
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
public class AttendanceFactResponse {

    private Long factId;
    private Long studentId;
    private Long courseId;
    private LocalDate classDate;
    private Boolean isPresent;
    private Boolean isLate;
    private Integer minutesLate;
    private Instant createdAt;

    public static AttendanceFactResponse from(AttendanceFactEntity entity) {
        return AttendanceFactResponse.builder()
                .factId(entity.getFactId())
                .studentId(entity.getStudent().getStudentId())
                .courseId(entity.getCourse().getCourseId())
                .classDate(entity.getClassDate())
                .isPresent(entity.isPresent())
                .isLate(entity.isLate())
                .minutesLate(entity.getMinutesLate())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
