package com.eduanalytics.domain.model;

import com.eduanalytics.infrastructure.persistence.entity.CourseEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseResponse {

    private Long courseId;
    private String courseCode;
    private String courseName;
    private String courseDescription;
    private Integer credits;
    private CourseLevel level;
    private Long departmentId;
    private String prerequisites;
    private Boolean isActive;
    private Instant createdAt;
    private Instant updatedAt;

    public static CourseResponse from(CourseEntity entity) {
        return CourseResponse.builder()
                .courseId(entity.getCourseId())
                .courseCode(entity.getCourseCode())
                .courseName(entity.getCourseName())
                .courseDescription(entity.getCourseDescription())
                .credits(entity.getCredits())
                .level(entity.getLevel())
                .departmentId(entity.getDepartment() != null ? entity.getDepartment().getDepartmentId() : null)
                .prerequisites(entity.getPrerequisites())
                .isActive(entity.isActive())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
