package com.eduanalytics.domain.model;

import com.eduanalytics.infrastructure.persistence.entity.InstructorEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstructorResponse {

    private Long instructorId;
    private String instructorNumber;
    private String firstName;
    private String lastName;
    private String email;
    private String title;
    private Long departmentId;
    private LocalDate hireDate;
    private Boolean isActive;

    public static InstructorResponse from(InstructorEntity entity) {
        return InstructorResponse.builder()
                .instructorId(entity.getInstructorId())
                .instructorNumber(entity.getInstructorNumber())
                .firstName(entity.getFirstName())
                .lastName(entity.getLastName())
                .email(entity.getEmail())
                .title(entity.getTitle())
                .departmentId(entity.getDepartment() != null ? entity.getDepartment().getDepartmentId() : null)
                .hireDate(entity.getHireDate())
                .isActive(entity.isActive())
                .build();
    }
}
