package com.eduanalytics.domain.model;

import com.eduanalytics.infrastructure.persistence.entity.StudentEntity;
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
public class StudentResponse {

    private Long studentId;
    private String studentNumber;
    private String firstName;
    private String lastName;
    private String email;
    private LocalDate dateOfBirth;
    private Gender gender;
    private String ethnicity;
    private String major;
    private String minor;
    private LocalDate enrollmentDate;
    private LocalDate graduationDate;
    private StudentStatus status;
    private Double gpa;
    private Integer creditsCompleted;
    private Instant createdAt;
    private Instant updatedAt;

    public static StudentResponse from(StudentEntity entity) {
        return StudentResponse.builder()
                .studentId(entity.getStudentId())
                .studentNumber(entity.getStudentNumber())
                .firstName(entity.getFirstName())
                .lastName(entity.getLastName())
                .email(entity.getEmail())
                .dateOfBirth(entity.getDateOfBirth())
                .gender(entity.getGender())
                .ethnicity(entity.getEthnicity())
                .major(entity.getMajor())
                .minor(entity.getMinor())
                .enrollmentDate(entity.getEnrollmentDate())
                .graduationDate(entity.getGraduationDate())
                .status(entity.getStatus())
                .gpa(entity.getGpa())
                .creditsCompleted(entity.getCreditsCompleted())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
