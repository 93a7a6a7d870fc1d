package com.eduanalytics.domain.model;

import jakarta.validation.constraints.Email;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Partial update. Only non-null fields are applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudentUpdateRequest {

    private String firstName;
    private String lastName;

    @Email
    private String email;

    private String major;
    private String minor;
    private StudentStatus status;
    private LocalDate graduationDate;
}
