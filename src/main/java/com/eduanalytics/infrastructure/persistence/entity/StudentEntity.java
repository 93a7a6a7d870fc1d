package com.eduanalytics.infrastructure.persistence.entity;

import com.eduanalytics.domain.model.Gender;
import com.eduanalytics.domain.model.StudentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Student dimension.
 *
 * gpa and creditsCompleted are caches of the student's performance facts,
 * refreshed whenever a performance fact is recorded.
 */
@Entity
@Table(name = "dim_student", indexes = {
    @Index(name = "idx_student_number_unique", columnList = "student_number", unique = true),
    @Index(name = "idx_student_status_major", columnList = "status,major")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "student_id")
    private Long studentId;

    @Column(name = "student_number", nullable = false, length = 20)
    private String studentNumber;

    @Column(nullable = false, length = 100)
    private String firstName;

    @Column(nullable = false, length = 100)
    private String lastName;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false)
    private LocalDate dateOfBirth;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Gender gender;

    @Column(length = 50)
    private String ethnicity;

    @Column(nullable = false)
    private LocalDate enrollmentDate;

    private LocalDate graduationDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private StudentStatus status = StudentStatus.ACTIVE;

    @Column(length = 100)
    private String major;

    @Column(length = 100)
    private String minor;

    private Double gpa;

    @Builder.Default
    private Integer creditsCompleted = 0;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
