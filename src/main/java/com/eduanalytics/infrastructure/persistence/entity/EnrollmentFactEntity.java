package com.eduanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "enrollment_fact", indexes = {
    @Index(name = "idx_enrollment_student_course", columnList = "student_id,course_id"),
    @Index(name = "idx_enrollment_date", columnList = "enrollment_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrollmentFactEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "fact_id")
    private Long factId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false)
    private StudentEntity student;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "course_id", nullable = false)
    private CourseEntity course;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "time_id", nullable = false)
    private TimeDimensionEntity timeDimension;

    @Column(name = "enrollment_date", nullable = false)
    private LocalDate enrollmentDate;

    private LocalDate dropDate;

    @Column(name = "is_dropped", nullable = false)
    private boolean dropped;

    @Column(name = "is_completed", nullable = false)
    private boolean completed;

    private Integer waitlistPosition;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
