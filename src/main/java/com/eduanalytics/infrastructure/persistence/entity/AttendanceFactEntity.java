package com.eduanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "attendance_fact", indexes = {
    @Index(name = "idx_attendance_student_course", columnList = "student_id,course_id"),
    @Index(name = "idx_attendance_class_date", columnList = "class_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceFactEntity {

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

    @Column(name = "class_date", nullable = false)
    private LocalDate classDate;

    @Column(name = "is_present", nullable = false)
    private boolean present;

    @Column(name = "is_late", nullable = false)
    private boolean late;

    @Builder.Default
    private Integer minutesLate = 0;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
