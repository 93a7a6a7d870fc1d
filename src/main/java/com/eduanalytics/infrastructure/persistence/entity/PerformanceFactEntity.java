package com.eduanalytics.infrastructure.persistence.entity;

import com.eduanalytics.domain.model.LetterGrade;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Student performance fact. One row per graded student/course/term outcome.
 *
 * finalScore and passed are always set through PerformanceScoring, never taken from input.
 */
@Entity
@Table(name = "student_performance_fact", indexes = {
    @Index(name = "idx_perf_student_course", columnList = "student_id,course_id"),
    @Index(name = "idx_perf_time", columnList = "time_id"),
    @Index(name = "idx_perf_grade_points", columnList = "grade_points")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceFactEntity {

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
    @JoinColumn(name = "instructor_id", nullable = false)
    private InstructorEntity instructor;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "time_id", nullable = false)
    private TimeDimensionEntity timeDimension;

    @Column(name = "grade_points", nullable = false)
    private Double gradePoints;

    @Convert(converter = LetterGradeConverter.class)
    @Column(name = "letter_grade", nullable = false, length = 2)
    private LetterGrade letterGrade;

    @Column(nullable = false)
    private Integer creditsEarned;

    private Double attendancePercentage;

    private Double assignmentScore;

    private Double examScore;

    private Double finalScore;

    @Column(name = "is_pass", nullable = false)
    private boolean passed;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
