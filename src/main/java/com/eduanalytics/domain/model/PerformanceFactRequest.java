package com.eduanalytics.domain.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request to record a graded outcome.
 *
 * isPass is accepted for compatibility with existing feeds but ignored; the pass flag is
 * always recomputed from the final score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceFactRequest {

    @NotNull
    private Long studentId;

    @NotNull
    private Long courseId;

    @NotNull
    private Long instructorId;

    @NotNull
    private LocalDate date;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("4.0")
    private Double gradePoints;

    private LetterGrade letterGrade;

    @NotNull
    @Min(0)
    private Integer creditsEarned;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double attendancePercentage;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double assignmentScore;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double examScore;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double finalScore;

    private Boolean isPass;
}
