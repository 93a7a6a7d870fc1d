package com.eduanalytics.domain.model;

import com.eduanalytics.infrastructure.persistence.entity.PerformanceFactEntity;
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
public class PerformanceFactResponse {

    private Long factId;
    private Long studentId;
    private Long courseId;
    private Long instructorId;
    private LocalDate date;
    private Double gradePoints;
    private LetterGrade letterGrade;
    private Integer creditsEarned;
    private Double attendancePercentage;
    private Double assignmentScore;
    private Double examScore;
    private Double finalScore;
    private Boolean isPass;
    private Instant createdAt;

    public static PerformanceFactResponse from(PerformanceFactEntity entity) {
        return PerformanceFactResponse.builder()
                .factId(entity.getFactId())
                .studentId(entity.getStudent().getStudentId())
                .courseId(entity.getCourse().getCourseId())
                .instructorId(entity.getInstructor().getInstructorId())
                .date(entity.getTimeDimension().getCalendarDate())
                .gradePoints(entity.getGradePoints())
                .letterGrade(entity.getLetterGrade())
                .creditsEarned(entity.getCreditsEarned())
                .attendancePercentage(entity.getAttendancePercentage())
                .assignmentScore(entity.getAssignmentScore())
                .examScore(entity.getExamScore())
                .finalScore(entity.getFinalScore())
                .isPass(entity.isPassed())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
