package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseStatistics {

    private long courseId;
    private long totalEnrollments;
    private long activeEnrollments;
    private long completedEnrollments;
    private long gradedRecords;
    private double averageGradePoints;
    private double averageFinalScore;
    private long passedStudents;
    private double passRate;
}
