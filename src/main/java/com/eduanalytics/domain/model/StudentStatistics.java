package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudentStatistics {

    private long studentId;
    private long totalCourses;
    private double averageGradePoints;
    private long totalCredits;
    private long passedCourses;
    private long totalEnrollments;
    private long droppedEnrollments;
    private double passRate;
}
