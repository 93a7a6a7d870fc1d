package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseStats {

    private long courseId;
    private String courseName;
    private long totalEnrollments;
    private double averageGrade;
    private double passRate;
    private double completionRate;
}
