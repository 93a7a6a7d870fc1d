package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-student performance aggregate. studentId 0 marks the institution-wide entry of the dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {

    private long studentId;
    private double gpa;
    private long creditsCompleted;
    private long coursesTaken;
    private double averageGrade;
    private double passRate;
}
