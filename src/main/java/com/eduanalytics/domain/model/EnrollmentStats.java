package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrollmentStats {

    private long totalStudents;
    private long activeStudents;
    private long graduatedStudents;
    private long newEnrollments;
    private double retentionRate;
}
