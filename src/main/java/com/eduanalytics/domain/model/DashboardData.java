package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardData {

    private PerformanceMetrics performanceMetrics;
    private EnrollmentStats enrollmentStats;
    private List<CourseStats> courseStats;
    private List<DepartmentStats> departmentStats;
}
