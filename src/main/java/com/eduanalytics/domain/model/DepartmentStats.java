package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentStats {

    private long departmentId;
    private String departmentName;
    private long totalCourses;
    private long totalStudents;
    private double averageGpa;
    private double graduationRate;
}
