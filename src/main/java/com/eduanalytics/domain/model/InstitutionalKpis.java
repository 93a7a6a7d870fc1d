package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstitutionalKpis {

    private double retentionRate;
    private double graduationRate;
    private double averageGpa;
    private double studentSatisfaction;
    private double facultyRatio;
    private double budgetUtilization;
}
