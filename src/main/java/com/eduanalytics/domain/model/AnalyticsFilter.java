package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Conjunctive filter for aggregate reads. Null fields impose no constraint; date bounds are inclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsFilter {

    private Long studentId;
    private Long courseId;
    private Long departmentId;
    private CourseLevel level;
    private LocalDate startDate;
    private LocalDate endDate;

    public boolean hasDateBound() {
        return startDate != null || endDate != null;
    }
}
