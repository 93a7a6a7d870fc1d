package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Conjunctive filter over feedback documents. Dates are inclusive, interpreted in UTC.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackFilter {

    private Long studentId;
    private Long courseId;
    private String feedbackType;
    private Integer minRating;
    private Integer maxRating;
    private LocalDate startDate;
    private LocalDate endDate;

    public Instant startInstant() {
        return startDate == null ? null : startDate.atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    // exclusive upper bound
    public Instant endInstantExclusive() {
        return endDate == null ? null : endDate.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    public static FeedbackFilter none() {
        return new FeedbackFilter();
    }
}
