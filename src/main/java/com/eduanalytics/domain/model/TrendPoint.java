package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One calendar bucket of a trend series.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendPoint {

    private String period;
    private long count;
    private double average;
}
