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
public class TrendSeries {

    // performance, enrollment or feedback
    private String metric;
    private TrendPeriod period;
    private List<TrendPoint> trends;
}
