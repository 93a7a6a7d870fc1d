package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeRangeRequest {

    // omitted bounds fall back to app.time-dimension defaults
    private LocalDate startDate;

    private LocalDate endDate;
}
