package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RatingDistribution {

    // "1".."5", ascending, only ratings that occur
    private Map<String, Long> ratings;
    private long total;
}
