package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Performance facts grouped in the store by one key (student, course or department).
 *
 * Averages are null when the group holds no value for them. passedRecords counts a fact as
 * passed when its final score reaches the pass threshold, or, lacking a final score, when its
 * stored pass flag is set.
 */
@Value
@Builder
@AllArgsConstructor
public class PerformanceAggregate {

    Long groupId;
    Long records;
    Double averageGradePoints;
    Double averageFinalScore;
    Long creditsEarned;
    Long passedRecords;
}
