package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Enrollment facts grouped in the store by student or course.
 *
 * activeRecords are neither dropped nor completed.
 */
@Value
@Builder
@AllArgsConstructor
public class EnrollmentAggregate {

    Long groupId;
    Long records;
    Long droppedRecords;
    Long completedRecords;
    Long activeRecords;
}
