package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class CourseSnapshot {
    Long courseId;
    String courseName;
    Long departmentId;
    CourseLevel level;
}
