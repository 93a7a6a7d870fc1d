package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class StatusCount {

    StudentStatus status;
    Long count;
}
