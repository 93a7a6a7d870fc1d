package com.eduanalytics.domain.model;

import com.eduanalytics.domain.etl.EtlJobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtlJobSubmission {
    private String jobId;
    private EtlJobState status;
    private String message;
}
