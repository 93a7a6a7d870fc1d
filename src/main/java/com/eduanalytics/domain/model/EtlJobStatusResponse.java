package com.eduanalytics.domain.model;

import com.eduanalytics.domain.etl.EtlJobState;
import com.eduanalytics.domain.etl.EtlJobType;
import com.eduanalytics.infrastructure.document.model.EtlJobLogDocument;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtlJobStatusResponse {
    private String jobId;
    private EtlJobType jobType;
    private EtlJobState status;
    private double progress;
    private Long totalRecords;
    private long recordsProcessed;
    private long recordsSuccessful;
    private long recordsFailed;
    private Instant startTime;
    private Instant endTime;
    private String errorMessage;
    private String filePath;

    public static EtlJobStatusResponse from(EtlJobLogDocument job) {
        return EtlJobStatusResponse.builder()
                .jobId(job.getJobId())
                .jobType(job.getJobType())
                .status(job.getStatus())
                .progress(job.progress())
                .totalRecords(job.getTotalRecords())
                .recordsProcessed(job.getRecordsProcessed())
                .recordsSuccessful(job.getRecordsSuccessful())
                .recordsFailed(job.getRecordsFailed())
                .startTime(job.getStartTime())
                .endTime(job.getEndTime())
                .errorMessage(job.getErrorMessage())
                .filePath(job.getFilePath())
                .build();
    }
}
