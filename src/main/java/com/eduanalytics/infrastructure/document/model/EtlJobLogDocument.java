package com.eduanalytics.infrastructure.document.model;

import com.eduanalytics.domain.etl.EtlJobState;
import com.eduanalytics.domain.etl.EtlJobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Durable record of one ETL job.
 *
 * Created as RUNNING; the counters are written only by the job itself, and endTime is set
 * only together with a terminal status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "etl_job_logs")
public class EtlJobLogDocument {

    @Id
    private String id;

    @Indexed(unique = true)
    private String jobId;

    @Indexed
    private EtlJobType jobType;

    @Indexed
    private EtlJobState status;

    private Instant startTime;

    private Instant endTime;

    private Long totalRecords;

    private long recordsProcessed;

    private long recordsSuccessful;

    private long recordsFailed;

    private String errorMessage;

    private String filePath;

    @Indexed
    private Instant createdAt;

    /**
     * completed reads as 100, failed as 0, otherwise processed over total.
     */
    public double progress() {
        if (status == EtlJobState.COMPLETED) {
            return 100.0;
        }
        if (status == EtlJobState.FAILED) {
            return 0.0;
        }
        if (totalRecords == null || totalRecords <= 0) {
            return 0.0;
        }
        return Math.min(100.0, recordsProcessed * 100.0 / totalRecords);
    }
}
