package com.eduanalytics.infrastructure.document.repository;

import com.eduanalytics.domain.etl.EtlJobState;
import com.eduanalytics.domain.etl.EtlJobType;
import com.eduanalytics.infrastructure.document.model.EtlJobLogDocument;

import java.time.Instant;
import java.util.List;

/**
 * Single-document atomic updates on ETL job logs.
 */
public interface EtlJobLogRepositoryCustom {

    void updateTotalRecords(String jobId, long totalRecords);

    /**
     * Writes all three counters in one update so processed == successful + failed
     * holds in every persisted version of the record.
     */
    void updateProgress(String jobId, long processed, long successful, long failed);

    /**
     * Moves a RUNNING job to a terminal state and stamps its end time.
     *
     * @return false when the job was no longer running, in which case nothing is written
     */
    boolean finishIfRunning(String jobId, EtlJobState state, String errorMessage, Instant endTime);

    List<EtlJobLogDocument> findJobs(EtlJobState status, EtlJobType jobType, int limit);
}
