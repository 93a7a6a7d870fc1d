package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.EtlPipelineException;
import com.eduanalytics.infrastructure.cache.QueryCacheService;
import com.eduanalytics.infrastructure.document.model.EtlJobLogDocument;
import com.eduanalytics.infrastructure.document.model.SystemLogDocument;
import com.eduanalytics.infrastructure.document.repository.EtlJobLogRepository;
import com.eduanalytics.infrastructure.document.repository.SystemLogRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Executes ETL jobs on the ETL executor.
 *
 * Processing Flow:
 * 1. Read the input (a read failure fails the job)
 * 2. Record the total row count
 * 3. Load rows in file order; a failing row is counted and skipped
 * 4. Every chunk: persist counters and check whether the job was cancelled
 * 5. Persist final counters and mark the job completed
 *
 * Terminal writes only apply while the stored status is still RUNNING, so a job cancelled
 * from the API keeps its cancelled status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EtlJobRunner {

    private static final String MODULE = "etl";

    private final EtlJobLogRepository jobLogRepository;
    private final SystemLogRepository systemLogRepository;
    private final RecordLoaderRegistry loaderRegistry;
    private final EtlJobRegistry jobRegistry;
    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Value("${app.etl.progress-chunk-size:100}")
    private int chunkSize = 100;

    @Async("etlTaskExecutor")
    public void runAsync(String jobId, EtlJobType jobType, RecordSource source) {
        run(jobId, jobType, source);
    }

    public void run(String jobId, EtlJobType jobType, RecordSource source) {
        CancellationToken token = jobRegistry.get(jobId);
        if (token == null) {
            token = jobRegistry.register(jobId);
        }

        try {
            log.info("ETL job {} started (type: {})", jobId, jobType.token());

            ParsedFile file;
            try {
                file = source.read();
            } catch (Exception e) {
                throw new EtlPipelineException("Failed to read input: " + e.getMessage(), e);
            }

            List<Map<String, String>> records = file.getRecords();
            jobLogRepository.updateTotalRecords(jobId, records.size());

            RecordLoader loader = loaderRegistry.loaderFor(jobType);
            long processed = 0;
            long successful = 0;
            long failed = 0;

            for (Map<String, String> record : records) {
                if (token.isCancelled()) {
                    break;
                }

                try {
                    loader.load(new RecordFields(record));
                    successful++;
                } catch (RuntimeException e) {
                    failed++;
                    log.warn("ETL job {} row {} failed: {}", jobId, processed + 1, e.getMessage());
                }
                processed++;

                if (processed % chunkSize == 0) {
                    jobLogRepository.updateProgress(jobId, processed, successful, failed);
                    if (!stillRunning(jobId)) {
                        token.cancel();
                    }
                }
            }

            jobLogRepository.updateProgress(jobId, processed, successful, failed);

            if (token.isCancelled()) {
                log.info("ETL job {} stopped after cancellation ({} of {} rows processed)",
                        jobId, processed, records.size());
                recordCounters(jobType, EtlJobState.CANCELLED, successful, failed);
                return;
            }

            if (!jobLogRepository.finishIfRunning(jobId, EtlJobState.COMPLETED, null, Instant.now())) {
                log.info("ETL job {} was no longer running; completion not recorded", jobId);
                return;
            }

            recordCounters(jobType, EtlJobState.COMPLETED, successful, failed);
            cacheService.evictAll();

            log.info("ETL job {} completed: {} processed, {} successful, {} failed",
                    jobId, processed, successful, failed);
            systemLog("INFO", "ETL job completed", Map.of(
                    "job_id", jobId,
                    "job_type", jobType.token(),
                    "records_processed", processed,
                    "records_successful", successful,
                    "records_failed", failed));

        } catch (Exception e) {
            fail(jobId, jobType, e.getMessage(), e);
        } finally {
            jobRegistry.remove(jobId);
        }
    }

    private boolean stillRunning(String jobId) {
        return jobLogRepository.findByJobId(jobId)
                .map(EtlJobLogDocument::getStatus)
                .map(status -> status == EtlJobState.RUNNING)
                .orElse(false);
    }

    private void fail(String jobId, EtlJobType jobType, String message, Exception cause) {
        log.error("ETL job {} failed: {}", jobId, message, cause);
        try {
            if (jobLogRepository.finishIfRunning(jobId, EtlJobState.FAILED, message, Instant.now())) {
                recordCounters(jobType, EtlJobState.FAILED, 0, 0);
            }
        } catch (RuntimeException e) {
            log.error("Could not mark ETL job {} as failed: {}", jobId, e.getMessage(), e);
        }
        systemLog("ERROR", "ETL job failed: " + message, Map.of(
                "job_id", jobId,
                "job_type", jobType.token()));
    }

    private void recordCounters(EtlJobType jobType, EtlJobState state, long successful, long failed) {
        Counter.builder("etl.jobs")
                .tag("type", jobType.token())
                .tag("status", state.token())
                .register(meterRegistry)
                .increment();
        Counter.builder("etl.records")
                .tag("type", jobType.token())
                .tag("result", "successful")
                .register(meterRegistry)
                .increment(successful);
        Counter.builder("etl.records")
                .tag("type", jobType.token())
                .tag("result", "failed")
                .register(meterRegistry)
                .increment(failed);
    }

    private void systemLog(String level, String message, Map<String, Object> metadata) {
        try {
            systemLogRepository.save(SystemLogDocument.builder()
                    .level(level)
                    .message(message)
                    .module(MODULE)
                    .metadata(metadata)
                    .createdAt(Instant.now())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Could not write system log entry: {}", e.getMessage());
        }
    }
}
