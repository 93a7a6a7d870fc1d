package com.eduanalytics.domain.etl;

/**
 * Deferred read of a job's input, evaluated on the ETL executor.
 */
@FunctionalInterface
public interface RecordSource {

    ParsedFile read() throws Exception;
}
