package com.eduanalytics.domain.exception;

/**
 * Unrecoverable ETL failure. Terminates the job as failed; never re-raised past the job runner.
 */
public class EtlPipelineException extends RuntimeException {

    public EtlPipelineException(String message) {
        super(message);
    }

    public EtlPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
