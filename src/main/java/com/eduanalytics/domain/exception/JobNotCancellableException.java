package com.eduanalytics.domain.exception;

public class JobNotCancellableException extends RuntimeException {

    public JobNotCancellableException(String jobId, String status) {
        super("Job " + jobId + " cannot be cancelled in status " + status);
    }
}
