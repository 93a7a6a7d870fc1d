package com.eduanalytics.domain.exception;

/**
 * Duplicate business key on create. Raised before anything is written.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
