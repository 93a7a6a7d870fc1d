package com.eduanalytics.domain.exception;

/**
 * Upload whose format cannot be detected or is not supported.
 */
public class UnsupportedFileTypeException extends ValidationException {

    public UnsupportedFileTypeException(String message) {
        super(message);
    }
}
