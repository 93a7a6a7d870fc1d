package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * ETL job lifecycle. RUNNING is the only non-terminal state.
 */
public enum EtlJobState {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EtlJobState fromToken(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        try {
            return valueOf(token.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown job status: " + token);
        }
    }
}
