package com.eduanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.eduanalytics.domain.exception.ValidationException;

import java.util.Locale;

public enum StudentStatus {
    ACTIVE,
    GRADUATED,
    DROPPED,
    SUSPENDED;

    @JsonValue
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StudentStatus fromToken(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        try {
            return valueOf(token.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown student status: " + token);
        }
    }
}
