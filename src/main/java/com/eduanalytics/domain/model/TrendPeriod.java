package com.eduanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Calendar granularity for trend series.
 *
 * Buckets are labelled in the store, PostgreSQL through TO_CHAR and MongoDB through
 * $dateToString, with patterns that produce the same zero padded labels, so lexicographic
 * order matches chronological order. Weeks are ISO weeks labelled with their week-based year.
 */
public enum TrendPeriod {
    DAILY("YYYY-MM-DD", "%Y-%m-%d"),
    WEEKLY("IYYY-\"W\"IW", "%G-W%V"),
    MONTHLY("YYYY-MM", "%Y-%m"),
    YEARLY("YYYY", "%Y");

    public static final TrendPeriod DEFAULT = MONTHLY;

    private final String sqlPattern;
    private final String mongoFormat;

    TrendPeriod(String sqlPattern, String mongoFormat) {
        this.sqlPattern = sqlPattern;
        this.mongoFormat = mongoFormat;
    }

    @JsonValue
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse: unknown or missing tokens fall back to {@link #DEFAULT}.
     */
    public static TrendPeriod fromToken(String token) {
        if (token == null || token.isBlank()) {
            return DEFAULT;
        }
        for (TrendPeriod period : values()) {
            if (period.name().equalsIgnoreCase(token.trim())) {
                return period;
            }
        }
        return DEFAULT;
    }

    /**
     * PostgreSQL TO_CHAR pattern for the bucket label.
     */
    public String sqlPattern() {
        return sqlPattern;
    }

    /**
     * MongoDB $dateToString format for the bucket label (UTC).
     */
    public String mongoFormat() {
        return mongoFormat;
    }
}
