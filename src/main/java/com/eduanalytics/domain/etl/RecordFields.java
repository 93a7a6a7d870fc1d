package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.ValidationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Typed access to one parsed row. Every accessor throws {@link ValidationException}
 * naming the column when a value is missing or malformed.
 */
public class RecordFields {

    private final Map<String, String> values;

    public RecordFields(Map<String, String> values) {
        this.values = values;
    }

    public boolean has(String column) {
        String value = values.get(column);
        return value != null && !value.isBlank();
    }

    public String text(String column) {
        return has(column) ? values.get(column).trim() : null;
    }

    public String requireText(String column) {
        if (!has(column)) {
            throw new ValidationException("Missing required field: " + column);
        }
        return text(column);
    }

    public LocalDate date(String column) {
        if (!has(column)) {
            return null;
        }
        String value = text(column);
        try {
            // tolerate date-time values such as 2024-01-15T00:00:00
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid date in " + column + ": " + value);
        }
    }

    public LocalDate requireDate(String column) {
        requireText(column);
        return date(column);
    }

    public Integer integer(String column) {
        if (!has(column)) {
            return null;
        }
        String value = text(column);
        try {
            return new BigDecimal(value).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ValidationException("Invalid integer in " + column + ": " + value);
        }
    }

    public Integer requireInteger(String column) {
        requireText(column);
        return integer(column);
    }

    public Long id(String column) {
        Integer value = integer(column);
        return value == null ? null : value.longValue();
    }

    /**
     * @return the value, or null when absent; out-of-range values are rejected
     */
    public Double decimal(String column, double min, double max) {
        if (!has(column)) {
            return null;
        }
        String value = text(column);
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid number in " + column + ": " + value);
        }
        if (Double.isNaN(parsed) || parsed < min || parsed > max) {
            throw new ValidationException(column + " must be between " + min + " and " + max + ": " + value);
        }
        return parsed;
    }

    public Double requireDecimal(String column, double min, double max) {
        requireText(column);
        return decimal(column, min, max);
    }

    public Boolean bool(String column) {
        if (!has(column)) {
            return null;
        }
        String value = text(column).toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes", "y" -> Boolean.TRUE;
            case "false", "0", "no", "n" -> Boolean.FALSE;
            default -> throw new ValidationException("Invalid boolean in " + column + ": " + value);
        };
    }
}
