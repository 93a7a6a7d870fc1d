package com.eduanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.eduanalytics.domain.exception.ValidationException;

/**
 * The twelve letter grades a performance fact can carry.
 */
public enum LetterGrade {
    A_PLUS("A+"),
    A("A"),
    A_MINUS("A-"),
    B_PLUS("B+"),
    B("B"),
    B_MINUS("B-"),
    C_PLUS("C+"),
    C("C"),
    C_MINUS("C-"),
    D_PLUS("D+"),
    D("D"),
    F("F");

    private final String symbol;

    LetterGrade(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    @JsonCreator
    public static LetterGrade fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        String trimmed = symbol.trim().toUpperCase();
        for (LetterGrade grade : values()) {
            if (grade.symbol.equals(trimmed)) {
                return grade;
            }
        }
        throw new ValidationException("Unknown letter grade: " + symbol);
    }

    /**
     * Letter grade for loads that only carry grade points.
     * A+ and D+ are never derived; they only arrive explicitly.
     */
    public static LetterGrade fromGradePoints(double gradePoints) {
        if (gradePoints >= 3.7) return A;
        if (gradePoints >= 3.3) return A_MINUS;
        if (gradePoints >= 3.0) return B_PLUS;
        if (gradePoints >= 2.7) return B;
        if (gradePoints >= 2.3) return B_MINUS;
        if (gradePoints >= 2.0) return C_PLUS;
        if (gradePoints >= 1.7) return C;
        if (gradePoints >= 1.3) return C_MINUS;
        if (gradePoints >= 1.0) return D;
        return F;
    }
}
