package com.eduanalytics.infrastructure.persistence.entity;

import com.eduanalytics.domain.model.LetterGrade;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores letter grades by their symbol ("A+", "B-") rather than the enum constant name.
 */
@Converter
public class LetterGradeConverter implements AttributeConverter<LetterGrade, String> {

    @Override
    public String convertToDatabaseColumn(LetterGrade grade) {
        return grade == null ? null : grade.symbol();
    }

    @Override
    public LetterGrade convertToEntityAttribute(String symbol) {
        return LetterGrade.fromSymbol(symbol);
    }
}
