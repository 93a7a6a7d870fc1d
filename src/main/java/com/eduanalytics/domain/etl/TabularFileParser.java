package com.eduanalytics.domain.etl;

import java.io.InputStream;
import java.util.Locale;

/**
 * Parser for one upload format.
 */
public interface TabularFileParser {

    /**
     * @throws com.eduanalytics.domain.exception.ValidationException when the content cannot be parsed
     */
    ParsedFile parse(InputStream input);

    static String normalizeColumn(String column) {
        return column == null ? null : column.trim().toLowerCase(Locale.ROOT);
    }
}
