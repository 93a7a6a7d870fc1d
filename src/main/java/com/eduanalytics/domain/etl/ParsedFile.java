package com.eduanalytics.domain.etl;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Rows of an input file as column -> text, in file order. Blank cells are absent or null.
 * Column names are trimmed and lower-cased.
 */
@Value
public class ParsedFile {
    List<String> columns;
    List<Map<String, String>> records;

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
