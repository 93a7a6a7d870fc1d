package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.ValidationException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Comma separated files with a header row.
 */
@Component
public class CsvFileParser implements TabularFileParser {

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    @Override
    public ParsedFile parse(InputStream input) {
        if (input == null) {
            throw new ValidationException("Input stream is required");
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(input)) {

            List<Map<String, String>> records = new ArrayList<>();
            while (rows.hasNext()) {
                records.add(normalize(rows.next()));
            }

            List<String> columns = new ArrayList<>();
            CsvSchema parsed = (CsvSchema) rows.getParser().getSchema();
            if (parsed != null) {
                parsed.forEach(column -> columns.add(TabularFileParser.normalizeColumn(column.getName())));
            }
            return new ParsedFile(columns, records);
        } catch (IOException | RuntimeException e) {
            throw new ValidationException("Malformed CSV content: " + e.getMessage());
        }
    }

    private Map<String, String> normalize(Map<String, String> row) {
        Map<String, String> record = new LinkedHashMap<>();
        row.forEach((column, value) -> record.put(
                TabularFileParser.normalizeColumn(column),
                value == null || value.isBlank() ? null : value.trim()));
        return record;
    }
}
