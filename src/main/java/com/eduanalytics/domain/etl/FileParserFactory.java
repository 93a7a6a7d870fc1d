package com.eduanalytics.domain.etl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FileParserFactory {

    private final CsvFileParser csvFileParser;
    private final ExcelFileParser excelFileParser;
    private final JsonFileParser jsonFileParser;

    public TabularFileParser getParser(FileType fileType) {
        if (fileType == null) {
            throw new IllegalArgumentException("File type is required");
        }
        return switch (fileType) {
            case CSV -> csvFileParser;
            case EXCEL -> excelFileParser;
            case JSON -> jsonFileParser;
        };
    }
}
