package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.ValidationException;
import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * First sheet of an .xlsx/.xls workbook; the first non-empty row is the header.
 */
@Component
public class ExcelFileParser implements TabularFileParser {

    @Override
    public ParsedFile parse(InputStream input) {
        if (input == null) {
            throw new ValidationException("Input stream is required");
        }

        try (Workbook workbook = WorkbookFactory.create(input)) {
            if (workbook.getNumberOfSheets() == 0) {
                return new ParsedFile(List.of(), List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();

            int headerIndex = sheet.getFirstRowNum();
            while (headerIndex <= sheet.getLastRowNum() && isRowEmpty(sheet.getRow(headerIndex), formatter)) {
                headerIndex++;
            }
            if (headerIndex > sheet.getLastRowNum()) {
                return new ParsedFile(List.of(), List.of());
            }

            Map<Integer, String> headers = mapHeaders(sheet.getRow(headerIndex), formatter);
            List<Map<String, String>> records = new ArrayList<>();
            for (int rowIdx = headerIndex + 1; rowIdx <= sheet.getLastRowNum(); rowIdx++) {
                Row row = sheet.getRow(rowIdx);
                if (isRowEmpty(row, formatter)) {
                    continue;
                }
                Map<String, String> record = new LinkedHashMap<>();
                headers.forEach((idx, column) -> record.put(column, readCell(row.getCell(idx), formatter)));
                records.add(record);
            }
            return new ParsedFile(new ArrayList<>(headers.values()), records);
        } catch (ValidationException e) {
            throw e;
        } catch (Exception e) {
            throw new ValidationException("Malformed Excel content: " + e.getMessage());
        }
    }

    private Map<Integer, String> mapHeaders(Row headerRow, DataFormatter formatter) {
        Map<Integer, String> headers = new TreeMap<>();
        short lastCell = headerRow.getLastCellNum();
        for (int i = 0; i < lastCell; i++) {
            Cell cell = headerRow.getCell(i);
            if (cell == null) {
                continue;
            }
            String value = formatter.formatCellValue(cell);
            if (value != null && !value.isBlank()) {
                headers.put(i, TabularFileParser.normalizeColumn(value));
            }
        }
        return headers;
    }

    // Date cells come out as ISO dates regardless of the cell's display format
    private String readCell(Cell cell, DataFormatter formatter) {
        if (cell == null) {
            return null;
        }
        if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        String value = formatter.formatCellValue(cell);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isBlank() ? null : trimmed;
    }

    private boolean isRowEmpty(Row row, DataFormatter formatter) {
        if (row == null) {
            return true;
        }
        short firstCell = row.getFirstCellNum();
        short lastCell = row.getLastCellNum();
        if (firstCell < 0 || lastCell < 0) {
            return true;
        }
        for (int i = firstCell; i < lastCell; i++) {
            Cell cell = row.getCell(i);
            if (cell == null) {
                continue;
            }
            String value = formatter.formatCellValue(cell);
            if (value != null && !value.trim().isBlank()) {
                return false;
            }
        }
        return true;
    }
}
