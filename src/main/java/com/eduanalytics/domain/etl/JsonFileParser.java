package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * JSON array of flat objects. Nested values are kept as their JSON text.
 */
@Component
@RequiredArgsConstructor
public class JsonFileParser implements TabularFileParser {

    private final ObjectMapper objectMapper;

    @Override
    public ParsedFile parse(InputStream input) {
        if (input == null) {
            throw new ValidationException("Input stream is required");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed JSON content: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new ValidationException("Unreadable JSON content: " + e.getMessage());
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            return new ParsedFile(List.of(), List.of());
        }
        if (!root.isArray()) {
            throw new ValidationException("JSON content must be an array of records");
        }

        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, String>> records = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new ValidationException("Every JSON record must be an object");
            }
            records.add(toRecord(node, columns));
        }
        return new ParsedFile(new ArrayList<>(columns), records);
    }

    /**
     * Converts inline request records (already deserialized) to the same shape as a parsed file.
     */
    public ParsedFile fromObjects(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, String>> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(toRecord(objectMapper.valueToTree(row), columns));
        }
        return new ParsedFile(new ArrayList<>(columns), records);
    }

    private Map<String, String> toRecord(JsonNode node, Set<String> columns) {
        Map<String, String> record = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String column = TabularFileParser.normalizeColumn(field.getKey());
            columns.add(column);
            record.put(column, textOf(field.getValue()));
        }
        return record;
    }

    private String textOf(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.isValueNode() ? value.asText() : value.toString();
        return text.isBlank() ? null : text.trim();
    }
}
