package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.UnsupportedFileTypeException;

import java.util.Locale;

/**
 * Supported upload formats, detected from the file name extension.
 */
public enum FileType {
    CSV("csv", "txt"),
    EXCEL("xlsx", "xls"),
    JSON("json");

    private final String[] extensions;

    FileType(String... extensions) {
        this.extensions = extensions;
    }

    /**
     * @throws UnsupportedFileTypeException for a missing or unknown extension
     */
    public static FileType fromFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new UnsupportedFileTypeException("File name is required to detect its type");
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            throw new UnsupportedFileTypeException("File has no extension: " + filename);
        }
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (FileType type : values()) {
            for (String candidate : type.extensions) {
                if (candidate.equals(extension)) {
                    return type;
                }
            }
        }
        throw new UnsupportedFileTypeException("Unsupported file type: ." + extension);
    }

    /**
     * Explicit type override ("csv", "excel", "json").
     */
    public static FileType fromToken(String token) {
        for (FileType type : values()) {
            if (type.name().equalsIgnoreCase(token.trim())) {
                return type;
            }
        }
        throw new UnsupportedFileTypeException("Unsupported file type: " + token);
    }
}
