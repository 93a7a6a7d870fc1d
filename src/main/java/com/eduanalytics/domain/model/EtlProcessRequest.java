package com.eduanalytics.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Structured ETL request. Inline rows go in parameters.records; otherwise filePath is read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtlProcessRequest {

    @NotBlank
    private String jobType;

    private String filePath;

    private Map<String, Object> parameters;
}
