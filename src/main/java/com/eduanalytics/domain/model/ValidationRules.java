package com.eduanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Expected columns and value constraints for one job type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationRules {
    private List<String> requiredFields;
    private List<String> optionalFields;
    private Map<String, String> constraints;
}
