package com.eduanalytics.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryPlanAnalysis {
    private String query;
    private double executionTime;
    private double planningTime;
    private double totalCost;
    private JsonNode plan;
}
