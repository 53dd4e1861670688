package org.carball.insight.model.classification;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw JSON shape returned by the classification model.
 */
@Data
@NoArgsConstructor
public class ClassificationResponse {

    private String intent;

    private String persona;

    private Double confidence;

    @JsonProperty("execution_strategy")
    private String executionStrategy;

    @JsonProperty("extracted_entities")
    private Map<String, Object> extractedEntities = new LinkedHashMap<>();

    @JsonProperty("enable_evaluation")
    private Boolean enableEvaluation;

    private String reasoning;

    @JsonProperty("actual_tables")
    private List<String> actualTables = new ArrayList<>();
}
