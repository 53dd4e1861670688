package org.carball.insight.ai;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON returned by the evaluation call.
 */
@Data
@NoArgsConstructor
public class EvaluationResponse {

    @JsonProperty("business_answer")
    private String businessAnswer;

    @JsonProperty("key_findings")
    private List<String> keyFindings = new ArrayList<>();

    @JsonProperty("recommended_action")
    private String recommendedAction;

    @JsonProperty("supporting_data")
    private SupportingData supportingData;

    @JsonProperty("data_quality")
    private String dataQuality;

    @Data
    @NoArgsConstructor
    public static class SupportingData {

        // A string or a list, depending on the model
        @JsonProperty("primary_values")
        private Object primaryValues;

        private Object alternatives;

        private String confidence;
    }
}
