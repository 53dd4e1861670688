package org.carball.insight.support;

import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.classification.ExecutionStrategy;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Fixtures {

    public static final String PLANNING = "product_planning";
    public static final String SALES = "spt_sales_rep";

    private Fixtures() {
        // Utility class - prevent instantiation
    }

    public static ClassificationRecord classification(String persona, ExecutionStrategy strategy) {
        return ClassificationRecord.builder()
                .intent("test_intent")
                .persona(persona)
                .confidence(0.9)
                .executionStrategy(strategy)
                .enableEvaluation(true)
                .build();
    }

    public static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    public static String classificationJson(String persona, String strategy) {
        return classificationJson(persona, strategy, "{}", true);
    }

    public static String classificationJson(String persona, String strategy, String entities, boolean evaluate) {
        return """
            {
              "intent": "test_intent",
              "persona": "%s",
              "confidence": 0.9,
              "execution_strategy": "%s",
              "extracted_entities": %s,
              "enable_evaluation": %s,
              "reasoning": "test"
            }
            """.formatted(persona, strategy, entities, evaluate);
    }

    public static String evaluationJson(String answer) {
        return """
            {
              "business_answer": "%s",
              "key_findings": ["finding one"],
              "recommended_action": "act",
              "supporting_data": {"primary_values": ["A"], "alternatives": [], "confidence": "high"},
              "data_quality": "good"
            }
            """.formatted(answer);
    }
}
