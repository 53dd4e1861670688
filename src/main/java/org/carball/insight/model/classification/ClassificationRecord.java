package org.carball.insight.model.classification;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured view of a question produced by the classifier. Immutable; one per question.
 *
 * <p>Entity values may be a scalar, {@code null} or an ordered list. Use
 * {@link #entityValues(String)} to read them uniformly.
 */
@Builder(toBuilder = true)
public record ClassificationRecord(
        String intent,
        String persona,
        double confidence,
        ExecutionStrategy executionStrategy,
        Map<String, Object> extractedEntities,
        boolean enableEvaluation,
        String reasoning,
        boolean defaulted
) {

    public ClassificationRecord {
        if (persona == null || persona.isBlank()) {
            throw new IllegalArgumentException("Classification persona is required");
        }
        if (executionStrategy == null) {
            throw new IllegalArgumentException("Classification execution strategy is required");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be within [0,1]: " + confidence);
        }
        intent = intent == null ? "unknown" : intent;
        extractedEntities = extractedEntities == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extractedEntities));
    }

    /**
     * Safe record used when the classifier is unavailable or returns unusable output.
     */
    public static ClassificationRecord defaultFor(String persona, String reason) {
        return ClassificationRecord.builder()
                .intent("general_inquiry")
                .persona(persona)
                .confidence(0.5)
                .executionStrategy(ExecutionStrategy.SINGLE_STAGE)
                .extractedEntities(Map.of())
                .enableEvaluation(true)
                .reasoning(reason)
                .defaulted(true)
                .build();
    }

    /**
     * Values of an entity as an ordered list of non-blank strings; empty when absent.
     */
    public List<String> entityValues(String kind) {
        Object value = extractedEntities.get(kind);
        List<String> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                addIfPresent(values, item);
            }
        } else {
            addIfPresent(values, value);
        }
        return values;
    }

    public boolean hasEntity(String kind) {
        return !entityValues(kind).isEmpty();
    }

    public boolean isPersona(String name) {
        return persona.equals(name);
    }

    private static void addIfPresent(List<String> values, Object item) {
        if (item != null && !item.toString().isBlank()) {
            values.add(item.toString().trim());
        }
    }
}
