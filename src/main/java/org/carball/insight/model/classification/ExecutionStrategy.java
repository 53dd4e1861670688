package org.carball.insight.model.classification;

import java.util.Locale;

public enum ExecutionStrategy {
    SINGLE_STAGE("single_stage"),
    MULTI_STAGE("multi_stage"),
    /** No refinement loop exists; routed exactly like {@link #SINGLE_STAGE}. */
    ITERATIVE("iterative");

    private final String value;

    ExecutionStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isDirectFirst() {
        return this != MULTI_STAGE;
    }

    /**
     * Accepts "multi_stage", "MultiStage", "multi-stage" and similar spellings.
     */
    public static ExecutionStrategy fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Execution strategy is missing");
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toLowerCase(Locale.ROOT);
        for (ExecutionStrategy strategy : values()) {
            if (strategy.value.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown execution strategy: " + value);
    }
}
