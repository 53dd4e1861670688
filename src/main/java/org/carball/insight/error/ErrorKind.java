package org.carball.insight.error;

/**
 * Failure categories recognised by the orchestrator. Every one of them is recovered locally;
 * only {@link #STORE_QUERY} marks the resulting answer as degraded.
 */
public enum ErrorKind {
    CLASSIFICATION("ClassificationError"),
    DIRECT_TOOL("DirectToolError"),
    STORE_QUERY("StoreQueryError"),
    EVALUATION_PARSE("EvaluationParseError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
