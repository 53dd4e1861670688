package org.carball.insight.model.response;

/**
 * Which branch produced the answer.
 */
public enum ExecutionPath {
    DIRECT_WITH_EVALUATION,
    DIRECT_NO_EVALUATION,
    AI_WORKFLOW_FALLBACK,
    MULTI_STAGE
}
