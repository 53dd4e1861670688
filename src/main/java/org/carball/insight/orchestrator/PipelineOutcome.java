package org.carball.insight.orchestrator;

/**
 * How a path finished: whether a store failure made the answer partial, and the note explaining why.
 */
public record PipelineOutcome(boolean degraded, String note) {

    public static PipelineOutcome complete() {
        return new PipelineOutcome(false, null);
    }

    public static PipelineOutcome degraded(String note) {
        return new PipelineOutcome(true, note);
    }
}
