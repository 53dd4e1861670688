package org.carball.insight.model.response;

import lombok.Builder;
import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.stage.StageResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single response shape returned for every question, whichever path produced it.
 *
 * @param degraded true when a store query failed and the answer may be incomplete
 */
@Builder
public record ResponseEnvelope(
        String requestId,
        String question,
        ClassificationRecord classification,
        ExecutionPath executionPath,
        Map<String, StageResult> stageResults,
        String finalAnswer,
        boolean degraded,
        List<String> notes,
        long durationMs
) {

    public ResponseEnvelope {
        if (executionPath == null) {
            throw new IllegalArgumentException("Execution path is required");
        }
        if (stageResults == null || stageResults.isEmpty()) {
            throw new IllegalArgumentException("At least one stage result is required");
        }
        if (finalAnswer == null || finalAnswer.isBlank()) {
            throw new IllegalArgumentException("Final answer must not be blank");
        }
        stageResults = Collections.unmodifiableMap(new LinkedHashMap<>(stageResults));
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public boolean hasStage(String key) {
        return stageResults.containsKey(key);
    }
}
