package org.carball.insight.model.stage;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered record of what each stage produced for one request. Not thread-safe and never shared.
 */
public class StageContext {

    @Getter
    private final String question;

    @Getter
    private final String persona;

    private final Map<StageName, StageResult> results = new LinkedHashMap<>();

    public StageContext(String question, String persona) {
        this.question = question;
        this.persona = persona;
    }

    public void record(StageName stage, StageResult result) {
        results.put(stage, result);
    }

    public StageResult get(StageName stage) {
        return results.get(stage);
    }

    public boolean contains(StageName stage) {
        return results.containsKey(stage);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public List<Map<String, Object>> rowsOf(StageName stage) {
        StageResult result = results.get(stage);
        return result == null ? List.of() : result.rowsOrEmpty();
    }

    public CandidateSelection selection() {
        StageResult result = results.get(StageName.SELECTION);
        return result == null ? null : result.selection();
    }

    public EvaluationResult evaluation() {
        StageResult result = results.get(StageName.EVALUATION);
        return result == null ? null : result.evaluation();
    }

    /**
     * Snapshot keyed by stage key, in recording order.
     */
    public Map<String, StageResult> asMap() {
        Map<String, StageResult> snapshot = new LinkedHashMap<>();
        results.forEach((stage, result) -> snapshot.put(stage.getKey(), result));
        return Collections.unmodifiableMap(snapshot);
    }
}
