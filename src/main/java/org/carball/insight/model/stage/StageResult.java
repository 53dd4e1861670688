package org.carball.insight.model.stage;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.carball.insight.model.tool.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * Output of one stage as it appears in the response. Which fields are set depends on the stage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageResult(
        String toolName,
        String executedQuery,
        List<Map<String, Object>> rows,
        Integer rowCount,
        List<String> unmatchedInputs,
        CandidateSelection selection,
        EvaluationResult evaluation,
        String error
) {

    public static StageResult rows(String executedQuery, List<Map<String, Object>> rows) {
        return new StageResult(null, executedQuery, List.copyOf(rows), rows.size(), null, null, null, null);
    }

    public static StageResult tool(String toolName, ToolResult result) {
        List<String> unmatched = result.unmatchedInputs().isEmpty() ? null : result.unmatchedInputs();
        return new StageResult(toolName, result.executedQuery(), result.rows(), result.rowCount(),
                unmatched, null, null, null);
    }

    public static StageResult toolFailure(String toolName, String error) {
        return new StageResult(toolName, null, null, null, null, null, null, error);
    }

    public static StageResult selection(CandidateSelection selection) {
        return new StageResult(null, null, null, null, null, selection, null, null);
    }

    public static StageResult evaluation(EvaluationResult evaluation) {
        return new StageResult(null, null, null, null, null, null, evaluation, null);
    }

    public static StageResult failure(String executedQuery, String error) {
        return new StageResult(null, executedQuery, null, null, null, null, null, error);
    }

    public boolean isFailure() {
        return error != null;
    }

    public List<Map<String, Object>> rowsOrEmpty() {
        return rows == null ? List.of() : rows;
    }
}
