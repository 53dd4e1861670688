package org.carball.insight.model.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tabular output of a direct tool. {@code matchedInputs} and {@code unmatchedInputs} partition
 * the lookup keys the tool was asked for.
 */
public record ToolResult(
        List<Map<String, Object>> rows,
        int rowCount,
        String executedQuery,
        List<String> matchedInputs,
        List<String> unmatchedInputs
) {

    public ToolResult {
        rows = copyRows(rows);
        if (rowCount != rows.size()) {
            throw new IllegalArgumentException(
                    "Row count " + rowCount + " does not match " + rows.size() + " rows");
        }
        matchedInputs = matchedInputs == null ? List.of() : List.copyOf(matchedInputs);
        unmatchedInputs = unmatchedInputs == null ? List.of() : List.copyOf(unmatchedInputs);
        Set<String> overlap = new LinkedHashSet<>(matchedInputs);
        overlap.retainAll(unmatchedInputs);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Inputs both matched and unmatched: " + overlap);
        }
    }

    public static ToolResult of(List<Map<String, Object>> rows, String executedQuery) {
        List<Map<String, Object>> safeRows = rows == null ? List.of() : rows;
        return new ToolResult(safeRows, safeRows.size(), executedQuery, List.of(), List.of());
    }

    /**
     * Builds a result whose unmatched inputs are the requested keys not present in {@code matched}.
     */
    public static ToolResult forKeys(List<Map<String, Object>> rows, String executedQuery,
                                     List<String> requestedKeys, Set<String> matched) {
        List<String> matchedKeys = new ArrayList<>();
        List<String> unmatchedKeys = new ArrayList<>();
        for (String key : new LinkedHashSet<>(requestedKeys)) {
            if (matched.contains(key)) {
                matchedKeys.add(key);
            } else {
                unmatchedKeys.add(key);
            }
        }
        return new ToolResult(rows, rows.size(), executedQuery, matchedKeys, unmatchedKeys);
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public Set<String> requestedInputs() {
        Set<String> all = new LinkedHashSet<>(matchedInputs);
        all.addAll(unmatchedInputs);
        return all;
    }

    private static List<Map<String, Object>> copyRows(List<Map<String, Object>> rows) {
        if (rows == null) {
            return List.of();
        }
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return Collections.unmodifiableList(copy);
    }
}
