package org.carball.insight.store;

import java.util.List;
import java.util.Map;

public record QueryResult(List<Map<String, Object>> rows, int rowCount, String executedQuery) {

    public QueryResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
        if (rowCount != rows.size()) {
            throw new IllegalArgumentException(
                    "Row count " + rowCount + " does not match " + rows.size() + " rows");
        }
    }

    public static QueryResult of(List<Map<String, Object>> rows, String executedQuery) {
        List<Map<String, Object>> safeRows = rows == null ? List.of() : rows;
        return new QueryResult(safeRows, safeRows.size(), executedQuery);
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }
}
