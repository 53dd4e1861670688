package org.carball.insight.store;

import java.util.List;

/**
 * A read query for the warehouse with positional parameters.
 *
 * @param purpose short label used in logs and the session trace, e.g. "stage1_discovery"
 */
public record StoreQuery(String sql, List<Object> params, String purpose) {

    public StoreQuery {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("Query text is required");
        }
        params = params == null ? List.of() : List.copyOf(params);
        purpose = purpose == null ? "query" : purpose;
    }

    public static StoreQuery of(String sql, String purpose) {
        return new StoreQuery(sql, List.of(), purpose);
    }
}
