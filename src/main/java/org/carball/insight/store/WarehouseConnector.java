package org.carball.insight.store;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.config.InsightConfig;
import org.carball.insight.error.StoreQueryException;
import org.carball.insight.session.SessionTrace;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs read queries against the SQL Server / Fabric warehouse over JDBC.
 */
@Slf4j
public class WarehouseConnector implements StoreQueryCapability {

    private final String connectionString;
    private final int queryTimeoutSeconds;
    private final int maxRows;

    public WarehouseConnector(String connectionString, int queryTimeoutSeconds, int loginTimeoutSeconds, int maxRows) {
        this.connectionString = connectionString;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.maxRows = maxRows;
        DriverManager.setLoginTimeout(loginTimeoutSeconds);
    }

    public WarehouseConnector(InsightConfig config) {
        this(config.getJdbcUrl(), config.getQueryTimeoutSeconds(), config.getLoginTimeoutSeconds(), config.getMaxRows());
    }

    @Override
    public QueryResult query(StoreQuery query) throws StoreQueryException {
        if (connectionString == null || connectionString.isBlank()) {
            throw new StoreQueryException("No warehouse connection configured");
        }

        long start = System.currentTimeMillis();
        log.debug("Executing {} query with {} parameters", query.purpose(), query.params().size());
        log.trace("SQL:\n{}", query.sql());

        try (Connection conn = DriverManager.getConnection(connectionString);
             PreparedStatement stmt = conn.prepareStatement(query.sql())) {

            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setMaxRows(maxRows);
            for (int i = 0; i < query.params().size(); i++) {
                stmt.setObject(i + 1, query.params().get(i));
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                int columns = meta.getColumnCount();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int c = 1; c <= columns; c++) {
                        row.put(meta.getColumnLabel(c), rs.getObject(c));
                    }
                    rows.add(row);
                }
            }

            long elapsed = System.currentTimeMillis() - start;
            log.info("{} query returned {} rows in {}ms", query.purpose(), rows.size(), elapsed);
            SessionTrace.current().ifPresent(t -> t.sqlExecution(query.purpose(), query.sql(), elapsed, rows.size()));
            return QueryResult.of(rows, query.sql());

        } catch (SQLTimeoutException e) {
            log.warn("{} query timed out after {}s", query.purpose(), queryTimeoutSeconds);
            throw new StoreQueryException("Query timed out after " + queryTimeoutSeconds + "s", e);
        } catch (SQLException e) {
            log.warn("{} query failed: {}", query.purpose(), e.getMessage());
            throw new StoreQueryException("Query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Tests the connection with a trivial query.
     */
    public boolean testConnection() {
        try {
            query(StoreQuery.of("SELECT 1 AS ok", "connection_test"));
            return true;
        } catch (StoreQueryException e) {
            log.warn("Warehouse connection test failed: {}", e.getMessage());
            return false;
        }
    }
}
