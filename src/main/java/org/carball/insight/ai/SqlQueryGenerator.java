package org.carball.insight.ai;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.config.InsightConfig;

/**
 * Asks the chat model for one read-only T-SQL query.
 */
@Slf4j
public class SqlQueryGenerator {

    private static final String SYSTEM_PROMPT =
            "You are an expert SQL assistant for a Microsoft Fabric Data Warehouse. Return only SQL.";

    private static final String SQL_PROMPT = """
        %s

        Write a correct, safe T-SQL query for the task above.
        - Use only tables and columns described in the context
        - Write a single read-only SELECT statement
        - Include proper JOINs when multiple tables are needed
        - Use TOP clause for limiting results when appropriate
        - Return ONLY the SQL query, nothing else.
        """;

    private final ChatGateway gateway;
    private final int maxTokens;

    public SqlQueryGenerator(ChatGateway gateway, InsightConfig config) {
        this.gateway = gateway;
        this.maxTokens = config.getSqlMaxTokens();
    }

    /**
     * @param purpose label of the stage asking, used for token accounting
     * @param context persona knowledge, stage instructions and the question
     * @throws LlmException when the model fails or returns no SQL
     */
    public String generate(String purpose, String context) {
        String raw = gateway.complete(new ChatRequest(purpose + "_sql", SYSTEM_PROMPT,
                String.format(SQL_PROMPT, context), maxTokens, false));

        String sql = JsonPayloads.stripCodeFences(raw);
        if (sql.regionMatches(true, 0, "sql\n", 0, 4)) {
            sql = sql.substring(4).trim();
        }
        if (sql.isBlank()) {
            throw new LlmException("Model returned no SQL for " + purpose);
        }

        log.debug("Generated {} SQL ({} chars)", purpose, sql.length());
        log.trace("Generated SQL:\n{}", sql);
        return sql;
    }
}
