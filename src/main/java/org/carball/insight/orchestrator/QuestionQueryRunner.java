package org.carball.insight.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.ai.LlmException;
import org.carball.insight.ai.SqlQueryGenerator;
import org.carball.insight.error.StoreQueryException;
import org.carball.insight.store.QueryResult;
import org.carball.insight.store.SqlSafetyGuard;
import org.carball.insight.store.StoreQuery;
import org.carball.insight.store.StoreQueryCapability;

import java.util.List;

/**
 * Generates one query from a prompt, checks it is a plain SELECT, and runs it. Every failure,
 * including a model that produced no usable SQL, is reported as a {@link StoreQueryException}.
 */
@Slf4j
public class QuestionQueryRunner {

    private final SqlQueryGenerator generator;
    private final SqlSafetyGuard guard;
    private final StoreQueryCapability store;

    public QuestionQueryRunner(SqlQueryGenerator generator, SqlSafetyGuard guard, StoreQueryCapability store) {
        this.generator = generator;
        this.guard = guard;
        this.store = store;
    }

    public QueryResult run(String purpose, String context) throws StoreQueryException {
        String sql;
        try {
            sql = generator.generate(purpose, context);
        } catch (LlmException e) {
            throw new StoreQueryException("Could not generate a query: " + e.getMessage(), e);
        }

        List<String> tables = guard.inspect(sql);
        log.debug("{} query reads {}", purpose, tables);
        return store.query(StoreQuery.of(sql, purpose));
    }
}
