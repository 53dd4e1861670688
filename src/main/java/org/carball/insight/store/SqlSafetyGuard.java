package org.carball.insight.store;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.carball.insight.error.StoreQueryException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Accepts only a single read-only SELECT. Generated SQL passes through here before it reaches the warehouse.
 */
@Slf4j
public class SqlSafetyGuard {

    private static final Pattern WRITE_KEYWORDS = Pattern.compile(
            "\\b(INSERT|UPDATE|DELETE|MERGE|DROP|ALTER|CREATE|TRUNCATE|EXEC|EXECUTE|GRANT|REVOKE|DENY|BACKUP|RESTORE)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SELECT_START = Pattern.compile("^\\s*(SELECT|WITH)\\b", Pattern.CASE_INSENSITIVE);

    /**
     * Checks the statement and returns the tables it reads.
     *
     * @throws StoreQueryException when the text is empty, not a SELECT, or holds several statements
     */
    public List<String> inspect(String sql) throws StoreQueryException {
        if (sql == null || sql.isBlank()) {
            throw new StoreQueryException("Empty query");
        }

        String normalized = stripTrailingSemicolon(sql.trim());

        try {
            // Remove SQL Server bracket identifiers so JSqlParser accepts them
            Statements statements = CCJSqlParserUtil.parseStatements(preprocess(normalized));
            List<Statement> parsed = statements.getStatements();
            if (parsed.size() != 1) {
                throw new StoreQueryException("Multiple statements are not allowed, found " + parsed.size());
            }
            Statement statement = parsed.get(0);
            if (!(statement instanceof Select)) {
                throw new StoreQueryException("Only SELECT queries are allowed, got "
                        + statement.getClass().getSimpleName());
            }
            List<String> tables = new TablesNamesFinder().getTableList(statement);
            log.debug("Query reads tables: {}", tables);
            return tables;

        } catch (JSQLParserException e) {
            // T-SQL constructs JSqlParser does not understand still get a keyword check
            log.debug("Could not parse query, applying keyword check: {}", e.getMessage());
            if (normalized.contains(";")) {
                throw new StoreQueryException("Multiple statements are not allowed");
            }
            if (!SELECT_START.matcher(normalized).find()) {
                throw new StoreQueryException("Only SELECT queries are allowed");
            }
            if (WRITE_KEYWORDS.matcher(normalized).find()) {
                throw new StoreQueryException("Query contains a data-modifying keyword");
            }
            log.warn("Accepting unparsed SELECT after keyword check");
            return List.of();
        }
    }

    public boolean isSafe(String sql) {
        try {
            inspect(sql);
            return true;
        } catch (StoreQueryException e) {
            log.debug("Unsafe query rejected: {}", e.getMessage());
            return false;
        }
    }

    private static String preprocess(String sql) {
        return sql.replaceAll("\\[([^]]+)]", "$1");
    }

    private static String stripTrailingSemicolon(String sql) {
        String result = sql;
        while (result.endsWith(";")) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }
}
