package org.carball.insight.tools.direct;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.error.DirectToolException;
import org.carball.insight.error.StoreQueryException;
import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.tool.ToolDescriptor;
import org.carball.insight.model.tool.ToolResult;
import org.carball.insight.store.QueryResult;
import org.carball.insight.store.StoreQuery;
import org.carball.insight.store.StoreQueryCapability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Base for direct tools that look rows up by an exact list of keys with one IN query.
 */
@Slf4j
public abstract class KeyedLookupTool {

    protected final StoreQueryCapability store;
    protected final ProductKeyExtractor extractor;
    protected final int rowLimit;

    protected KeyedLookupTool(StoreQueryCapability store, ProductKeyExtractor extractor, int rowLimit) {
        this.store = store;
        this.extractor = extractor;
        this.rowLimit = rowLimit;
    }

    public abstract String name();

    public abstract String description();

    public abstract List<String> exampleTriggers();

    /**
     * Cheap check on the question text and extracted entities. No I/O.
     */
    public abstract boolean applies(String question, ClassificationRecord classification);

    /**
     * Keys to look up, in the order they were mentioned.
     */
    protected abstract List<String> lookupKeys(String question, ClassificationRecord classification);

    /**
     * SELECT whose WHERE clause contains the given {@code IN (...)} placeholder list.
     */
    protected abstract String buildSql(String placeholders);

    /**
     * Column of the result that holds the key a row matched.
     */
    protected abstract String keyColumn();

    public ToolDescriptor descriptor() {
        return new ToolDescriptor(name(), this::applies, this::execute, description(), exampleTriggers());
    }

    public ToolResult execute(String question, ClassificationRecord classification) throws DirectToolException {
        List<String> keys = lookupKeys(question, classification);
        if (keys.isEmpty()) {
            throw new DirectToolException("No lookup keys found in question for " + name());
        }

        String sql = buildSql(String.join(", ", Collections.nCopies(keys.size(), "?")));
        List<Object> params = new ArrayList<>();
        for (String key : keys) {
            params.add(key.toUpperCase(Locale.ROOT));
        }

        QueryResult result;
        try {
            result = store.query(new StoreQuery(sql, params, name()));
        } catch (StoreQueryException e) {
            throw new DirectToolException(name() + " lookup failed: " + e.getMessage(), e);
        }

        Set<String> found = new HashSet<>();
        for (Map<String, Object> row : result.rows()) {
            Object value = row.get(keyColumn());
            if (value != null) {
                found.add(value.toString().trim().toUpperCase(Locale.ROOT));
            }
        }
        Set<String> matched = new LinkedHashSet<>();
        for (String key : keys) {
            if (found.contains(key.toUpperCase(Locale.ROOT))) {
                matched.add(key);
            }
        }

        log.debug("{} matched {} of {} keys", name(), matched.size(), keys.size());
        return ToolResult.forKeys(result.rows(), result.executedQuery(), keys, matched);
    }

    protected static boolean mentions(Pattern keywords, String question) {
        return question != null && keywords.matcher(question).find();
    }

    protected static List<String> distinct(List<String> first, List<String> second) {
        Set<String> keys = new LinkedHashSet<>(first);
        keys.addAll(second);
        return new ArrayList<>(keys);
    }
}
