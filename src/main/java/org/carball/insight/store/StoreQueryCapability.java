package org.carball.insight.store;

import org.carball.insight.error.StoreQueryException;

/**
 * Executes read queries against the backing data store. Implementations must bound every call
 * with a timeout and report timeouts as {@link StoreQueryException}.
 */
public interface StoreQueryCapability {

    QueryResult query(StoreQuery query) throws StoreQueryException;
}
