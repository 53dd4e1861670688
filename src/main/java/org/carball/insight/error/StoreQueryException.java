package org.carball.insight.error;

public class StoreQueryException extends InsightException {

    public StoreQueryException(String message) {
        super(ErrorKind.STORE_QUERY, message);
    }

    public StoreQueryException(String message, Throwable cause) {
        super(ErrorKind.STORE_QUERY, message, cause);
    }
}
