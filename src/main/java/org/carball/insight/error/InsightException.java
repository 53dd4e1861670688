package org.carball.insight.error;

/**
 * Base type for the recoverable failures raised at the external-capability seams.
 */
public abstract class InsightException extends Exception {

    private final ErrorKind kind;

    protected InsightException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected InsightException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Short form used in response notes: "StoreQueryError: connection refused".
     */
    public String describe() {
        return kind.getLabel() + ": " + getMessage();
    }
}
