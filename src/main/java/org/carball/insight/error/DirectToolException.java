package org.carball.insight.error;

public class DirectToolException extends InsightException {

    public DirectToolException(String message) {
        super(ErrorKind.DIRECT_TOOL, message);
    }

    public DirectToolException(String message, Throwable cause) {
        super(ErrorKind.DIRECT_TOOL, message, cause);
    }
}
