package org.carball.insight.error;

public class ClassificationException extends InsightException {

    public ClassificationException(String message) {
        super(ErrorKind.CLASSIFICATION, message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(ErrorKind.CLASSIFICATION, message, cause);
    }
}
