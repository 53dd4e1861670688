package org.carball.insight.error;

public class EvaluationParseException extends InsightException {

    public EvaluationParseException(String message) {
        super(ErrorKind.EVALUATION_PARSE, message);
    }

    public EvaluationParseException(String message, Throwable cause) {
        super(ErrorKind.EVALUATION_PARSE, message, cause);
    }
}
