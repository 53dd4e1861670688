package org.carball.insight.ai;

/**
 * A chat model call could not be completed: disabled, unreachable, timed out or returned nothing.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
