package org.carball.insight.model.tool;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of one dispatch attempt: a successful lookup, no applicable tool, or a failed tool.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DispatchOutcome {

    public enum Kind {
        SUCCESS,
        NO_MATCH,
        FAILED
    }

    private static final DispatchOutcome NO_MATCH = new DispatchOutcome(Kind.NO_MATCH, null, null, null);

    private final Kind kind;
    private final String toolName;
    private final ToolResult result;
    private final Exception error;

    public static DispatchOutcome success(String toolName, ToolResult result) {
        return new DispatchOutcome(Kind.SUCCESS, toolName, result, null);
    }

    public static DispatchOutcome noMatch() {
        return NO_MATCH;
    }

    public static DispatchOutcome failed(String toolName, Exception error) {
        return new DispatchOutcome(Kind.FAILED, toolName, null, error);
    }

    /**
     * True only for a successful lookup that returned at least one row.
     */
    public boolean hasRows() {
        return kind == Kind.SUCCESS && result != null && result.rowCount() > 0;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SUCCESS -> "Success(" + toolName + ", rows=" + result.rowCount() + ")";
            case NO_MATCH -> "NoMatch";
            case FAILED -> "Failed(" + toolName + ", " + error.getMessage() + ")";
        };
    }
}
