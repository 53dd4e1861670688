package org.carball.insight.output;

public enum OutputFormat {
    JSON,
    MARKDOWN
}
