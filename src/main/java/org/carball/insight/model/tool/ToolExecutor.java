package org.carball.insight.model.tool;

import org.carball.insight.error.DirectToolException;
import org.carball.insight.model.classification.ClassificationRecord;

@FunctionalInterface
public interface ToolExecutor {

    ToolResult execute(String question, ClassificationRecord classification) throws DirectToolException;
}
