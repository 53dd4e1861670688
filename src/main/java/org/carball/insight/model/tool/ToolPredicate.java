package org.carball.insight.model.tool;

import org.carball.insight.model.classification.ClassificationRecord;

/**
 * Decides whether a direct tool applies. Must be side-effect free and perform no I/O.
 */
@FunctionalInterface
public interface ToolPredicate {

    boolean test(String question, ClassificationRecord classification);
}
