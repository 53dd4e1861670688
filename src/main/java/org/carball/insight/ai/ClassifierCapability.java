package org.carball.insight.ai;

import org.carball.insight.error.ClassificationException;
import org.carball.insight.model.classification.ClassificationRecord;

/**
 * Turns a question into a {@link ClassificationRecord}.
 */
public interface ClassifierCapability {

    ClassificationRecord classify(String question) throws ClassificationException;
}
