package org.carball.insight.ai;

import org.carball.insight.model.stage.EvaluationResult;
import org.carball.insight.model.stage.StageResult;

import java.util.Map;

/**
 * Synthesizes a business answer from data that has already been retrieved. Performs no store access
 * and never throws: unreadable model output is recovered locally.
 */
public interface EvaluationCapability {

    EvaluationResult evaluate(String question, String persona, Map<String, StageResult> stageOutputs);
}
