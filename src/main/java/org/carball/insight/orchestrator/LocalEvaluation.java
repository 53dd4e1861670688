package org.carball.insight.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.ai.EvaluationCapability;
import org.carball.insight.model.stage.ConfidenceLabel;
import org.carball.insight.model.stage.EvaluationResult;
import org.carball.insight.model.stage.StageResult;

import java.util.List;
import java.util.Map;

/**
 * Evaluation entries built without the model, for requests whose data could not be retrieved.
 */
@Slf4j
final class LocalEvaluation {

    static final String NO_CANDIDATES = "No candidates were found during discovery";

    private LocalEvaluation() {
        // Utility class - prevent instantiation
    }

    static EvaluationResult storeFailure(String question, String stage, String message, int candidatesBefore) {
        String answer = "The data needed to answer \"" + question + "\" could not be retrieved ("
                + stage + " failed), so no complete answer is available.";
        List<String> findings = candidatesBefore > 0
                ? List.of("Data retrieval failed: " + message, candidatesBefore + " candidates were found before the failure")
                : List.of("Data retrieval failed: " + message);
        return EvaluationResult.builder()
                .businessAnswer(answer)
                .keyFindings(findings)
                .recommendedAction("Retry later or check warehouse connectivity")
                .confidence(ConfidenceLabel.LOW)
                .dataQualityNote("incomplete - store query failed")
                .structured(false)
                .build();
    }

    static EvaluationResult internalFailure(String question, String message) {
        return EvaluationResult.builder()
                .businessAnswer("No results found for \"" + question + "\": the request failed before an answer was produced.")
                .keyFindings(List.of("Internal error: " + message))
                .recommendedAction("Rephrase the question or try again")
                .confidence(ConfidenceLabel.LOW)
                .dataQualityNote("no data - request failed")
                .structured(false)
                .build();
    }

    /**
     * Placeholder for an evaluator that broke its contract. Has no answer, so the rows become the answer.
     */
    static EvaluationResult evaluationFailure(String message) {
        return EvaluationResult.builder()
                .businessAnswer("")
                .keyFindings(List.of("Evaluation failed: " + message))
                .confidence(ConfidenceLabel.LOW)
                .dataQualityNote("evaluation failed - raw data shown")
                .structured(false)
                .build();
    }

    static EvaluationResult guarded(EvaluationCapability evaluator, String question, String persona,
                                    Map<String, StageResult> outputs) {
        try {
            return evaluator.evaluate(question, persona, outputs);
        } catch (RuntimeException e) {
            log.error("Evaluator threw: {}", e.getMessage(), e);
            return evaluationFailure(e.getMessage());
        }
    }
}
