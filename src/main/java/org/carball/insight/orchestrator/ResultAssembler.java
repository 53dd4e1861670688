package org.carball.insight.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.response.ExecutionPath;
import org.carball.insight.model.response.ResponseEnvelope;
import org.carball.insight.model.stage.EvaluationResult;
import org.carball.insight.model.stage.StageContext;
import org.carball.insight.model.stage.StageName;
import org.carball.insight.model.stage.StageResult;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns whatever a path recorded into a {@link ResponseEnvelope}. The final answer comes from the
 * evaluation when there is one, otherwise from the raw rows, otherwise it says nothing was found.
 */
@Slf4j
public class ResultAssembler {

    private static final int PREVIEW_RECORDS = 3;

    public ResponseEnvelope assemble(String requestId, ClassificationRecord classification, ExecutionPath path,
                                     StageContext context, List<String> notes, boolean degraded, long startMillis) {
        if (context.isEmpty()) {
            log.warn("No stage recorded a result; adding an empty evaluation entry");
            context.record(StageName.EVALUATION,
                    StageResult.evaluation(LocalEvaluation.internalFailure(context.getQuestion(), "no stage ran")));
        }

        String finalAnswer = finalAnswer(context);
        return ResponseEnvelope.builder()
                .requestId(requestId)
                .question(context.getQuestion())
                .classification(classification)
                .executionPath(path)
                .stageResults(context.asMap())
                .finalAnswer(finalAnswer)
                .degraded(degraded)
                .notes(notes)
                .durationMs(System.currentTimeMillis() - startMillis)
                .build();
    }

    /**
     * Envelope for a request that failed unexpectedly. Keeps whatever stages already ran.
     */
    public ResponseEnvelope failure(String requestId, ClassificationRecord classification, StageContext context,
                                    List<String> notes, RuntimeException error, long startMillis) {
        ExecutionPath path = classification.executionStrategy().isDirectFirst()
                ? ExecutionPath.AI_WORKFLOW_FALLBACK
                : ExecutionPath.MULTI_STAGE;
        context.record(StageName.EVALUATION, StageResult.evaluation(
                LocalEvaluation.internalFailure(context.getQuestion(), String.valueOf(error.getMessage()))));
        return assemble(requestId, classification, path, context, notes, true, startMillis);
    }

    static String finalAnswer(StageContext context) {
        EvaluationResult evaluation = context.evaluation();
        if (evaluation != null && evaluation.hasAnswer()) {
            return formatEvaluation(evaluation);
        }

        for (StageName stage : List.of(StageName.DIRECT_TOOL, StageName.ANALYSIS,
                StageName.FALLBACK_QUERY, StageName.DISCOVERY)) {
            List<Map<String, Object>> rows = context.rowsOf(stage);
            if (!rows.isEmpty()) {
                return formatRows(context.getQuestion(), rows);
            }
        }
        return "No results found for: " + context.getQuestion();
    }

    private static String formatEvaluation(EvaluationResult evaluation) {
        StringBuilder answer = new StringBuilder();
        answer.append("**").append(evaluation.businessAnswer()).append("**\n");
        if (!evaluation.keyFindings().isEmpty()) {
            answer.append("\n**Key Findings:**\n");
            for (String finding : evaluation.keyFindings()) {
                answer.append("- ").append(finding).append('\n');
            }
        }
        if (!evaluation.recommendedAction().isBlank()) {
            answer.append("\n**Recommended Action:** ").append(evaluation.recommendedAction()).append('\n');
        }
        answer.append("\n_Confidence: ").append(evaluation.confidence().name().toLowerCase(Locale.ROOT));
        if (!evaluation.dataQualityNote().isBlank()) {
            answer.append(" | Data quality: ").append(evaluation.dataQualityNote());
        }
        answer.append('_');
        return answer.toString();
    }

    private static String formatRows(String question, List<Map<String, Object>> rows) {
        StringBuilder answer = new StringBuilder();
        answer.append("**Answer to: ").append(question).append("**\n\n");
        rows.stream().limit(PREVIEW_RECORDS).forEach(row -> answer.append("- ")
                .append(row.entrySet().stream()
                        .filter(e -> e.getValue() != null)
                        .map(e -> e.getKey() + ": " + e.getValue())
                        .collect(Collectors.joining(", ")))
                .append('\n'));
        if (rows.size() > PREVIEW_RECORDS) {
            answer.append("- ... ").append(rows.size() - PREVIEW_RECORDS).append(" more\n");
        }
        answer.append("\n**Data Summary**: Found ").append(rows.size()).append(" records");
        return answer.toString();
    }
}
