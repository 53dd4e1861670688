package org.carball.insight.model.stage;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Business-level synthesis of the retrieved data.
 *
 * @param structured false when the answer was recovered from free text or built locally
 */
@Builder(toBuilder = true)
public record EvaluationResult(
        String businessAnswer,
        List<String> keyFindings,
        String recommendedAction,
        ConfidenceLabel confidence,
        String dataQualityNote,
        List<String> primaryValues,
        List<String> alternatives,
        boolean structured
) {

    public static final String UNSTRUCTURED_FALLBACK = "unstructured fallback";

    public EvaluationResult {
        businessAnswer = businessAnswer == null ? "" : businessAnswer.trim();
        keyFindings = withoutNulls(keyFindings);
        recommendedAction = recommendedAction == null ? "" : recommendedAction.trim();
        confidence = confidence == null ? ConfidenceLabel.LOW : confidence;
        dataQualityNote = dataQualityNote == null ? "" : dataQualityNote;
        primaryValues = withoutNulls(primaryValues);
        alternatives = withoutNulls(alternatives);
    }

    private static List<String> withoutNulls(List<String> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    public boolean hasAnswer() {
        return !businessAnswer.isBlank();
    }

    public EvaluationResult withLeadingFinding(String finding) {
        if (keyFindings.contains(finding)) {
            return this;
        }
        List<String> findings = new ArrayList<>();
        findings.add(finding);
        findings.addAll(keyFindings);
        return toBuilder().keyFindings(findings).build();
    }
}
