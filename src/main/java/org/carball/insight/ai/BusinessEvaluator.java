package org.carball.insight.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.insight.config.InsightConfig;
import org.carball.insight.error.EvaluationParseException;
import org.carball.insight.model.stage.CandidateSelection;
import org.carball.insight.model.stage.ConfidenceLabel;
import org.carball.insight.model.stage.EvaluationResult;
import org.carball.insight.model.stage.StageName;
import org.carball.insight.model.stage.StageResult;
import org.carball.insight.persona.PersonaCatalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluation step backed by the chat model.
 *
 * <p>Model output is read in two tiers: a strict JSON parse, then, if that fails, regex extraction
 * of the scalar fields. Results of the second tier are marked {@code "unstructured fallback"} and
 * carry a lowered confidence.
 */
@Slf4j
public class BusinessEvaluator implements EvaluationCapability {

    private static final String SYSTEM_PROMPT =
            "You are a business analyst. Analyze data and provide insights. DO NOT generate SQL queries.";

    private static final Pattern ANSWER = Pattern.compile("\"business_answer\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern ACTION = Pattern.compile("\"recommended_action\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern FINDINGS = Pattern.compile("\"key_findings\"\\s*:\\s*\\[(.*?)]", Pattern.DOTALL);
    private static final Pattern QUOTED = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern CONFIDENCE = Pattern.compile("\"confidence\"\\s*:\\s*\"(high|medium|low)\"",
            Pattern.CASE_INSENSITIVE);
    private static final int MAX_RECOVERED_FINDINGS = 5;
    private static final int MAX_RECOVERED_ANSWER = 500;

    private final ChatGateway gateway;
    private final PersonaCatalog personaCatalog;
    private final DataCompressor compressor;
    private final int maxTokens;
    private final ObjectMapper objectMapper;

    public BusinessEvaluator(ChatGateway gateway, PersonaCatalog personaCatalog, DataCompressor compressor,
                             InsightConfig config) {
        this.gateway = gateway;
        this.personaCatalog = personaCatalog;
        this.compressor = compressor;
        this.maxTokens = config.getEvaluationMaxTokens();
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public EvaluationResult evaluate(String question, String persona, Map<String, StageResult> stageOutputs) {
        List<Map<String, Object>> finalData = finalData(stageOutputs);
        String prompt = PersonaCatalog.render(personaCatalog.template(StageName.EVALUATION), Map.of(
                "persona_context", personaCatalog.content(persona),
                "question", question,
                "stage_summary", summarizeStages(stageOutputs),
                "data_sample", compressor.compressForStage(StageName.EVALUATION.getKey(), finalData)));

        String raw;
        try {
            raw = gateway.complete(new ChatRequest(StageName.EVALUATION.getKey(), SYSTEM_PROMPT, prompt, maxTokens, true));
        } catch (LlmException e) {
            log.warn("Evaluation unavailable, summarising raw data instead: {}", e.getMessage());
            return localSummary(question, finalData, e.getMessage());
        }
        return parse(raw);
    }

    /**
     * Strict parse first; free-text recovery only when it fails.
     */
    EvaluationResult parse(String raw) {
        try {
            return parseStructured(raw);
        } catch (EvaluationParseException e) {
            log.warn("{} - recovering answer from unstructured text", e.describe());
            return recoverUnstructured(raw);
        }
    }

    EvaluationResult parseStructured(String raw) throws EvaluationParseException {
        EvaluationResponse response;
        try {
            response = objectMapper.readValue(JsonPayloads.extractJsonObject(raw), EvaluationResponse.class);
        } catch (JsonProcessingException e) {
            throw new EvaluationParseException("Evaluation response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (response.getBusinessAnswer() == null || response.getBusinessAnswer().isBlank()) {
            throw new EvaluationParseException("Evaluation response has no business_answer");
        }

        EvaluationResponse.SupportingData supporting = response.getSupportingData();
        return EvaluationResult.builder()
                .businessAnswer(response.getBusinessAnswer())
                .keyFindings(asList(response.getKeyFindings()))
                .recommendedAction(response.getRecommendedAction())
                .confidence(ConfidenceLabel.fromString(supporting != null ? supporting.getConfidence() : null))
                .dataQualityNote(response.getDataQuality())
                .primaryValues(supporting != null ? asList(supporting.getPrimaryValues()) : List.of())
                .alternatives(supporting != null ? asList(supporting.getAlternatives()) : List.of())
                .structured(true)
                .build();
    }

    EvaluationResult recoverUnstructured(String raw) {
        String text = raw == null ? "" : JsonPayloads.stripCodeFences(raw);

        String answer = firstGroup(ANSWER, text);
        if (answer == null) {
            answer = firstProseLine(text);
        }
        if (answer == null || answer.isBlank()) {
            answer = "Analysis completed but the evaluation could not be read";
        }

        List<String> findings = new ArrayList<>();
        Matcher findingsMatcher = FINDINGS.matcher(text);
        if (findingsMatcher.find()) {
            Matcher quoted = QUOTED.matcher(findingsMatcher.group(1));
            while (quoted.find() && findings.size() < MAX_RECOVERED_FINDINGS) {
                findings.add(unescape(quoted.group(1)));
            }
        }

        String confidence = firstGroup(CONFIDENCE, text);
        ConfidenceLabel label = confidence != null ? ConfidenceLabel.fromString(confidence).lower() : ConfidenceLabel.LOW;

        String action = firstGroup(ACTION, text);
        return EvaluationResult.builder()
                .businessAnswer(truncate(unescape(answer)))
                .keyFindings(findings)
                .recommendedAction(action != null ? unescape(action) : "Review the retrieved data before acting")
                .confidence(label)
                .dataQualityNote(EvaluationResult.UNSTRUCTURED_FALLBACK)
                .structured(false)
                .build();
    }

    /**
     * Answer built from the rows alone when the model cannot be reached.
     */
    EvaluationResult localSummary(String question, List<Map<String, Object>> finalData, String reason) {
        String answer = finalData.isEmpty()
                ? "No results found for: " + question
                : "Found " + finalData.size() + " records for: " + question + ". " + compressor.compress(finalData);
        return EvaluationResult.builder()
                .businessAnswer(answer)
                .keyFindings(List.of("Automated evaluation unavailable: " + reason))
                .recommendedAction("Review the retrieved records manually")
                .confidence(ConfidenceLabel.LOW)
                .dataQualityNote("evaluation unavailable - summary built from raw data")
                .structured(false)
                .build();
    }

    /**
     * The most specific rows available: analysis, then direct tool, then fallback query, then discovery.
     */
    static List<Map<String, Object>> finalData(Map<String, StageResult> stageOutputs) {
        for (StageName stage : List.of(StageName.ANALYSIS, StageName.DIRECT_TOOL,
                StageName.FALLBACK_QUERY, StageName.DISCOVERY)) {
            StageResult result = stageOutputs.get(stage.getKey());
            if (result != null && !result.rowsOrEmpty().isEmpty()) {
                return result.rowsOrEmpty();
            }
        }
        return List.of();
    }

    static String summarizeStages(Map<String, StageResult> stageOutputs) {
        StringBuilder summary = new StringBuilder();
        stageOutputs.forEach((stage, result) -> {
            summary.append("- ").append(stage).append(": ");
            if (result.isFailure()) {
                summary.append("failed (").append(result.error()).append(')');
            } else if (result.selection() != null) {
                CandidateSelection selection = result.selection();
                summary.append(selection.isEmpty() ? "no items selected" : "selected " + selection.selectedItems())
                        .append(". ").append(selection.reasoning());
            } else if (result.rowCount() != null) {
                summary.append(result.rowCount()).append(" records retrieved");
                if (result.unmatchedInputs() != null) {
                    summary.append(", not found: ").append(result.unmatchedInputs());
                }
            }
            summary.append('\n');
        });
        return summary.toString();
    }

    private static List<String> asList(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            collection.stream().filter(v -> v != null).forEach(v -> values.add(v.toString()));
        } else if (value != null && !value.toString().isBlank()) {
            values.add(value.toString());
        }
        return values;
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String firstProseLine(String text) {
        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("{") && !trimmed.startsWith("}") && !trimmed.startsWith("\"")) {
                return trimmed;
            }
        }
        return null;
    }

    private static String unescape(String value) {
        return value.replace("\\\"", "\"").replace("\\n", " ");
    }

    private static String truncate(String value) {
        return value.length() > MAX_RECOVERED_ANSWER ? value.substring(0, MAX_RECOVERED_ANSWER) + "..." : value;
    }
}
