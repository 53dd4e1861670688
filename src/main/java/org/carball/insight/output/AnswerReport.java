package org.carball.insight.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.response.ResponseEnvelope;
import org.carball.insight.model.stage.StageResult;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link ResponseEnvelope} as JSON or Markdown.
 */
@Slf4j
public class AnswerReport {

    private final ResponseEnvelope envelope;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public AnswerReport(ResponseEnvelope envelope) {
        this(envelope, LocalDateTime.now());
    }

    AnswerReport(ResponseEnvelope envelope, LocalDateTime timestamp) {
        this.envelope = envelope;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(new ReportData(timestamp, envelope));
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        ClassificationRecord classification = envelope.classification();

        // Header
        md.append("# Insight Answer\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Request:** ").append(envelope.requestId()).append("  \n");
        md.append("**Question:** ").append(envelope.question()).append("  \n\n");

        // Answer
        md.append("## Answer\n\n");
        if (envelope.degraded()) {
            md.append("> ⚠️ A data query failed; this answer may be incomplete.\n\n");
        }
        md.append(envelope.finalAnswer()).append("\n\n");

        // Routing
        md.append("## Routing\n\n");
        md.append("| Field | Value |\n");
        md.append("|-------|-------|\n");
        md.append("| Execution Path | ").append(envelope.executionPath()).append(" |\n");
        if (classification != null) {
            md.append("| Persona | ").append(classification.persona()).append(" |\n");
            md.append("| Intent | ").append(classification.intent()).append(" |\n");
            md.append("| Strategy | ").append(classification.executionStrategy().getValue()).append(" |\n");
            md.append("| Confidence | ").append(String.format("%.2f", classification.confidence())).append(" |\n");
            if (classification.defaulted()) {
                md.append("| Classification | default (classifier unavailable) |\n");
            }
        }
        md.append("| Duration | ").append(envelope.durationMs()).append(" ms |\n\n");

        // Stages
        md.append("## Stages\n\n");
        md.append("| Stage | Tool | Rows | Status |\n");
        md.append("|-------|------|------|--------|\n");
        for (Map.Entry<String, StageResult> entry : envelope.stageResults().entrySet()) {
            StageResult stage = entry.getValue();
            md.append("| ").append(entry.getKey())
                    .append(" | ").append(stage.toolName() != null ? stage.toolName() : "-")
                    .append(" | ").append(stage.rowCount() != null ? stage.rowCount() : "-")
                    .append(" | ").append(status(stage))
                    .append(" |\n");
        }
        md.append("\n");

        for (Map.Entry<String, StageResult> entry : envelope.stageResults().entrySet()) {
            String query = entry.getValue().executedQuery();
            if (query != null && !query.isBlank()) {
                md.append("### ").append(entry.getKey()).append(" query\n\n");
                md.append("```sql\n").append(query.trim()).append("\n```\n\n");
            }
        }

        // Notes
        if (!envelope.notes().isEmpty()) {
            md.append("## Notes\n\n");
            envelope.notes().forEach(note -> md.append("- ").append(note).append("\n"));
            md.append("\n");
        }

        return md.toString();
    }

    private static String status(StageResult stage) {
        if (stage.isFailure()) {
            return "❌ " + stage.error();
        }
        if (stage.evaluation() != null) {
            return "evaluated (" + stage.evaluation().confidence().name().toLowerCase(Locale.ROOT) + ")";
        }
        if (stage.selection() != null) {
            return stage.selection().isEmpty() ? "nothing selected" : String.join(", ", stage.selection().selectedItems());
        }
        return "✓";
    }

    record ReportData(
            @JsonProperty("generated_at") LocalDateTime generatedAt,
            @JsonProperty("response") ResponseEnvelope response
    ) {
    }
}
