package org.carball.insight.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.insight.config.InsightConfig;
import org.carball.insight.model.stage.CandidateSelection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks the discovery candidates worth a focused analysis query. Never touches the store.
 */
@Slf4j
public class CandidateSelector {

    private static final Pattern IDENTIFIER_COLUMN = Pattern.compile("(?i).*(code|part|_id|^id$|品番|product).*");
    private static final int CONTEXT_CHARS = 500;

    private static final String SELECTION_PROMPT = """
        Analyze these Stage 1 results and select the most relevant items for Stage 2 detailed analysis.

        Original question: %s
        Context: %s

        Stage 1 Results:
        %s

        Provide:
        1. Brief summary of findings
        2. Select the most relevant 1-%d items for detailed Stage 2 analysis
        3. Key identifiers (IDs, part numbers, etc.) to use in Stage 2

        Return JSON format:
        {
            "summary": "brief summary of Stage 1 findings",
            "selected_items": ["item1_id", "item2_id"],
            "reasoning": "why these items were selected",
            "stage2_focus": "what Stage 2 should analyze"
        }
        """;

    private final ChatGateway gateway;
    private final DataCompressor compressor;
    private final int maxItems;
    private final int maxTokens;
    private final ObjectMapper objectMapper;

    public CandidateSelector(ChatGateway gateway, DataCompressor compressor, InsightConfig config) {
        this.gateway = gateway;
        this.compressor = compressor;
        this.maxItems = Math.max(1, config.getMaxSelectedItems());
        this.maxTokens = config.getSelectionMaxTokens();
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Selects up to the configured number of candidates. Falls back to the first rows when the model
     * cannot be used; an empty candidate list yields an empty selection.
     */
    public CandidateSelection select(String question, String personaContent, List<Map<String, Object>> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            log.info("No discovery candidates to select from");
            return CandidateSelection.empty("Discovery returned no candidates");
        }

        String context = personaContent.length() > CONTEXT_CHARS
                ? personaContent.substring(0, CONTEXT_CHARS) + "..."
                : personaContent;
        String prompt = String.format(SELECTION_PROMPT, question, context,
                compressor.compressForStage("stage1_intermediate", candidates), maxItems);

        try {
            String raw = gateway.complete(new ChatRequest("intermediate_selection",
                    "You select candidates for follow-up analysis. Return ONLY valid JSON.", prompt, maxTokens, true));
            SelectionResponse response = objectMapper.readValue(JsonPayloads.extractJsonObject(raw), SelectionResponse.class);

            List<String> items = toItems(response.getSelectedItems());
            if (items.isEmpty()) {
                log.warn("Selection response named no items, selecting automatically");
                return autoSelect(candidates, "Model selected no items");
            }

            CandidateSelection selection = new CandidateSelection(response.getSummary(),
                    items.subList(0, Math.min(maxItems, items.size())),
                    response.getReasoning(), response.getStage2Focus(), false);
            log.info("Selected {} of {} candidates: {}", selection.selectedItems().size(),
                    candidates.size(), selection.selectedItems());
            return selection;

        } catch (LlmException | JsonProcessingException e) {
            log.warn("Candidate selection failed, selecting automatically: {}", e.getMessage());
            return autoSelect(candidates, "Automatic selection due to processing error");
        }
    }

    /**
     * Takes the identifier of each of the first candidates: a code/id-like column if there is one,
     * otherwise the first non-null value.
     */
    CandidateSelection autoSelect(List<Map<String, Object>> candidates, String reason) {
        List<String> items = new ArrayList<>();
        for (Map<String, Object> row : candidates) {
            if (items.size() >= maxItems) {
                break;
            }
            String identifier = identifierOf(row);
            if (identifier != null && !items.contains(identifier)) {
                items.add(identifier);
            }
        }
        return new CandidateSelection("Found " + candidates.size() + " potential matches", items,
                reason, "detailed analysis of selected items", true);
    }

    private static String identifierOf(Map<String, Object> row) {
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getValue() != null && IDENTIFIER_COLUMN.matcher(entry.getKey()).matches()) {
                return entry.getValue().toString().trim();
            }
        }
        for (Object value : row.values()) {
            if (value != null) {
                return value.toString().trim();
            }
        }
        return null;
    }

    private static List<String> toItems(Object selected) {
        List<String> items = new ArrayList<>();
        if (selected instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !item.toString().isBlank()) {
                    items.add(item.toString().trim());
                }
            }
        } else if (selected != null) {
            for (String part : selected.toString().split(",")) {
                if (!part.isBlank()) {
                    items.add(part.trim());
                }
            }
        }
        return items;
    }
}
