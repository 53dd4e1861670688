package org.carball.insight.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class InsightConfig {

    // Language model
    @JsonProperty("openai_api_key")
    private String openAiApiKey;

    @JsonProperty("openai_base_url")
    private String openAiBaseUrl;

    @Builder.Default
    private String model = "gpt-4o";

    @Builder.Default
    private double temperature = 0.0;

    @Builder.Default
    @JsonProperty("llm_timeout_seconds")
    private int llmTimeoutSeconds = 60;

    @Builder.Default
    @JsonProperty("llm_max_retries")
    private int llmMaxRetries = 2;

    // Token budgets per call type
    @Builder.Default
    @JsonProperty("classification_max_tokens")
    private int classificationMaxTokens = 500;

    @Builder.Default
    @JsonProperty("sql_max_tokens")
    private int sqlMaxTokens = 512;

    @Builder.Default
    @JsonProperty("selection_max_tokens")
    private int selectionMaxTokens = 300;

    @Builder.Default
    @JsonProperty("evaluation_max_tokens")
    private int evaluationMaxTokens = 500;

    // Warehouse
    @JsonProperty("jdbc_url")
    private String jdbcUrl;

    @Builder.Default
    @JsonProperty("query_timeout_seconds")
    private int queryTimeoutSeconds = 30;

    @Builder.Default
    @JsonProperty("login_timeout_seconds")
    private int loginTimeoutSeconds = 15;

    @Builder.Default
    @JsonProperty("max_rows")
    private int maxRows = 1000;

    // Routing and pipeline
    @Builder.Default
    @JsonProperty("default_persona")
    private String defaultPersona = "product_planning";

    @Builder.Default
    private List<String> personas = new ArrayList<>(List.of("product_planning", "spt_sales_rep"));

    @Builder.Default
    @JsonProperty("discovery_limit")
    private int discoveryLimit = 20;

    @Builder.Default
    @JsonProperty("max_selected_items")
    private int maxSelectedItems = 3;

    @Builder.Default
    @JsonProperty("compression_max_records")
    private int compressionMaxRecords = 10;

    // Direct tools
    @Builder.Default
    @JsonProperty("competitor_brands")
    private List<String> competitorBrands = new ArrayList<>(List.of("Hogy"));

    @Builder.Default
    @JsonProperty("competitor_mapping_table")
    private String competitorMappingTable = "JPNMRSdb_SPT_SALES_DRAPE_MAPPING";

    @Builder.Default
    @JsonProperty("part_master_table")
    private String partMasterTable = "JPNPROdb_pt_mstr";

    @Builder.Default
    @JsonProperty("product_structure_table")
    private String productStructureTable = "JPNPROdb_ps_mstr";

    @Builder.Default
    @JsonProperty("direct_tool_row_limit")
    private int directToolRowLimit = 50;

    public static InsightConfig defaults() {
        return InsightConfig.builder().build();
    }

    public boolean isAiConfigured() {
        return openAiApiKey != null && !openAiApiKey.isBlank();
    }

    public boolean isWarehouseConfigured() {
        return jdbcUrl != null && !jdbcUrl.isBlank();
    }

    /**
     * Validates the configuration and logs warnings for values that will misbehave at runtime.
     *
     * @throws IllegalArgumentException when no default persona is set
     */
    public void validate() {
        if (!isAiConfigured() && !"true".equals(System.getProperty("skip.ai"))) {
            log.warn("No OpenAI API key configured; classification and evaluation will fall back to defaults");
        }

        if (!isWarehouseConfigured()) {
            log.warn("No JDBC URL configured; every store query will fail");
        }

        if (defaultPersona == null || defaultPersona.isBlank()) {
            throw new IllegalArgumentException("Default persona must not be blank");
        }

        if (personas == null || personas.isEmpty()) {
            log.warn("No personas configured; every question will use the default persona");
        } else if (!personas.contains(defaultPersona)) {
            log.warn("Default persona '{}' is not among the configured personas {}", defaultPersona, personas);
        }

        if (discoveryLimit <= 0) {
            log.warn("Discovery limit ({}) should be positive", discoveryLimit);
        }

        if (maxSelectedItems <= 0) {
            log.warn("Max selected items ({}) should be positive", maxSelectedItems);
        }

        if (maxSelectedItems > discoveryLimit) {
            log.warn("Max selected items ({}) exceeds discovery limit ({})", maxSelectedItems, discoveryLimit);
        }

        if (queryTimeoutSeconds <= 0 || llmTimeoutSeconds <= 0) {
            log.warn("Timeouts should be positive (query: {}s, llm: {}s); blocking calls may hang",
                    queryTimeoutSeconds, llmTimeoutSeconds);
        }

        if (temperature < 0.0 || temperature > 2.0) {
            log.warn("Temperature ({}) is outside the supported range 0.0-2.0", temperature);
        }

        log.debug("Using model {} with token budgets classify={}, sql={}, select={}, evaluate={}",
                model, classificationMaxTokens, sqlMaxTokens, selectionMaxTokens, evaluationMaxTokens);
    }

    /**
     * Returns a description of the current configuration for user feedback. The API key is never shown.
     */
    public String getConfigurationSummary() {
        return String.format("Model: %s | AI: %s | Warehouse: %s | Default persona: %s | Discovery limit: %d | Selected items: %d",
                model,
                isAiConfigured() ? "configured" : "not configured",
                isWarehouseConfigured() ? "configured" : "not configured",
                defaultPersona, discoveryLimit, maxSelectedItems);
    }
}
