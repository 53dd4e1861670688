package org.carball.insight.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        InsightConfig config = new ConfigurationLoader(Map.of()).loadConfiguration(new String[0]);

        // Then
        assertThat(config.getModel()).isEqualTo("gpt-4o");
        assertThat(config.getDefaultPersona()).isEqualTo("product_planning");
        assertThat(config.getPersonas()).containsExactly("product_planning", "spt_sales_rep");
        assertThat(config.getDiscoveryLimit()).isEqualTo(20);
        assertThat(config.getMaxSelectedItems()).isEqualTo(3);
        assertThat(config.getCompetitorBrands()).containsExactly("Hogy");
        assertThat(config.isAiConfigured()).isFalse();
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        Map<String, String> env = Map.of(
                "OPENAI_API_KEY", "sk-test",
                "INSIGHT_JDBC_URL", "jdbc:sqlserver://warehouse",
                "INSIGHT_PERSONAS", "spt_sales_rep, product_planning",
                "INSIGHT_DISCOVERY_LIMIT", "50");

        // When
        InsightConfig config = new ConfigurationLoader(env).loadConfiguration(new String[0]);

        // Then
        assertThat(config.isAiConfigured()).isTrue();
        assertThat(config.isWarehouseConfigured()).isTrue();
        assertThat(config.getPersonas()).containsExactly("spt_sales_rep", "product_planning");
        assertThat(config.getDiscoveryLimit()).isEqualTo(50);
    }

    @Test
    void shouldPreferCliArgumentsOverEnvironment() {
        // Given
        Map<String, String> env = Map.of("INSIGHT_MODEL", "gpt-4o-mini", "INSIGHT_MAX_ROWS", "10");
        String[] args = {"--insight.model", "gpt-4.1", "--insight.discovery-limit", "5"};

        // When
        InsightConfig config = new ConfigurationLoader(env).loadConfiguration(args);

        // Then
        assertThat(config.getModel()).isEqualTo("gpt-4.1");
        assertThat(config.getDiscoveryLimit()).isEqualTo(5);
        assertThat(config.getMaxRows()).isEqualTo(10);
    }

    @Test
    void shouldIgnoreInvalidNumbers() {
        // Given
        String[] args = {"--insight.max-selected", "many"};

        // When
        InsightConfig config = new ConfigurationLoader(Map.of("INSIGHT_QUERY_TIMEOUT_SECONDS", "soon"))
                .loadConfiguration(args);

        // Then
        assertThat(config.getMaxSelectedItems()).isEqualTo(3);
        assertThat(config.getQueryTimeoutSeconds()).isEqualTo(30);
    }

    @Test
    void shouldLoadYamlFileBelowEnvironment() throws IOException {
        // Given
        Path file = tempDir.resolve("insight.yml");
        Files.writeString(file, """
            model: gpt-4o-mini
            default_persona: spt_sales_rep
            discovery_limit: 15
            competitor_brands:
              - Hogy
              - Acme
            unknown_key: ignored
            """);

        // When
        InsightConfig config = new ConfigurationLoader(Map.of("INSIGHT_MODEL", "gpt-4o"))
                .loadConfiguration(file, new String[0]);

        // Then
        assertThat(config.getModel()).isEqualTo("gpt-4o");
        assertThat(config.getDefaultPersona()).isEqualTo("spt_sales_rep");
        assertThat(config.getDiscoveryLimit()).isEqualTo(15);
        assertThat(config.getCompetitorBrands()).containsExactly("Hogy", "Acme");
        assertThat(config.getMaxSelectedItems()).isEqualTo(3);
    }

    @Test
    void shouldRejectBlankDefaultPersona() {
        // Given
        Map<String, String> env = Map.of("INSIGHT_DEFAULT_PERSONA", "");

        // When/Then
        assertThatThrownBy(() -> new ConfigurationLoader(env).loadConfiguration(new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Default persona");
    }

    @Test
    void shouldRejectMissingConfigFile() {
        // When/Then
        assertThatThrownBy(() -> new ConfigurationLoader(Map.of()).loadFile(tempDir.resolve("absent.yml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void shouldNeverShowApiKeyInSummary() {
        // Given
        InsightConfig config = InsightConfig.builder().openAiApiKey("sk-secret").build();

        // When/Then
        assertThat(config.getConfigurationSummary()).doesNotContain("sk-secret").contains("AI: configured");
    }
}
