package org.carball.insight.tools;

import org.carball.insight.config.InsightConfig;
import org.carball.insight.model.classification.ExecutionStrategy;
import org.carball.insight.model.tool.ToolDescriptor;
import org.carball.insight.model.tool.ToolResult;
import org.carball.insight.support.FakeStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.insight.support.Fixtures.PLANNING;
import static org.carball.insight.support.Fixtures.SALES;
import static org.carball.insight.support.Fixtures.classification;

public class DirectToolRegistryTest {

    @Test
    void shouldKeepRegistrationOrderPerPersona() {
        // When
        DirectToolRegistry registry = DirectToolRegistry.builder()
                .register(SALES, tool("b"))
                .register(SALES, tool("a"))
                .register(PLANNING, tool("c"))
                .build();

        // Then
        assertThat(registry.toolsFor(SALES)).extracting(ToolDescriptor::name).containsExactly("b", "a");
        assertThat(registry.toolsFor(PLANNING)).extracting(ToolDescriptor::name).containsExactly("c");
        assertThat(registry.toolsFor("unknown")).isEmpty();
        assertThat(registry.toolsFor(null)).isEmpty();
    }

    @Test
    void shouldRejectRegistrationAfterBuild() {
        // Given
        DirectToolRegistry.Builder builder = DirectToolRegistry.builder().register(SALES, tool("a"));
        builder.build();

        // When/Then
        assertThatThrownBy(() -> builder.register(SALES, tool("b")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldExposeImmutableToolLists() {
        // Given
        DirectToolRegistry registry = DirectToolRegistry.builder().register(SALES, tool("a")).build();

        // When/Then
        assertThatThrownBy(() -> registry.toolsFor(SALES).add(tool("b")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRejectDuplicateToolNames() {
        // When/Then
        assertThatThrownBy(() -> DirectToolRegistry.builder()
                .register(SALES, tool("a"))
                .register(SALES, tool("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate tool 'a'");
    }

    @Test
    void shouldAllowSameToolNameForDifferentPersonas() {
        // When
        DirectToolRegistry registry = DirectToolRegistry.builder()
                .register(SALES, tool("a"))
                .register(PLANNING, tool("a"))
                .build();

        // Then
        assertThat(registry.stats().toolCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectDescriptorWithMissingFields() {
        // Given
        ToolDescriptor incomplete = new ToolDescriptor("a", null, null, " ");

        // When/Then
        assertThatThrownBy(() -> DirectToolRegistry.builder().register(SALES, incomplete))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("predicate")
                .hasMessageContaining("executor")
                .hasMessageContaining("description");
    }

    @Test
    void shouldReportStats() {
        // Given
        DirectToolRegistry registry = DirectToolRegistry.builder()
                .register(SALES, tool("a"))
                .register(SALES, tool("b"))
                .persona(PLANNING)
                .build();

        // When
        RegistryStats stats = registry.stats();

        // Then
        assertThat(stats.personaCount()).isEqualTo(2);
        assertThat(stats.toolCount()).isEqualTo(2);
        assertThat(stats.toolsByPersona()).containsEntry(SALES, List.of("a", "b"))
                .containsEntry(PLANNING, List.of());
    }

    @Test
    void shouldEvaluatePredicateOverSampleQuestions() {
        // Given
        DirectToolRegistry registry = DirectToolCatalog.standard(new FakeStore(), InsightConfig.defaults());

        // When
        Map<String, Boolean> results = registry.testPredicate(SALES, "competitor_mapping",
                List.of("What is our equivalent for Hogy BR-56U10?", "Show me last month's sales"),
                classification(SALES, ExecutionStrategy.SINGLE_STAGE));

        // Then
        assertThat(results).containsEntry("What is our equivalent for Hogy BR-56U10?", true)
                .containsEntry("Show me last month's sales", false);
    }

    @Test
    void shouldRegisterStandardCatalogInPriorityOrder() {
        // When
        DirectToolRegistry registry = DirectToolCatalog.standard(new FakeStore(), InsightConfig.defaults());

        // Then
        assertThat(registry.toolsFor(SALES)).extracting(ToolDescriptor::name)
                .containsExactly("competitor_mapping", "product_pricing");
        assertThat(registry.toolsFor(PLANNING)).extracting(ToolDescriptor::name)
                .containsExactly("component_lookup");
    }

    @Test
    void shouldFailTestPredicateForUnknownTool() {
        // Given
        DirectToolRegistry registry = DirectToolRegistry.empty();

        // When/Then
        assertThatThrownBy(() -> registry.testPredicate(SALES, "missing", List.of("q"),
                classification(SALES, ExecutionStrategy.SINGLE_STAGE)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ToolDescriptor tool(String name) {
        return new ToolDescriptor(name, (q, c) -> true, (q, c) -> ToolResult.of(List.of(), "SELECT 1"), "tool " + name);
    }
}
