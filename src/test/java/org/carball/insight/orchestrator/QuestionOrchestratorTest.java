package org.carball.insight.orchestrator;

import org.carball.insight.config.InsightConfig;
import org.carball.insight.model.response.ExecutionPath;
import org.carball.insight.model.response.ResponseEnvelope;
import org.carball.insight.model.stage.ConfidenceLabel;
import org.carball.insight.model.stage.EvaluationResult;
import org.carball.insight.model.stage.StageResult;
import org.carball.insight.support.FakeChatGateway;
import org.carball.insight.support.FakeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.insight.support.Fixtures.PLANNING;
import static org.carball.insight.support.Fixtures.SALES;
import static org.carball.insight.support.Fixtures.classificationJson;
import static org.carball.insight.support.Fixtures.evaluationJson;
import static org.carball.insight.support.Fixtures.row;

public class QuestionOrchestratorTest {

    private static final String CLASSIFY = "intent_classification";
    private static final String EVALUATE = "stage3_evaluation";
    private static final String COMPETITOR_QUESTION = "What is our equivalent for Hogy BR-56U10?";
    private static final String DISCOVERY_SQL =
            "SELECT TOP 20 pt_part AS part_code, pt_desc1 AS description FROM JPNPROdb_pt_mstr WHERE pt_desc1 LIKE '%KIT%'";
    private static final String ANALYSIS_SQL =
            "SELECT ps_par AS parent_code, ps_comp AS component_code FROM JPNPROdb_ps_mstr WHERE ps_par IN ('KIT-1001')";
    private static final String FALLBACK_SQL =
            "SELECT TOP 5 pt_part AS part_code, pt_price AS list_price FROM JPNPROdb_pt_mstr WHERE pt_part LIKE '%56U10%'";

    private FakeChatGateway gateway;
    private FakeStore store;
    private QuestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        gateway = new FakeChatGateway();
        store = new FakeStore();
        orchestrator = OrchestratorFactory.create(InsightConfig.defaults(), gateway, store);
    }

    @Test
    void shouldAnswerCompetitorQuestionThroughDirectToolWithEvaluation() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(SALES, "single_stage"))
                .reply(EVALUATE, evaluationJson("Our equivalent of BR-56U10 is SP-3300"));
        store.rows("competitor_mapping", List.of(row("competitor_product", "BR-56U10", "our_product", "SP-3300")));

        // When
        ResponseEnvelope envelope = orchestrator.handle(COMPETITOR_QUESTION);

        // Then
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.DIRECT_WITH_EVALUATION);
        assertThat(envelope.stageResults()).containsOnlyKeys("direct_tool", "stage3_evaluation");
        assertThat(envelope.stageResults().get("direct_tool").toolName()).isEqualTo("competitor_mapping");
        assertThat(envelope.finalAnswer()).startsWith("**Our equivalent of BR-56U10 is SP-3300**");
        assertThat(envelope.degraded()).isFalse();
        assertThat(store.getQueries()).hasSize(1);
        assertThat(gateway.callsFor("fallback_query_sql")).isZero();
    }

    @Test
    void shouldReturnRowsWhenEvaluationIsDisabled() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(SALES, "single_stage", "{}", false));
        store.rows("competitor_mapping", List.of(row("competitor_product", "BR-56U10", "our_product", "SP-3300")));

        // When
        ResponseEnvelope envelope = orchestrator.handle(COMPETITOR_QUESTION);

        // Then
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.DIRECT_NO_EVALUATION);
        assertThat(envelope.stageResults()).containsOnlyKeys("direct_tool");
        assertThat(envelope.finalAnswer()).contains("our_product: SP-3300").contains("Found 1 records");
        assertThat(gateway.callsFor(EVALUATE)).isZero();
    }

    @Test
    void shouldFallBackWhenDirectToolFindsNoRows() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(SALES, "single_stage"))
                .reply("fallback_query_sql", FALLBACK_SQL)
                .reply(EVALUATE, evaluationJson("BR-56U10 resembles SP-56U10"));
        store.rows("fallback_query", List.of(row("part_code", "SP-56U10", "list_price", 1500)));

        // When
        ResponseEnvelope envelope = orchestrator.handle(COMPETITOR_QUESTION);

        // Then
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.AI_WORKFLOW_FALLBACK);
        assertThat(envelope.stageResults()).containsOnlyKeys("direct_tool", "fallback_query", "stage3_evaluation");
        assertThat(envelope.stageResults().get("direct_tool").rowCount()).isZero();
        assertThat(envelope.stageResults().get("fallback_query").rowCount()).isEqualTo(1);
        assertThat(envelope.notes()).anyMatch(n -> n.contains("found no rows"));
        assertThat(gateway.lastRequestFor("fallback_query_sql").userPrompt()).contains(COMPETITOR_QUESTION);
    }

    @Test
    void shouldFallBackWhenDirectToolFails() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(SALES, "single_stage"))
                .reply("fallback_query_sql", FALLBACK_SQL)
                .reply(EVALUATE, evaluationJson("answer"));
        store.fail("competitor_mapping", "Login timeout expired")
                .rows("fallback_query", List.of(row("part_code", "SP-56U10")));

        // When
        ResponseEnvelope envelope = orchestrator.handle(COMPETITOR_QUESTION);

        // Then
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.AI_WORKFLOW_FALLBACK);
        assertThat(envelope.stageResults().get("direct_tool").error()).contains("Login timeout expired");
        assertThat(envelope.notes()).anyMatch(n -> n.startsWith("DirectToolError: competitor_mapping"));
        assertThat(envelope.degraded()).isFalse();
    }

    @Test
    void shouldFallBackWhenNoDirectToolApplies() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(PLANNING, "single_stage"))
                .reply("fallback_query_sql", FALLBACK_SQL)
                .reply(EVALUATE, evaluationJson("Sales were flat"));
        store.rows("fallback_query", List.of(row("part_code", "KIT-1001")));

        // When
        ResponseEnvelope envelope = orchestrator.handle("How did drape kit sales trend last quarter?");

        // Then
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.AI_WORKFLOW_FALLBACK);
        assertThat(envelope.hasStage("direct_tool")).isFalse();
        assertThat(envelope.notes()).anyMatch(n -> n.contains("No direct tool applied"));
    }

    @Test
    void shouldNoteUnmatchedInputsOnPartialDirectMatch() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(SALES, "single_stage"))
                .reply(EVALUATE, evaluationJson("One of two products maps"));
        store.rows("competitor_mapping", List.of(row("competitor_product", "BR-56U10", "our_product", "SP-3300")));

        // When
        ResponseEnvelope envelope = orchestrator.handle("Hogy BR-56U10 and Hogy XX-99999 equivalent");

        // Then
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.DIRECT_WITH_EVALUATION);
        assertThat(envelope.stageResults().get("direct_tool").unmatchedInputs()).containsExactly("XX-99999");
        assertThat(envelope.notes()).contains("No direct match for: XX-99999");
    }

    @Test
    void shouldRunMultiStagePipelineWithExactlyTwoQueries() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(PLANNING, "multi_stage"))
                .reply("stage1_discovery_sql", DISCOVERY_SQL)
                .reply("intermediate_selection", "{\"summary\": \"2 kits\", \"selected_items\": [\"KIT-1001\"],"
                        + " \"reasoning\": \"best seller\", \"stage2_focus\": \"components\"}")
                .reply("stage2_analysis_sql", ANALYSIS_SQL)
                .reply(EVALUATE, evaluationJson("KIT-1001 uses TX2040"));
        store.rows("stage1_discovery", List.of(row("part_code", "KIT-1001"), row("part_code", "KIT-1002")))
                .rows("stage2_analysis", List.of(row("parent_code", "KIT-1001", "component_code", "TX2040")));

        // When
        ResponseEnvelope envelope = orchestrator.handle("Which drape kits use TX2040 components most?");

        // Then
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.MULTI_STAGE);
        assertThat(envelope.stageResults().keySet()).containsExactly(
                "stage1_discovery", "intermediate_selection", "stage2_analysis", "stage3_evaluation");
        assertThat(envelope.stageResults().get("intermediate_selection").selection().selectedItems())
                .containsExactly("KIT-1001");
        assertThat(store.getQueries()).hasSize(2);
        assertThat(gateway.lastRequestFor("stage2_analysis_sql").userPrompt()).contains("KIT-1001");
        assertThat(envelope.finalAnswer()).startsWith("**KIT-1001 uses TX2040**");
    }

    @Test
    void shouldContinuePipelineWhenDiscoveryIsEmpty() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(PLANNING, "multi_stage"))
                .reply("stage1_discovery_sql", DISCOVERY_SQL)
                .reply("stage2_analysis_sql", ANALYSIS_SQL)
                .reply(EVALUATE, evaluationJson("No matching kits exist"));

        // When
        ResponseEnvelope envelope = orchestrator.handle("Which kits contain unobtainium?");

        // Then
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.MULTI_STAGE);
        assertThat(gateway.callsFor("intermediate_selection")).isZero();
        assertThat(store.getQueries()).hasSize(2);
        assertThat(envelope.stageResults().get("intermediate_selection").selection().isEmpty()).isTrue();
        EvaluationResult evaluation = envelope.stageResults().get("stage3_evaluation").evaluation();
        assertThat(evaluation.keyFindings().get(0)).isEqualTo("No candidates were found during discovery");
    }

    @Test
    void shouldMarkResponseDegradedWhenAnalysisQueryFails() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(PLANNING, "multi_stage"))
                .reply("stage1_discovery_sql", DISCOVERY_SQL)
                .reply("intermediate_selection", "{\"selected_items\": [\"KIT-1001\"]}")
                .reply("stage2_analysis_sql", ANALYSIS_SQL);
        store.rows("stage1_discovery", List.of(row("part_code", "KIT-1001")))
                .fail("stage2_analysis", "Query timed out");

        // When
        ResponseEnvelope envelope = orchestrator.handle("Which drape kits use TX2040 components most?");

        // Then
        assertThat(envelope.degraded()).isTrue();
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.MULTI_STAGE);
        StageResult analysis = envelope.stageResults().get("stage2_analysis");
        assertThat(analysis.isFailure()).isTrue();
        EvaluationResult evaluation = envelope.stageResults().get("stage3_evaluation").evaluation();
        assertThat(evaluation.confidence()).isEqualTo(ConfidenceLabel.LOW);
        assertThat(evaluation.keyFindings()).anyMatch(f -> f.contains("Query timed out"));
        assertThat(gateway.callsFor(EVALUATE)).isZero();
        assertThat(envelope.notes()).anyMatch(n -> n.startsWith("StoreQueryError"));
    }

    @Test
    void shouldRejectUnsafeGeneratedSqlWithoutTouchingStore() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(PLANNING, "single_stage"))
                .reply("fallback_query_sql", "DELETE FROM JPNPROdb_pt_mstr");

        // When
        ResponseEnvelope envelope = orchestrator.handle("Clean up old parts");

        // Then
        assertThat(store.getQueries()).isEmpty();
        assertThat(envelope.degraded()).isTrue();
        assertThat(envelope.stageResults().get("fallback_query").isFailure()).isTrue();
    }

    @Test
    void shouldUseDefaultClassificationWhenClassifierFails() {
        // Given
        gateway.fail(CLASSIFY, "service unavailable")
                .reply("fallback_query_sql", FALLBACK_SQL)
                .reply(EVALUATE, evaluationJson("answer"));
        store.rows("fallback_query", List.of(row("part_code", "KIT-1001")));

        // When
        ResponseEnvelope envelope = orchestrator.handle("Tell me about our kits");

        // Then
        assertThat(envelope.classification().persona()).isEqualTo(PLANNING);
        assertThat(envelope.classification().defaulted()).isTrue();
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.AI_WORKFLOW_FALLBACK);
        assertThat(envelope.notes()).anyMatch(n -> n.startsWith("ClassificationError"));
    }

    @Test
    void shouldHandleIterativeStrategyAsSingleStage() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(SALES, "iterative"))
                .reply(EVALUATE, evaluationJson("answer"));
        store.rows("competitor_mapping", List.of(row("competitor_product", "BR-56U10", "our_product", "SP-3300")));

        // When
        ResponseEnvelope envelope = orchestrator.handle(COMPETITOR_QUESTION);

        // Then
        assertThat(envelope.executionPath()).isEqualTo(ExecutionPath.DIRECT_WITH_EVALUATION);
        assertThat(envelope.notes()).contains("Iterative strategy handled as single stage");
    }

    @Test
    void shouldKeepAnswerWhenEvaluationIsUnstructured() {
        // Given
        gateway.reply(CLASSIFY, classificationJson(SALES, "single_stage"))
                .reply(EVALUATE, "Our equivalent is SP-3300, priced at 1200 JPY.");
        store.rows("competitor_mapping", List.of(row("competitor_product", "BR-56U10", "our_product", "SP-3300")));

        // When
        ResponseEnvelope envelope = orchestrator.handle(COMPETITOR_QUESTION);

        // Then
        EvaluationResult evaluation = envelope.stageResults().get("stage3_evaluation").evaluation();
        assertThat(evaluation.structured()).isFalse();
        assertThat(envelope.finalAnswer()).contains("Our equivalent is SP-3300").contains("unstructured fallback");
    }

    @Test
    void shouldNeverThrowWhenEverythingIsUnavailable() {
        // Given
        store.fail("fallback_query", "warehouse down");

        // When
        ResponseEnvelope envelope = orchestrator.handle(null);

        // Then
        assertThat(envelope).isNotNull();
        assertThat(envelope.finalAnswer()).isNotBlank();
        assertThat(envelope.stageResults()).isNotEmpty();
        assertThat(envelope.requestId()).isNotBlank();
    }

    @Test
    void shouldRefuseToStartWithoutDefaultPersona() {
        // Given
        InsightConfig config = InsightConfig.defaults().toBuilder().defaultPersona(" ").build();

        // When/Then
        assertThatThrownBy(() -> OrchestratorFactory.create(config, gateway, store))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Default persona");
    }
}
