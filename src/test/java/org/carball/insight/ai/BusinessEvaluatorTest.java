package org.carball.insight.ai;

import org.carball.insight.config.InsightConfig;
import org.carball.insight.error.EvaluationParseException;
import org.carball.insight.model.stage.ConfidenceLabel;
import org.carball.insight.model.stage.EvaluationResult;
import org.carball.insight.model.stage.StageName;
import org.carball.insight.model.stage.StageResult;
import org.carball.insight.persona.PersonaCatalog;
import org.carball.insight.support.FakeChatGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.insight.support.Fixtures.evaluationJson;
import static org.carball.insight.support.Fixtures.row;

public class BusinessEvaluatorTest {

    private static final String PURPOSE = "stage3_evaluation";

    private FakeChatGateway gateway;
    private BusinessEvaluator evaluator;
    private Map<String, StageResult> outputs;

    @BeforeEach
    void setUp() {
        gateway = new FakeChatGateway();
        PersonaCatalog personas = new PersonaCatalog(List.of("product_planning", "spt_sales_rep"));
        evaluator = new BusinessEvaluator(gateway, personas, new DataCompressor(10), InsightConfig.defaults());

        outputs = new LinkedHashMap<>();
        outputs.put(StageName.DISCOVERY.getKey(), StageResult.rows("SELECT 1",
                List.of(row("part_code", "KIT-1001"), row("part_code", "KIT-1002"))));
        outputs.put(StageName.ANALYSIS.getKey(), StageResult.rows("SELECT 2",
                List.of(row("part_code", "KIT-1001", "margin", 0.42))));
    }

    @Test
    void shouldParseStructuredEvaluation() {
        // Given
        gateway.reply(PURPOSE, evaluationJson("KIT-1001 has the best margin"));

        // When
        EvaluationResult result = evaluator.evaluate("Which kit is most profitable?", "product_planning", outputs);

        // Then
        assertThat(result.structured()).isTrue();
        assertThat(result.businessAnswer()).isEqualTo("KIT-1001 has the best margin");
        assertThat(result.keyFindings()).containsExactly("finding one");
        assertThat(result.confidence()).isEqualTo(ConfidenceLabel.HIGH);
        assertThat(result.primaryValues()).containsExactly("A");
        assertThat(result.dataQualityNote()).isEqualTo("good");
    }

    @Test
    void shouldSendMostSpecificRowsToModel() {
        // Given
        gateway.reply(PURPOSE, evaluationJson("answer"));

        // When
        evaluator.evaluate("Which kit is most profitable?", "product_planning", outputs);

        // Then
        String prompt = gateway.lastRequestFor(PURPOSE).userPrompt();
        assertThat(prompt).contains("margin: 0.42")
                .contains("USER QUESTION: Which kit is most profitable?")
                .contains("stage1_discovery: 2 records retrieved")
                .doesNotContain("{data_sample}");
        assertThat(gateway.lastRequestFor(PURPOSE).jsonMode()).isTrue();
    }

    @Test
    void shouldKeepStructuredAnswerWhenListsContainNulls() {
        // Given
        gateway.reply(PURPOSE, """
            {"business_answer": "KIT-1001 has the best margin",
             "key_findings": ["Margin is 42%", null],
             "recommended_action": "Promote KIT-1001",
             "supporting_data": {"primary_values": ["KIT-1001", null], "alternatives": [null], "confidence": "high"},
             "data_quality": "good"}
            """);

        // When
        EvaluationResult result = evaluator.evaluate("Which kit is most profitable?", "product_planning", outputs);

        // Then
        assertThat(result.structured()).isTrue();
        assertThat(result.businessAnswer()).isEqualTo("KIT-1001 has the best margin");
        assertThat(result.keyFindings()).containsExactly("Margin is 42%");
        assertThat(result.primaryValues()).containsExactly("KIT-1001");
        assertThat(result.alternatives()).isEmpty();
    }

    @Test
    void shouldRecoverFromTruncatedJson() {
        // Given
        String truncated = "{\"business_answer\": \"Our equivalent is SP-3300\", "
                + "\"key_findings\": [\"BR-56U10 maps to SP-3300\", \"Price is 1200 JPY\"], "
                + "\"supporting_data\": {\"confidence\": \"high\"";

        // When
        EvaluationResult result = evaluator.parse(truncated);

        // Then
        assertThat(result.structured()).isFalse();
        assertThat(result.businessAnswer()).isEqualTo("Our equivalent is SP-3300");
        assertThat(result.keyFindings()).containsExactly("BR-56U10 maps to SP-3300", "Price is 1200 JPY");
        assertThat(result.confidence()).isEqualTo(ConfidenceLabel.MEDIUM);
        assertThat(result.dataQualityNote()).isEqualTo(EvaluationResult.UNSTRUCTURED_FALLBACK);
    }

    @Test
    void shouldRecoverFromPlainProse() {
        // When
        EvaluationResult result = evaluator.parse("The equivalent is SP-3300.\nIt is in stock.");

        // Then
        assertThat(result.businessAnswer()).isEqualTo("The equivalent is SP-3300.");
        assertThat(result.confidence()).isEqualTo(ConfidenceLabel.LOW);
        assertThat(result.structured()).isFalse();
    }

    @Test
    void shouldTreatMissingAnswerAsUnstructured() {
        // When/Then
        assertThatThrownBy(() -> evaluator.parseStructured("{\"key_findings\": []}"))
                .isInstanceOf(EvaluationParseException.class)
                .hasMessageContaining("business_answer");
        assertThat(evaluator.parse("{\"key_findings\": []}").hasAnswer()).isTrue();
    }

    @Test
    void shouldSummarizeRowsLocallyWhenModelIsUnavailable() {
        // Given
        gateway.fail(PURPOSE, "timeout");

        // When
        EvaluationResult result = evaluator.evaluate("Which kit is most profitable?", "product_planning", outputs);

        // Then
        assertThat(result.confidence()).isEqualTo(ConfidenceLabel.LOW);
        assertThat(result.businessAnswer()).startsWith("Found 1 records");
        assertThat(result.keyFindings()).anyMatch(f -> f.contains("timeout"));
    }

    @Test
    void shouldPreferAnalysisThenDirectThenFallbackThenDiscovery() {
        // Given
        Map<String, StageResult> stages = new LinkedHashMap<>();
        stages.put(StageName.DISCOVERY.getKey(), StageResult.rows("SELECT 1", List.of(row("a", 1))));
        stages.put(StageName.FALLBACK_QUERY.getKey(), StageResult.rows("SELECT 2", List.of(row("b", 2))));

        // When/Then
        assertThat(BusinessEvaluator.finalData(stages)).containsExactly(row("b", 2));
        assertThat(BusinessEvaluator.finalData(Map.of())).isEmpty();
    }
}
