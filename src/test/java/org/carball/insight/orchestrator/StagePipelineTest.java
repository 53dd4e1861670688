package org.carball.insight.orchestrator;

import org.carball.insight.ai.BusinessEvaluator;
import org.carball.insight.ai.CandidateSelector;
import org.carball.insight.ai.DataCompressor;
import org.carball.insight.ai.SqlQueryGenerator;
import org.carball.insight.config.InsightConfig;
import org.carball.insight.model.stage.CandidateSelection;
import org.carball.insight.model.stage.StageContext;
import org.carball.insight.model.stage.StageName;
import org.carball.insight.persona.PersonaCatalog;
import org.carball.insight.store.SqlSafetyGuard;
import org.carball.insight.support.FakeChatGateway;
import org.carball.insight.support.FakeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.insight.support.Fixtures.PLANNING;
import static org.carball.insight.support.Fixtures.evaluationJson;
import static org.carball.insight.support.Fixtures.row;

public class StagePipelineTest {

    private static final String SQL = "SELECT TOP 20 pt_part AS part_code FROM JPNPROdb_pt_mstr";

    private FakeChatGateway gateway;
    private FakeStore store;
    private StagePipeline pipeline;

    @BeforeEach
    void setUp() {
        gateway = new FakeChatGateway();
        store = new FakeStore();
        InsightConfig config = InsightConfig.builder().discoveryLimit(5).maxSelectedItems(2).build();
        PersonaCatalog personas = new PersonaCatalog(config.getPersonas());
        DataCompressor compressor = new DataCompressor(config.getCompressionMaxRecords());
        QuestionQueryRunner runner = new QuestionQueryRunner(new SqlQueryGenerator(gateway, config),
                new SqlSafetyGuard(), store);
        pipeline = new StagePipeline(runner, new CandidateSelector(gateway, compressor, config),
                new BusinessEvaluator(gateway, personas, compressor, config), personas, config.getDiscoveryLimit());

        gateway.reply("stage1_discovery_sql", SQL)
                .reply("stage2_analysis_sql", SQL)
                .reply("stage3_evaluation", evaluationJson("answer"));
    }

    @Test
    void shouldTruncateDiscoveryToLimitAndRenderItInPrompt() {
        // Given
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            rows.add(row("part_code", "KIT-10" + (10 + i)));
        }
        store.rows("stage1_discovery", rows);

        // When
        StageContext context = new StageContext("Which kits sell best?", PLANNING);
        PipelineOutcome outcome = pipeline.run(context);

        // Then
        assertThat(outcome.degraded()).isFalse();
        assertThat(context.get(StageName.DISCOVERY).rowCount()).isEqualTo(5);
        assertThat(gateway.lastRequestFor("stage1_discovery_sql").userPrompt()).contains("TOP 5");
    }

    @Test
    void shouldAutoSelectWhenSelectionModelFails() {
        // Given
        store.rows("stage1_discovery", List.of(row("part_code", "KIT-1001"), row("part_code", "KIT-1002"),
                row("part_code", "KIT-1003")));
        gateway.fail("intermediate_selection", "rate limited");

        // When
        StageContext context = new StageContext("Which kits sell best?", PLANNING);
        pipeline.run(context);

        // Then
        CandidateSelection selection = context.selection();
        assertThat(selection.autoSelected()).isTrue();
        assertThat(selection.selectedItems()).containsExactly("KIT-1001", "KIT-1002");
        assertThat(gateway.lastRequestFor("stage2_analysis_sql").userPrompt()).contains("KIT-1001, KIT-1002");
        assertThat(context.evaluation().hasAnswer()).isTrue();
    }

    @Test
    void shouldStopAfterDiscoveryFailure() {
        // Given
        store.fail("stage1_discovery", "Invalid object name");

        // When
        StageContext context = new StageContext("Which kits sell best?", PLANNING);
        PipelineOutcome outcome = pipeline.run(context);

        // Then
        assertThat(outcome.degraded()).isTrue();
        assertThat(outcome.note()).contains("Invalid object name");
        assertThat(context.contains(StageName.SELECTION)).isFalse();
        assertThat(context.contains(StageName.ANALYSIS)).isFalse();
        assertThat(context.get(StageName.DISCOVERY).isFailure()).isTrue();
        assertThat(context.evaluation()).isNotNull();
        assertThat(store.getQueries()).hasSize(1);
    }
}
