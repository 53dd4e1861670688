package org.carball.insight.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.ai.BusinessEvaluator;
import org.carball.insight.ai.CandidateSelector;
import org.carball.insight.ai.ChatGateway;
import org.carball.insight.ai.DataCompressor;
import org.carball.insight.ai.IntentClassifier;
import org.carball.insight.ai.OpenAiChatGateway;
import org.carball.insight.ai.SqlQueryGenerator;
import org.carball.insight.config.InsightConfig;
import org.carball.insight.persona.PersonaCatalog;
import org.carball.insight.store.SqlSafetyGuard;
import org.carball.insight.store.StoreQueryCapability;
import org.carball.insight.store.WarehouseConnector;
import org.carball.insight.tools.DirectDispatcher;
import org.carball.insight.tools.DirectToolCatalog;
import org.carball.insight.tools.DirectToolRegistry;

/**
 * Wires the orchestrator and its collaborators from configuration.
 */
@Slf4j
public final class OrchestratorFactory {

    private OrchestratorFactory() {
        // Utility class - prevent instantiation
    }

    public static QuestionOrchestrator create(InsightConfig config) {
        return create(config, new OpenAiChatGateway(config), new WarehouseConnector(config));
    }

    public static QuestionOrchestrator create(InsightConfig config, ChatGateway gateway, StoreQueryCapability store) {
        return create(config, gateway, store, DirectToolCatalog.standard(store, config));
    }

    public static QuestionOrchestrator create(InsightConfig config, ChatGateway gateway, StoreQueryCapability store,
                                              DirectToolRegistry registry) {
        PersonaCatalog personas = new PersonaCatalog(config.getPersonas());
        DataCompressor compressor = new DataCompressor(config.getCompressionMaxRecords());

        IntentClassifier classifier = new IntentClassifier(gateway, personas, config);
        BusinessEvaluator evaluator = new BusinessEvaluator(gateway, personas, compressor, config);
        QuestionQueryRunner queryRunner = new QuestionQueryRunner(
                new SqlQueryGenerator(gateway, config), new SqlSafetyGuard(), store);
        StagePipeline pipeline = new StagePipeline(queryRunner, new CandidateSelector(gateway, compressor, config),
                evaluator, personas, config.getDiscoveryLimit());

        log.debug("Orchestrator wired with personas {} and direct tools {}",
                personas.names(), registry.stats().toolsByPersona());
        return new QuestionOrchestrator(classifier, new DirectDispatcher(registry), pipeline, queryRunner,
                evaluator, personas, new ResultAssembler(), config.getDefaultPersona());
    }
}
