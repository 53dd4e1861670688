package org.carball.insight.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.ai.CandidateSelector;
import org.carball.insight.ai.EvaluationCapability;
import org.carball.insight.error.StoreQueryException;
import org.carball.insight.model.stage.CandidateSelection;
import org.carball.insight.model.stage.EvaluationResult;
import org.carball.insight.model.stage.StageContext;
import org.carball.insight.model.stage.StageName;
import org.carball.insight.model.stage.StageResult;
import org.carball.insight.persona.PersonaCatalog;
import org.carball.insight.session.SessionTrace;
import org.carball.insight.store.QueryResult;

import java.util.List;
import java.util.Map;

/**
 * Discovery, candidate selection, analysis and evaluation for multi-stage questions.
 *
 * <p>Exactly two store queries are issued (discovery and analysis). An empty discovery does not
 * stop the pipeline; evaluation then states that no candidates were found. A store failure stops
 * it and the evaluation entry explains that data could not be retrieved.
 */
@Slf4j
public class StagePipeline {

    private final QuestionQueryRunner queryRunner;
    private final CandidateSelector selector;
    private final EvaluationCapability evaluator;
    private final PersonaCatalog personaCatalog;
    private final int discoveryLimit;

    public StagePipeline(QuestionQueryRunner queryRunner, CandidateSelector selector, EvaluationCapability evaluator,
                         PersonaCatalog personaCatalog, int discoveryLimit) {
        this.queryRunner = queryRunner;
        this.selector = selector;
        this.evaluator = evaluator;
        this.personaCatalog = personaCatalog;
        this.discoveryLimit = Math.max(1, discoveryLimit);
    }

    public PipelineOutcome run(StageContext context) {
        String question = context.getQuestion();
        String personaContent = personaCatalog.content(context.getPersona());

        // Stage 1: Discovery
        List<Map<String, Object>> candidates;
        try {
            QueryResult discovery = queryRunner.run(StageName.DISCOVERY.getKey(), discoveryPrompt(question, personaContent));
            candidates = discovery.rows().size() > discoveryLimit
                    ? discovery.rows().subList(0, discoveryLimit)
                    : discovery.rows();
            context.record(StageName.DISCOVERY, StageResult.rows(discovery.executedQuery(), candidates));
            log.info("Discovery found {} candidates", candidates.size());
        } catch (StoreQueryException e) {
            return abort(context, StageName.DISCOVERY, e, 0);
        }

        // Stage 1.5: Selection, no store access
        transition(StageName.DISCOVERY, StageName.SELECTION);
        CandidateSelection selection = selector.select(question, personaContent, candidates);
        context.record(StageName.SELECTION, StageResult.selection(selection));

        // Stage 2: Analysis keyed on the selection
        transition(StageName.SELECTION, StageName.ANALYSIS);
        try {
            QueryResult analysis = queryRunner.run(StageName.ANALYSIS.getKey(),
                    analysisPrompt(question, personaContent, selection));
            context.record(StageName.ANALYSIS, StageResult.rows(analysis.executedQuery(), analysis.rows()));
            log.info("Analysis retrieved {} records for {} selected items",
                    analysis.rowCount(), selection.selectedItems().size());
        } catch (StoreQueryException e) {
            return abort(context, StageName.ANALYSIS, e, candidates.size());
        }

        // Stage 3: Evaluation over what was retrieved
        transition(StageName.ANALYSIS, StageName.EVALUATION);
        EvaluationResult evaluation = LocalEvaluation.guarded(evaluator, question, context.getPersona(), context.asMap());
        if (candidates.isEmpty()) {
            evaluation = evaluation.withLeadingFinding(LocalEvaluation.NO_CANDIDATES);
        }
        context.record(StageName.EVALUATION, StageResult.evaluation(evaluation));
        return PipelineOutcome.complete();
    }

    private PipelineOutcome abort(StageContext context, StageName stage, StoreQueryException e, int candidates) {
        log.error("{} failed, aborting pipeline: {}", stage.getKey(), e.getMessage());
        SessionTrace.current().ifPresent(t -> t.error(e.getKind().getLabel(), stage.getKey(), e.getMessage()));
        context.record(stage, StageResult.failure(null, e.getMessage()));
        context.record(StageName.EVALUATION, StageResult.evaluation(
                LocalEvaluation.storeFailure(context.getQuestion(), stage.getKey(), e.getMessage(), candidates)));
        return PipelineOutcome.degraded(e.describe());
    }

    private String discoveryPrompt(String question, String personaContent) {
        return PersonaCatalog.render(personaCatalog.template(StageName.DISCOVERY), Map.of(
                "persona_context", personaContent,
                "question", question,
                "limit", String.valueOf(discoveryLimit)));
    }

    private String analysisPrompt(String question, String personaContent, CandidateSelection selection) {
        return PersonaCatalog.render(personaCatalog.template(StageName.ANALYSIS), Map.of(
                "persona_context", personaContent,
                "question", question,
                "discovery_summary", selection.summary(),
                "selected_items", selection.isEmpty()
                        ? "None - discovery found no candidates; query for the criteria directly"
                        : String.join(", ", selection.selectedItems()),
                "analysis_focus", selection.analysisFocus()));
    }

    private static void transition(StageName from, StageName to) {
        SessionTrace.current().ifPresent(t -> t.stageTransition(from.getKey(), to.getKey()));
    }
}
