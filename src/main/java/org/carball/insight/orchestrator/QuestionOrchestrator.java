package org.carball.insight.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.ai.ClassifierCapability;
import org.carball.insight.ai.EvaluationCapability;
import org.carball.insight.error.ClassificationException;
import org.carball.insight.error.ErrorKind;
import org.carball.insight.error.StoreQueryException;
import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.classification.ExecutionStrategy;
import org.carball.insight.model.response.ExecutionPath;
import org.carball.insight.model.response.ResponseEnvelope;
import org.carball.insight.model.stage.EvaluationResult;
import org.carball.insight.model.stage.StageContext;
import org.carball.insight.model.stage.StageName;
import org.carball.insight.model.stage.StageResult;
import org.carball.insight.model.tool.DispatchOutcome;
import org.carball.insight.model.tool.ToolResult;
import org.carball.insight.persona.PersonaCatalog;
import org.carball.insight.session.SessionTrace;
import org.carball.insight.store.QueryResult;
import org.carball.insight.tools.DirectDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for answering a question.
 *
 * <p>Single-stage (and iterative) questions try a direct tool first. A tool that does not apply,
 * fails, or finds no rows hands over to one generated query followed by evaluation. Multi-stage
 * questions run the {@link StagePipeline}. {@link #handle(String)} never throws.
 *
 * <p>Holds no per-request state and can serve concurrent requests.
 */
@Slf4j
public class QuestionOrchestrator {

    private final ClassifierCapability classifier;
    private final DirectDispatcher dispatcher;
    private final StagePipeline pipeline;
    private final QuestionQueryRunner queryRunner;
    private final EvaluationCapability evaluator;
    private final PersonaCatalog personaCatalog;
    private final ResultAssembler assembler;
    private final String defaultPersona;

    public QuestionOrchestrator(ClassifierCapability classifier, DirectDispatcher dispatcher, StagePipeline pipeline,
                                QuestionQueryRunner queryRunner, EvaluationCapability evaluator,
                                PersonaCatalog personaCatalog, ResultAssembler assembler, String defaultPersona) {
        if (defaultPersona == null || defaultPersona.isBlank()) {
            throw new IllegalArgumentException("Default persona must not be blank");
        }
        this.classifier = classifier;
        this.dispatcher = dispatcher;
        this.pipeline = pipeline;
        this.queryRunner = queryRunner;
        this.evaluator = evaluator;
        this.personaCatalog = personaCatalog;
        this.assembler = assembler;
        this.defaultPersona = defaultPersona;
    }

    public ResponseEnvelope handle(String question) {
        String normalized = question == null ? "" : question.trim();
        String requestId = UUID.randomUUID().toString();
        long start = System.currentTimeMillis();
        List<String> notes = new ArrayList<>();

        try (SessionTrace trace = SessionTrace.open(requestId, normalized)) {
            log.info("Handling question: {}", normalized);
            ClassificationRecord classification = ClassificationRecord.defaultFor(defaultPersona, "not yet classified");
            StageContext context = new StageContext(normalized, defaultPersona);
            try {
                // Step 1: Classify
                classification = classify(normalized, notes, trace);
                context = new StageContext(normalized, classification.persona());

                // Step 2: Route
                ExecutionPath path;
                PipelineOutcome outcome;
                if (classification.executionStrategy() == ExecutionStrategy.MULTI_STAGE) {
                    path = ExecutionPath.MULTI_STAGE;
                    outcome = pipeline.run(context);
                } else {
                    if (classification.executionStrategy() == ExecutionStrategy.ITERATIVE) {
                        notes.add("Iterative strategy handled as single stage");
                    }
                    DirectAttempt attempt = attemptDirect(normalized, classification, context, notes, trace);
                    path = attempt.path();
                    outcome = attempt.outcome();
                }
                if (outcome.note() != null) {
                    notes.add(outcome.note());
                }

                // Step 3: Assemble
                ResponseEnvelope envelope = assembler.assemble(requestId, classification, path, context, notes,
                        outcome.degraded(), start);
                trace.end(path.name(), envelope.degraded());
                log.info("Answered via {} in {}ms{}", path, envelope.durationMs(),
                        envelope.degraded() ? " (degraded)" : "");
                return envelope;

            } catch (RuntimeException e) {
                log.error("Unexpected failure while handling question: {}", e.getMessage(), e);
                trace.error("Unexpected", "handle", e.getMessage());
                notes.add("Internal error: " + e.getMessage());
                ResponseEnvelope envelope = assembler.failure(requestId, classification, context, notes, e, start);
                trace.end(envelope.executionPath().name(), true);
                return envelope;
            }
        }
    }

    private ClassificationRecord classify(String question, List<String> notes, SessionTrace trace) {
        ClassificationRecord classification;
        try {
            classification = classifier.classify(question);
            if (classification == null) {
                throw new ClassificationException("Classifier returned no result");
            }
        } catch (ClassificationException e) {
            log.warn("{}; using default persona {}", e.describe(), defaultPersona);
            trace.error(e.getKind().getLabel(), "classification", e.getMessage());
            notes.add(e.describe() + " - default classification used (persona " + defaultPersona + ")");
            classification = ClassificationRecord.defaultFor(defaultPersona, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Classifier failed unexpectedly; using default persona {}: {}", defaultPersona, e.getMessage());
            trace.error(ErrorKind.CLASSIFICATION.getLabel(), "classification", e.getMessage());
            notes.add(ErrorKind.CLASSIFICATION.getLabel() + ": " + e.getMessage()
                    + " - default classification used (persona " + defaultPersona + ")");
            classification = ClassificationRecord.defaultFor(defaultPersona, e.getMessage());
        }
        trace.classification(classification.persona(), classification.executionStrategy().getValue(),
                classification.confidence(), classification.defaulted());
        return classification;
    }

    private record DirectAttempt(ExecutionPath path, PipelineOutcome outcome) {
    }

    private DirectAttempt attemptDirect(String question, ClassificationRecord classification, StageContext context,
                                        List<String> notes, SessionTrace trace) {
        DispatchOutcome dispatch = dispatcher.dispatch(question, classification);
        trace.dispatch(dispatch.toString(), dispatch.getToolName());

        if (dispatch.hasRows()) {
            ToolResult result = dispatch.getResult();
            context.record(StageName.DIRECT_TOOL, StageResult.tool(dispatch.getToolName(), result));
            if (!result.unmatchedInputs().isEmpty()) {
                notes.add("No direct match for: " + String.join(", ", result.unmatchedInputs()));
            }
            if (!classification.enableEvaluation()) {
                return new DirectAttempt(ExecutionPath.DIRECT_NO_EVALUATION, PipelineOutcome.complete());
            }
            evaluate(context);
            return new DirectAttempt(ExecutionPath.DIRECT_WITH_EVALUATION, PipelineOutcome.complete());
        }

        switch (dispatch.getKind()) {
            case NO_MATCH -> notes.add("No direct tool applied; answered through the AI workflow");
            case FAILED -> {
                String message = dispatch.getError().getMessage();
                notes.add(ErrorKind.DIRECT_TOOL.getLabel() + ": " + dispatch.getToolName() + " - " + message);
                trace.error(ErrorKind.DIRECT_TOOL.getLabel(), dispatch.getToolName(), message);
                context.record(StageName.DIRECT_TOOL, StageResult.toolFailure(dispatch.getToolName(), message));
            }
            case SUCCESS -> {
                notes.add("Direct tool " + dispatch.getToolName() + " found no rows; answered through the AI workflow");
                context.record(StageName.DIRECT_TOOL, StageResult.tool(dispatch.getToolName(), dispatch.getResult()));
            }
        }
        return new DirectAttempt(ExecutionPath.AI_WORKFLOW_FALLBACK, runFallback(context));
    }

    /**
     * One generated query from the question and persona context, then evaluation.
     */
    private PipelineOutcome runFallback(StageContext context) {
        SessionTrace.current().ifPresent(t -> t.stageTransition(StageName.DIRECT_TOOL.getKey(),
                StageName.FALLBACK_QUERY.getKey()));
        String prompt = "PERSONA CONTEXT:\n" + personaCatalog.content(context.getPersona())
                + "\n\nUSER QUESTION: " + context.getQuestion()
                + "\n\nMatch product names and codes loosely (LIKE, partial codes) since an exact lookup found nothing.";
        try {
            QueryResult result = queryRunner.run(StageName.FALLBACK_QUERY.getKey(), prompt);
            context.record(StageName.FALLBACK_QUERY, StageResult.rows(result.executedQuery(), result.rows()));
        } catch (StoreQueryException e) {
            log.error("Fallback query failed: {}", e.getMessage());
            SessionTrace.current().ifPresent(t -> t.error(e.getKind().getLabel(), StageName.FALLBACK_QUERY.getKey(),
                    e.getMessage()));
            context.record(StageName.FALLBACK_QUERY, StageResult.failure(null, e.getMessage()));
            context.record(StageName.EVALUATION, StageResult.evaluation(LocalEvaluation.storeFailure(
                    context.getQuestion(), StageName.FALLBACK_QUERY.getKey(), e.getMessage(), 0)));
            return PipelineOutcome.degraded(e.describe());
        }
        evaluate(context);
        return PipelineOutcome.complete();
    }

    private void evaluate(StageContext context) {
        SessionTrace.current().ifPresent(t -> t.stageTransition("data", StageName.EVALUATION.getKey()));
        Map<String, StageResult> outputs = context.asMap();
        EvaluationResult evaluation = LocalEvaluation.guarded(evaluator, context.getQuestion(), context.getPersona(), outputs);
        context.record(StageName.EVALUATION, StageResult.evaluation(evaluation));
    }
}
