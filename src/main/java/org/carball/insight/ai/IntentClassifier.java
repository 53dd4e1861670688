package org.carball.insight.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.insight.config.InsightConfig;
import org.carball.insight.error.ClassificationException;
import org.carball.insight.model.classification.ClassificationRecord;
import org.carball.insight.model.classification.ClassificationResponse;
import org.carball.insight.model.classification.EntityKinds;
import org.carball.insight.model.classification.ExecutionStrategy;
import org.carball.insight.persona.PersonaCatalog;

/**
 * Classifies questions with the chat model and validates the JSON it returns.
 */
@Slf4j
public class IntentClassifier implements ClassifierCapability {

    private static final String SYSTEM_PROMPT = "You are a JSON classifier. Return ONLY valid JSON, no other text.";

    private static final String CLASSIFICATION_PROMPT = """
        You are a domain-agnostic intent classifier for a data warehouse assistant.

        Available personas (business domain experts):
        %s
        Analyze this question: "%s"

        Determine:
        1. Best matching persona based on question content and domain
        2. Execution strategy
        3. Entities mentioned in the question

        Execution Strategies:
        - "single_stage": one query answers the question, or a direct lookup applies
        - "multi_stage": candidates must be found first, then analysed (discovery -> analysis -> evaluation)
        - "iterative": multiple rounds of refinement

        Entities (omit the ones that are not mentioned):
        - "%s": competitor product name or code, string or list
        - "%s": competitor brand name
        - "%s": list of product or part codes
        - "%s": finer intent such as "equivalent", "pricing", "components"

        Set "enable_evaluation" to false only when the user wants raw records, not an interpretation.

        Respond with JSON:
        {
            "intent": "descriptive intent name",
            "persona": "best_matching_persona_name",
            "confidence": 0.0-1.0,
            "execution_strategy": "single_stage|multi_stage|iterative",
            "extracted_entities": {},
            "enable_evaluation": true,
            "reasoning": "why this classification and strategy were selected",
            "actual_tables": ["table names from the selected persona"]
        }
        """;

    private final ChatGateway gateway;
    private final PersonaCatalog personaCatalog;
    private final int maxTokens;
    private final ObjectMapper objectMapper;

    public IntentClassifier(ChatGateway gateway, PersonaCatalog personaCatalog, InsightConfig config) {
        this.gateway = gateway;
        this.personaCatalog = personaCatalog;
        this.maxTokens = config.getClassificationMaxTokens();
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public ClassificationRecord classify(String question) throws ClassificationException {
        if (question == null || question.isBlank()) {
            throw new ClassificationException("Question is empty");
        }

        String prompt = String.format(CLASSIFICATION_PROMPT,
                personaCatalog.describeForClassifier(), question.replace("\"", "'"),
                EntityKinds.COMPETITOR_PRODUCT, EntityKinds.COMPETITOR_BRAND,
                EntityKinds.PRODUCT_CODES, EntityKinds.INTENT_SUBTYPE);

        String raw;
        try {
            raw = gateway.complete(new ChatRequest("intent_classification", SYSTEM_PROMPT, prompt, maxTokens, true));
        } catch (LlmException e) {
            throw new ClassificationException("Classifier unavailable: " + e.getMessage(), e);
        }

        ClassificationRecord record = parse(raw);
        log.info("Classified as {} / {} (confidence {})",
                record.persona(), record.executionStrategy().getValue(), record.confidence());
        return record;
    }

    /**
     * Parses and validates the model's JSON. Persona must be present and known.
     */
    ClassificationRecord parse(String raw) throws ClassificationException {
        ClassificationResponse response;
        try {
            response = objectMapper.readValue(JsonPayloads.extractJsonObject(raw), ClassificationResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable classification response: {}", e.getOriginalMessage());
            log.debug("Raw classification response: {}", raw);
            throw new ClassificationException("Classification response is not valid JSON", e);
        }

        String persona = response.getPersona() == null ? null : response.getPersona().trim();
        if (persona == null || persona.isEmpty()) {
            throw new ClassificationException("Classification response has no persona");
        }
        if (!personaCatalog.hasPersona(persona)) {
            throw new ClassificationException("Unknown persona in classification: " + persona);
        }

        ExecutionStrategy strategy;
        if (response.getExecutionStrategy() == null || response.getExecutionStrategy().isBlank()) {
            strategy = ExecutionStrategy.SINGLE_STAGE;
        } else {
            try {
                strategy = ExecutionStrategy.fromString(response.getExecutionStrategy());
            } catch (IllegalArgumentException e) {
                throw new ClassificationException(e.getMessage(), e);
            }
        }

        double confidence = response.getConfidence() == null || response.getConfidence().isNaN()
                ? 0.5 : response.getConfidence();
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        return ClassificationRecord.builder()
                .intent(response.getIntent())
                .persona(persona)
                .confidence(confidence)
                .executionStrategy(strategy)
                .extractedEntities(response.getExtractedEntities())
                .enableEvaluation(response.getEnableEvaluation() == null || response.getEnableEvaluation())
                .reasoning(response.getReasoning())
                .defaulted(false)
                .build();
    }
}
