package org.carball.insight.ai;

/**
 * @param purpose  label for logs and token accounting, e.g. "classify" or "evaluate"
 * @param jsonMode request a JSON object response
 */
public record ChatRequest(String purpose, String systemPrompt, String userPrompt, int maxTokens, boolean jsonMode) {
}
