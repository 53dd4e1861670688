package org.carball.insight.ai;

/**
 * Single-turn access to a chat model.
 */
public interface ChatGateway {

    /**
     * Returns the model's text reply.
     *
     * @throws LlmException if the call fails or produces no content
     */
    String complete(ChatRequest request);
}
