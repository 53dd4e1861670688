package org.carball.insight.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.carball.insight.config.InsightConfig;
import org.carball.insight.session.SessionTrace;

import java.time.Duration;

/**
 * {@link ChatGateway} backed by the OpenAI chat completions API.
 */
@Slf4j
public class OpenAiChatGateway implements ChatGateway {

    private final OpenAIClient openAiClient;
    private final String model;
    private final double temperature;

    public OpenAiChatGateway(InsightConfig config) {
        this.model = config.getModel();
        this.temperature = config.getTemperature();

        if (!"true".equals(System.getProperty("skip.ai")) && config.isAiConfigured()) {
            OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder()
                    .apiKey(config.getOpenAiApiKey())
                    .timeout(Duration.ofSeconds(config.getLlmTimeoutSeconds()))
                    .maxRetries(config.getLlmMaxRetries());
            if (config.getOpenAiBaseUrl() != null && !config.getOpenAiBaseUrl().isBlank()) {
                builder.baseUrl(config.getOpenAiBaseUrl());
            }
            this.openAiClient = builder.build();
        } else {
            this.openAiClient = null;
        }
    }

    public boolean isEnabled() {
        return openAiClient != null;
    }

    @Override
    public String complete(ChatRequest request) {
        if (openAiClient == null) {
            throw new LlmException("AI calls are disabled (skip.ai=true or no API key)");
        }

        ChatCompletionCreateParams.Builder params = ChatCompletionCreateParams.builder()
                .model(model)
                .addSystemMessage(request.systemPrompt())
                .addUserMessage(request.userPrompt())
                .temperature(temperature)
                .maxCompletionTokens(request.maxTokens());
        if (request.jsonMode()) {
            params.responseFormat(ResponseFormatJsonObject.builder().build());
        }

        log.debug("Sending {} request to OpenAI (model {}, {} prompt chars)",
                request.purpose(), model, request.userPrompt().length());
        log.trace("Full user prompt:\n{}", request.userPrompt());

        ChatCompletion completion;
        try {
            completion = openAiClient.chat().completions().create(params.build());
        } catch (RuntimeException e) {
            log.warn("OpenAI {} call failed: {}", request.purpose(), e.getMessage());
            throw new LlmException("OpenAI call failed: " + e.getMessage(), e);
        }

        completion.usage().ifPresent(usage -> {
            log.info("OpenAI {} used {} prompt + {} completion tokens",
                    request.purpose(), usage.promptTokens(), usage.completionTokens());
            SessionTrace.current().ifPresent(trace ->
                    trace.apiCall(request.purpose(), model, usage.promptTokens(), usage.completionTokens()));
        });

        if (completion.choices().isEmpty()) {
            throw new LlmException("OpenAI returned no choices for " + request.purpose());
        }
        String content = completion.choices().get(0).message().content().orElse("");
        if (content.isBlank()) {
            throw new LlmException("OpenAI returned an empty response for " + request.purpose());
        }

        log.trace("Raw {} response:\n{}", request.purpose(), content);
        return content;
    }
}
