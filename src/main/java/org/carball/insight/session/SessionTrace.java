package org.carball.insight.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered event log for one request. Each event is also written as a JSON line to the
 * {@code org.carball.insight.session} logger.
 *
 * <p>A trace is bound to the calling thread between {@link #open} and {@link #close()} so that
 * collaborators deep in the call chain (the chat gateway, the store) can record against it.
 */
@Slf4j
public class SessionTrace implements AutoCloseable {

    private static final Logger SESSION_LOG = LoggerFactory.getLogger("org.carball.insight.session");
    private static final ThreadLocal<SessionTrace> CURRENT = new ThreadLocal<>();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    // USD per 1K tokens
    private static final double PROMPT_COST_PER_1K = 0.005;
    private static final double COMPLETION_COST_PER_1K = 0.015;

    @Getter
    private final String requestId;
    private final long startNanos;
    private final List<SessionEvent> events = new ArrayList<>();
    private final SessionTrace previous;

    private int apiCalls;
    private long totalTokens;
    private double estimatedCost;
    private long compressionSavings;

    private SessionTrace(String requestId, String question) {
        this.requestId = requestId;
        this.startNanos = System.nanoTime();
        this.previous = CURRENT.get();
        record(SessionEventType.SESSION_START, data("question", question));
    }

    /**
     * Starts a trace and binds it, and its request id in the MDC, to the current thread.
     */
    public static SessionTrace open(String requestId, String question) {
        SessionTrace trace = new SessionTrace(requestId, question);
        CURRENT.set(trace);
        MDC.put("requestId", requestId);
        return trace;
    }

    public static Optional<SessionTrace> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public void classification(String persona, String strategy, double confidence, boolean defaulted) {
        record(SessionEventType.INTENT_CLASSIFICATION, data(
                "persona", persona,
                "execution_strategy", strategy,
                "confidence", confidence,
                "defaulted", defaulted));
    }

    public void dispatch(String outcome, String toolName) {
        record(SessionEventType.DIRECT_DISPATCH, data("outcome", outcome, "tool", toolName));
    }

    public void sqlExecution(String stage, String sql, long executionMs, int rowCount) {
        record(SessionEventType.SQL_EXECUTION, data(
                "stage", stage,
                "sql", sql,
                "execution_time_ms", executionMs,
                "result_count", rowCount));
    }

    public void compression(String stage, int originalSize, int compressedSize) {
        long saved = Math.max(0, originalSize - compressedSize);
        compressionSavings += saved;
        double ratio = originalSize == 0 ? 1.0 : (double) compressedSize / originalSize;
        record(SessionEventType.DATA_COMPRESSION, data(
                "stage", stage,
                "original_size", originalSize,
                "compressed_size", compressedSize,
                "compression_ratio", Math.round(ratio * 1000) / 1000.0,
                "chars_saved", saved));
    }

    public void apiCall(String purpose, String model, long promptTokens, long completionTokens) {
        double cost = estimateCost(promptTokens, completionTokens);
        apiCalls++;
        totalTokens += promptTokens + completionTokens;
        estimatedCost += cost;
        record(SessionEventType.API_CALL, data(
                "purpose", purpose,
                "model", model,
                "prompt_tokens", promptTokens,
                "completion_tokens", completionTokens,
                "total_tokens", promptTokens + completionTokens,
                "estimated_cost", cost));
    }

    public void stageTransition(String from, String to) {
        record(SessionEventType.STAGE_TRANSITION, data("from", from, "to", to));
    }

    public void error(String kind, String context, String message) {
        record(SessionEventType.ERROR, data("kind", kind, "context", context, "message", message));
    }

    public void end(String executionPath, boolean degraded) {
        record(SessionEventType.SESSION_END, data(
                "execution_path", executionPath,
                "degraded", degraded,
                "api_calls", apiCalls,
                "total_tokens", totalTokens,
                "estimated_cost", estimatedCost,
                "compression_savings", compressionSavings));
    }

    public List<SessionEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<SessionEvent> eventsOf(SessionEventType type) {
        List<SessionEvent> matching = new ArrayList<>();
        for (SessionEvent event : events) {
            if (event.type() == type) {
                matching.add(event);
            }
        }
        return matching;
    }

    public int getApiCalls() {
        return apiCalls;
    }

    public long getTotalTokens() {
        return totalTokens;
    }

    public double getEstimatedCost() {
        return estimatedCost;
    }

    /**
     * Human-readable timeline of the session.
     */
    public String render() {
        StringBuilder trace = new StringBuilder();
        trace.append("Session ").append(requestId).append('\n');
        for (SessionEvent event : events) {
            Map<String, Object> d = event.data();
            trace.append(String.format("[%6dms] ", event.elapsedMs()));
            switch (event.type()) {
                case SESSION_START -> trace.append("START: ").append(d.get("question"));
                case INTENT_CLASSIFICATION -> trace.append("INTENT: ").append(d.get("persona"))
                        .append(" / ").append(d.get("execution_strategy"))
                        .append(" (confidence ").append(d.get("confidence")).append(')');
                case DIRECT_DISPATCH -> trace.append("DISPATCH: ").append(d.get("outcome"));
                case SQL_EXECUTION -> trace.append("SQL ").append(d.get("stage")).append(": ")
                        .append(d.get("result_count")).append(" rows in ")
                        .append(d.get("execution_time_ms")).append("ms");
                case DATA_COMPRESSION -> trace.append("COMPRESS ").append(d.get("stage")).append(": ")
                        .append(d.get("original_size")).append(" -> ").append(d.get("compressed_size"))
                        .append(" chars");
                case API_CALL -> trace.append("API ").append(d.get("purpose")).append(": ")
                        .append(d.get("total_tokens")).append(" tokens ($")
                        .append(String.format("%.4f", (Double) d.get("estimated_cost"))).append(')');
                case STAGE_TRANSITION -> trace.append("STAGE: ").append(d.get("from"))
                        .append(" -> ").append(d.get("to"));
                case ERROR -> trace.append("ERROR ").append(d.get("kind")).append(" in ")
                        .append(d.get("context")).append(": ").append(d.get("message"));
                case SESSION_END -> trace.append("END: ").append(d.get("execution_path"))
                        .append(", ").append(totalTokens).append(" tokens, $")
                        .append(String.format("%.4f", estimatedCost));
            }
            trace.append('\n');
        }
        return trace.toString();
    }

    /**
     * Unbinds the trace from the current thread, restoring any outer trace.
     */
    @Override
    public void close() {
        if (previous != null) {
            CURRENT.set(previous);
            MDC.put("requestId", previous.requestId);
        } else {
            CURRENT.remove();
            MDC.remove("requestId");
        }
    }

    static double estimateCost(long promptTokens, long completionTokens) {
        return (promptTokens / 1000.0) * PROMPT_COST_PER_1K + (completionTokens / 1000.0) * COMPLETION_COST_PER_1K;
    }

    private void record(SessionEventType type, Map<String, Object> data) {
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        SessionEvent event = new SessionEvent(requestId, type, elapsedMs, data);
        events.add(event);
        if (SESSION_LOG.isInfoEnabled()) {
            try {
                SESSION_LOG.info(MAPPER.writeValueAsString(event));
            } catch (JsonProcessingException e) {
                log.warn("Could not serialize session event {}: {}", type, e.getMessage());
            }
        }
    }

    private static Map<String, Object> data(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
