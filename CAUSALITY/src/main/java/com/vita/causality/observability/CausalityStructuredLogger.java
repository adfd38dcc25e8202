package com.vita.causality.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for CAUSALITY service.
 * <p>
 * Emits {@code message | data={json}} lines and keeps the reasoning session in MDC
 * so nested component logs carry it.
 */
@Slf4j
@Component
public class CausalityStructuredLogger {

    // MDC keys
    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_SYMPTOM = "symptom";
    public static final String MDC_EDGE_ID = "edgeId";

    /**
     * Log a reasoning session event. Session MDC is bound by {@link #withSession}.
     */
    public void logReasoningEvent(String sessionId, ReasoningEventType eventType,
                                  String message, Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", eventType.name());
        logData.put("sessionId", sessionId);

        if (details != null) {
            logData.putAll(details);
        }

        switch (eventType) {
            case SESSION_STARTED, HYPOTHESES_GENERATED, RESOLVED, SESSION_COMPLETED ->
                    log.info("{} | data={}", message, formatLogData(logData));
            case TOOL_OBSERVED ->
                    log.debug("{} | data={}", message, formatLogData(logData));
            case RULE_FALLBACK ->
                    log.warn("{} | data={}", message, formatLogData(logData));
            case SESSION_FAILED ->
                    log.error("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log an edge-learning event.
     */
    public void logLearningEvent(String edgeId, LearningEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_EDGE_ID, edgeId != null ? edgeId : ""))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            if (edgeId != null) {
                logData.put("edgeId", edgeId);
            }

            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case EDGE_CONFIRMED, EDGE_DISCONFIRMED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                case EDGE_CREATED, BATCH_COMPLETED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case BATCH_FAILED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    /**
     * Bind a reasoning session to the current thread.
     */
    public MDCScope withSession(String sessionId, String symptom) {
        return withContext(Map.of(MDC_SESSION_ID, sessionId, MDC_SYMPTOM, symptom));
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum ReasoningEventType {
        SESSION_STARTED, HYPOTHESES_GENERATED, TOOL_OBSERVED, RESOLVED,
        RULE_FALLBACK, SESSION_COMPLETED, SESSION_FAILED
    }

    public enum LearningEventType {
        EDGE_CONFIRMED, EDGE_DISCONFIRMED, EDGE_CREATED, BATCH_COMPLETED, BATCH_FAILED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
