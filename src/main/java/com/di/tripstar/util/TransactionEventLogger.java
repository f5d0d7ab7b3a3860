package com.di.tripstar.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured event logger for pipeline milestones.
 *
 * Each event is written as one JSON object on a single {@code [TX] EVENT:} log line,
 * carrying the application instance id, the run id (transaction id), the thread and
 * a free-form context map.
 */
@Slf4j
@Component
public class TransactionEventLogger {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

    private final String       applicationId;
    private final ObjectMapper om = new ObjectMapper();

    public TransactionEventLogger(@Value("${spring.application.name:tripstar}") String applicationName) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[TX] TransactionEventLogger initialized with applicationId: {}", applicationId);
    }

    public String getApplicationId() {
        return applicationId;
    }

    public void logEvent(String eventType, Map<String, Object> context,
                         String transactionId, String transactionContext) {
        logEvent(eventType, context, transactionId, transactionContext, null);
    }

    public void logEvent(String eventType, Map<String, Object> context,
                         String transactionId, String transactionContext, Throwable exception) {
        log.info("[TX] EVENT: {}", formatEvent(eventType, context, transactionId, transactionContext, exception));
    }

    /** Builds the JSON text for one event; package-private for tests. */
    String formatEvent(String eventType, Map<String, Object> context,
                       String transactionId, String transactionContext, Throwable exception) {
        Thread thread = Thread.currentThread();
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", ISO_FORMATTER.format(Instant.now()));
        event.put("applicationId", applicationId);
        event.put("transactionId", transactionId != null ? transactionId : "unknown");
        event.put("threadId", thread.getId());
        event.put("threadName", thread.getName());

        Map<String, Object> ctx = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        if (transactionContext != null && !transactionContext.isEmpty()) {
            ctx.put("transactionContext", transactionContext);
        }
        if (exception != null) {
            ctx.put("stackTraceSummary", getStackTraceSummary(exception, 5));
        }
        if (!ctx.isEmpty()) {
            event.put("context", ctx);
        }

        try {
            return om.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.debug("[TX] Event serialization failed, falling back to toString: {}", e.getMessage());
            return event.toString();
        }
    }

    private String getStackTraceSummary(Throwable exception, int maxLines) {
        StringBuilder sb = new StringBuilder();
        sb.append(exception.getClass().getName());
        if (exception.getMessage() != null) {
            sb.append(": ").append(exception.getMessage());
        }
        StackTraceElement[] stackTrace = exception.getStackTrace();
        for (int i = 0; i < Math.min(maxLines, stackTrace.length); i++) {
            sb.append(" | at ").append(stackTrace[i]);
        }
        return sb.toString();
    }
}
