package com.di.tripstar.aspect;

import com.di.tripstar.extract.RawTripTable;
import com.di.tripstar.util.TransactionEventLogger;
import com.di.tripstar.warehouse.WarehouseTable;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Logs start, completion and failure events for methods annotated with
 * {@link LogTransaction}.
 *
 * Features:
 * - MDC support (reads the run id from {@code jobId})
 * - Positional parameter extraction for context
 * - Duration tracking
 * - Error categorization and root cause on failure
 */
@Slf4j
@Aspect
@Component
public class TransactionEventAspect {

    private final TransactionEventLogger eventLogger;

    public TransactionEventAspect(TransactionEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    @Around("@annotation(com.di.tripstar.aspect.LogTransaction)")
    public Object logTransaction(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        LogTransaction annotation = method.getAnnotation(LogTransaction.class);

        String eventType = annotation.eventType();
        String transactionContext = annotation.transactionContext();
        String transactionId = MDC.get(annotation.transactionIdKey());
        long startTime = System.currentTimeMillis();

        Map<String, Object> context = extractContext(joinPoint.getArgs(), annotation.parameterNames());

        eventLogger.logEvent(eventType + "_STARTED", context, transactionId, transactionContext);

        try {
            Object result = joinPoint.proceed();

            long durationMs = System.currentTimeMillis() - startTime;
            context.put("durationMs", durationMs);
            if (result instanceof Collection<?> c) {
                context.put("resultSize", c.size());
            }
            eventLogger.logEvent(eventType + "_COMPLETED", context, transactionId, transactionContext);
            return result;

        } catch (Throwable e) {
            long durationMs = System.currentTimeMillis() - startTime;
            ErrorCategory errorCategory = ErrorCategory.categorize(e);
            context.put("errorMessage", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            context.put("errorType", e.getClass().getSimpleName());
            context.put("errorCategory", errorCategory.name());
            context.put("durationMs", durationMs);

            Throwable rootCause = getRootCause(e);
            if (rootCause != e) {
                context.put("rootCauseType", rootCause.getClass().getSimpleName());
                context.put("rootCauseMessage", rootCause.getMessage());
            }

            eventLogger.logEvent(eventType + "_FAILED", context, transactionId, transactionContext, e);
            throw e;
        }
    }

    private Map<String, Object> extractContext(Object[] args, String[] parameterNames) {
        Map<String, Object> context = new HashMap<>();
        for (int i = 0; i < Math.min(args.length, parameterNames.length); i++) {
            if (parameterNames[i] != null && !parameterNames[i].isEmpty()) {
                context.put(parameterNames[i], describe(args[i]));
            }
        }
        return context;
    }

    /** Large stage inputs are summarized rather than rendered in full. */
    private Object describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> c) {
            return value.getClass().getSimpleName() + "[size=" + c.size() + "]";
        }
        if (value instanceof RawTripTable raw) {
            return "RawTripTable[source=" + raw.getSourceUri() + ", size=" + raw.size() + "]";
        }
        if (value instanceof WarehouseTable table) {
            return table.getName() + "[rows=" + table.rowCount() + "]";
        }
        String s = value.toString();
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }
}
