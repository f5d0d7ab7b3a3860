package com.di.tripstar.exception;

import com.di.tripstar.aspect.ErrorCategory;
import com.di.tripstar.extract.TripInputException;
import com.di.tripstar.pipeline.ConcurrentRunException;
import com.di.tripstar.util.TransactionEventLogger;
import com.google.cloud.bigquery.BigQueryException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps exceptions escaping the REST controllers to a JSON {@link ErrorResponse}
 * carrying the {@link ErrorCategory}, and logs each one as a structured event.
 *
 * <p>Pipeline stage failures do not arrive here: a failed run is returned by the
 * controller as a normal response with status 500.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    private final TransactionEventLogger eventLogger;

    public GlobalExceptionHandler(TransactionEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    @ExceptionHandler(ConcurrentRunException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentRun(ConcurrentRunException e) {
        ErrorCategory category = ErrorCategory.VALIDATION_ERROR;
        logError("CONCURRENT_RUN_REJECTED", category, e);
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.CONFLICT);
        body.addDetail("activeRunId", e.getActiveRunId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException e) {
        ErrorCategory category = ErrorCategory.VALIDATION_ERROR;
        logError("REQUEST_VALIDATION_FAILED", category, e);
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        body.setMessage(e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; ")));
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("VALIDATION_EXCEPTION", category, e);
        return ResponseEntity.badRequest().body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(TripInputException.class)
    public ResponseEntity<ErrorResponse> handleTripInput(TripInputException e) {
        ErrorCategory category = ErrorCategory.INPUT_ERROR;
        logError("INPUT_EXCEPTION", category, e);
        return ResponseEntity.unprocessableEntity().body(buildErrorResponse(category, e, HttpStatus.UNPROCESSABLE_ENTITY));
    }

    /** Report queries against a dataset that has not been loaded yet land here (404 from BigQuery). */
    @ExceptionHandler(BigQueryException.class)
    public ResponseEntity<ErrorResponse> handleBigQuery(BigQueryException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("WAREHOUSE_EXCEPTION", category, e);
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.BAD_GATEWAY);
        body.addDetail("warehouseCode", e.getCode());
        if (e.getReason() != null) {
            body.addDetail("warehouseReason", e.getReason());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        String transactionId = MDC.get("jobId");
        if (transactionId == null) {
            transactionId = MDC.get("requestId");
        }
        if (transactionId == null) {
            transactionId = "global-handler-" + UUID.randomUUID().toString().substring(0, 8);
        }

        Map<String, Object> context = new HashMap<>();
        context.put("errorMessage", exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        context.put("errorType", exception.getClass().getName());
        context.put("errorCategory", category.name());
        context.put("errorCategoryDescription", category.getDescription());
        context.put("path", getRequestPath());

        eventLogger.logEvent(eventType, context, transactionId, "global_exception_handler", exception);
        log.error("GlobalExceptionHandler caught exception: {} [{}]",
                  exception.getClass().getSimpleName(), category.getName(), exception);
    }

    ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());
        return response;
    }

    private String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error body for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int    status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private Map<String, Object> details = new HashMap<>();

        public void addDetail(String key, Object value) {
            details.put(key, value);
        }
    }
}
