package com.di.tripstar.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method for automatic start/complete/fail event logging.
 *
 * When a method is annotated with @LogTransaction, the TransactionEventAspect
 * will automatically:
 * - Log {@code <eventType>_STARTED} before method execution
 * - Log {@code <eventType>_COMPLETED} with duration after successful execution
 * - Log {@code <eventType>_FAILED} with the error category if an exception occurs
 * - Use the run id from MDC ({@code jobId}) as the transaction id
 *
 * Example:
 * <pre>
 * {@code
 * @LogTransaction(
 *     eventType = "TRIP_EXTRACT",
 *     transactionContext = "raw_extract",
 *     parameterNames = {"sourceUri"}
 * )
 * public RawTripTable extract(String sourceUri) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogTransaction {

    /**
     * The event type prefix (e.g., "TRIP_EXTRACT" will generate
     * "TRIP_EXTRACT_STARTED", "TRIP_EXTRACT_COMPLETED", "TRIP_EXTRACT_FAILED").
     */
    String eventType();

    /** What is being performed (e.g., "raw_extract", "dimension_build", "warehouse_load"). */
    String transactionContext() default "";

    /**
     * Names given, positionally, to the method arguments included in the event context.
     * If empty, no arguments are included.
     */
    String[] parameterNames() default {};

    /** MDC key holding the transaction id. */
    String transactionIdKey() default "jobId";
}
