package com.di.tripstar.warehouse;

import lombok.Builder;
import lombok.Value;

/**
 * Row count of one warehouse table reconciled against the count the run computed.
 */
@Value
@Builder
public class ValidationResult {

    String  table;

    long    expectedRows;
    long    actualRows;

    /** {@code actualRows - expectedRows}; negative when rows went missing. */
    long    deltaRows;

    /** {@code |deltaRows| / expectedRows × 100}; 100 when nothing was expected but rows exist. */
    double  deltaPct;

    double  tolerancePct;

    boolean passed;
    String  detail;
}
