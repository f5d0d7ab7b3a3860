package com.di.tripstar.warehouse;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one full-refresh table load.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableLoadResult {

    private String  tableName;
    private String  jobId;

    /** True when the table did not exist and was created by this load. */
    private boolean created;

    private long    expectedRows;
    private long    loadedRows;
    private long    durationMs;
}
