package com.di.tripstar.warehouse;

import com.di.tripstar.util.InputValidator;
import com.google.cloud.bigquery.TableId;
import lombok.Value;

/**
 * BigQuery project and dataset that receive one pipeline run's tables.
 */
@Value
public class WarehouseTarget {

    String project;
    String dataset;

    public static WarehouseTarget of(String project, String dataset) {
        return new WarehouseTarget(
                InputValidator.validateProjectId(project),
                InputValidator.validateDatasetName(dataset));
    }

    public TableId tableId(String table) {
        return TableId.of(project, dataset, InputValidator.validateTableName(table));
    }

    /** Backtick-quoted {@code project.dataset.table} for standard SQL. */
    public String qualified(String table) {
        return "`" + project + "." + dataset + "." + InputValidator.validateTableName(table) + "`";
    }
}
