package com.di.tripstar.warehouse;

import com.di.tripstar.config.TripStarProperties;
import com.google.cloud.bigquery.BigQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the {@link WarehouseTarget} for a run: configured project, falling
 * back to the BigQuery client's own project, and configured or overridden dataset.
 */
@Component
@RequiredArgsConstructor
public class WarehouseTargetResolver {

    private final TripStarProperties properties;
    private final BigQuery           bigQuery;

    public WarehouseTarget resolve(String datasetOverride) {
        String project = properties.getWarehouse().getProject();
        if (project == null || project.isBlank()) {
            project = bigQuery.getOptions().getProjectId();
        }
        String dataset = datasetOverride != null && !datasetOverride.isBlank()
                ? datasetOverride
                : properties.getWarehouse().getDataset();
        return WarehouseTarget.of(project, dataset);
    }

    public WarehouseTarget resolveDefault() {
        return resolve(null);
    }
}
