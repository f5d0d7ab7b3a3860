package com.di.tripstar.config;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * BigQuery and Cloud Storage clients, both on Application Default Credentials.
 *
 * <p>{@code tripstar.warehouse.project} pins the billing project of both clients;
 * when blank the project is taken from the environment. Tests and callers that
 * bring their own client beans replace these.
 */
@Slf4j
@Configuration
public class GoogleCloudClientConfig {

    @Bean
    @ConditionalOnMissingBean(BigQuery.class)
    public BigQuery bigQueryClient(TripStarProperties properties) {
        BigQueryOptions.Builder options = BigQueryOptions.newBuilder();
        String project = configuredProject(properties);
        if (project != null) {
            options.setProjectId(project);
        }
        String location = properties.getWarehouse().getLocation();
        if (location != null && !location.isBlank()) {
            options.setLocation(location.trim());
        }
        BigQuery client = options.build().getService();
        log.info("BigQuery client ready: project={} location={}", client.getOptions().getProjectId(), location);
        return client;
    }

    /** Reads raw trip files from {@code gs://} locations. */
    @Bean
    @ConditionalOnMissingBean(Storage.class)
    public Storage gcsStorage(TripStarProperties properties) {
        StorageOptions.Builder options = StorageOptions.newBuilder();
        String project = configuredProject(properties);
        if (project != null) {
            options.setProjectId(project);
        }
        return options.build().getService();
    }

    private static String configuredProject(TripStarProperties properties) {
        String project = properties.getWarehouse().getProject();
        return project != null && !project.isBlank() ? project.trim() : null;
    }
}
