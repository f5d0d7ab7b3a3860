package com.di.tripstar.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Pipeline settings bound from {@code tripstar.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "tripstar")
public class TripStarProperties {

    private Source    source    = new Source();
    private Extract   extract   = new Extract();
    private Warehouse warehouse = new Warehouse();
    private Pipeline  pipeline  = new Pipeline();

    @Data
    public static class Source {
        /** Raw trip CSV: {@code gs://bucket/object.csv}, {@code file:///path} or a plain local path. */
        private String uri = "";
    }

    @Data
    public static class Extract {
        /** Rows rejected for null/malformed values above this count make extraction fatal. */
        private long maxRejectedRows = 1000;

        /** Rejected rows logged individually before only the summary is logged. */
        private int rejectedRowLogLimit = 20;
    }

    @Data
    public static class Warehouse {
        /** BigQuery project; blank means the client's default project. */
        private String project = "";

        private String dataset = "uber_data_engineering";

        /** Job location, e.g. US or EU. */
        private String location = "US";

        private Duration loadTimeout = Duration.ofMinutes(30);

        /** Create {@code datetime_dim} DAY-partitioned on {@code tpep_pickup_datetime}. */
        private boolean partitionDatetimeDim = false;

        /** Allowed deviation (percent) between expected and warehouse row counts. */
        private double rowCountTolerancePct = 0.0;
    }

    @Data
    public static class Pipeline {
        /** Run once when the application starts (container invoked by the orchestrator). */
        private boolean runOnStartup = false;

        /** Exit the JVM after the startup run, with status 1 if it failed. */
        private boolean exitAfterRun = false;

        /** Build the star schema without touching the warehouse. */
        private boolean dryRun = false;
    }
}
