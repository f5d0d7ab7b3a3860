package com.di.tripstar.warehouse;

import com.di.tripstar.aspect.LogTransaction;
import com.di.tripstar.config.TripStarProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.RetryOption;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.FormatOptions;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableDataWriteChannel;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import com.google.cloud.bigquery.TimePartitioning;
import com.google.cloud.bigquery.WriteChannelConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.threeten.bp.Duration;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Full-refresh loader backed by a BigQuery <em>load job</em> (not streaming inserts).
 *
 * <h3>Steps per table</h3>
 * <ol>
 *   <li>Create the table with its explicit schema if it does not exist
 *       (optionally DAY-partitioned on a DATETIME column).</li>
 *   <li>Upload the rows as newline-delimited JSON through a write channel with
 *       {@code WRITE_TRUNCATE}, so the previous contents are replaced.</li>
 *   <li>Wait for the job, bounded by {@code tripstar.warehouse.load-timeout}.</li>
 *   <li>Reconcile the job's output row count against the rows sent.</li>
 * </ol>
 */
@Service
@Slf4j
public class BigQueryWarehouseLoader implements WarehouseLoader {

    /** BigQuery DATETIME literal; fractional seconds only when present, up to microseconds. */
    static final DateTimeFormatter DATETIME_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.MICRO_OF_SECOND, 0, 6, true)
            .optionalEnd()
            .toFormatter();

    private final BigQuery           bigQuery;
    private final TripStarProperties properties;
    private final ObjectMapper       om = new ObjectMapper();

    public BigQueryWarehouseLoader(BigQuery bigQuery, TripStarProperties properties) {
        this.bigQuery   = bigQuery;
        this.properties = properties;
    }

    @Override
    @LogTransaction(
            eventType = "WAREHOUSE_LOAD",
            transactionContext = "warehouse_load",
            parameterNames = {"target", "table"})
    public TableLoadResult load(WarehouseTarget target, WarehouseTable table) {
        long    startMs = System.currentTimeMillis();
        TableId tableId = target.tableId(table.getName());

        log.info("[LOAD] {} rows -> {}.{}.{}",
                 table.rowCount(), target.getProject(), target.getDataset(), table.getName());

        try {
            boolean created = ensureTable(tableId, table);
            Job     job     = writeRows(target, tableId, table);

            JobStatistics.LoadStatistics stats = job.getStatistics();
            long outputRows = stats != null && stats.getOutputRows() != null ? stats.getOutputRows() : 0L;

            if (outputRows != table.rowCount()) {
                throw new WarehouseLoadException(table.getName(), String.format(
                        "Row count mismatch for %s: sent=%d loaded=%d",
                        table.getName(), table.rowCount(), outputRows));
            }

            long durationMs = System.currentTimeMillis() - startMs;
            log.info("[LOAD] {} complete: rows={} created={} job={} in {} ms",
                     table.getName(), outputRows, created, job.getJobId().getJob(), durationMs);

            return TableLoadResult.builder()
                    .tableName(table.getName())
                    .jobId(job.getJobId().getJob())
                    .created(created)
                    .expectedRows(table.rowCount())
                    .loadedRows(outputRows)
                    .durationMs(durationMs)
                    .build();
        } catch (BigQueryException e) {
            throw new WarehouseLoadException(table.getName(),
                    "BigQuery rejected load of " + table.getName() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new WarehouseLoadException(table.getName(),
                    "Upload to BigQuery failed for " + table.getName() + ": " + e.getMessage(), e);
        }
    }

    /** Creates the table when absent; returns {@code true} if it was created. */
    private boolean ensureTable(TableId tableId, WarehouseTable table) {
        Table existing = bigQuery.getTable(tableId);
        if (existing != null) {
            return false;
        }

        StandardTableDefinition.Builder definition = StandardTableDefinition.newBuilder()
                .setSchema(table.schema());
        if (table.getPartitionColumn() != null) {
            definition.setTimePartitioning(TimePartitioning.newBuilder(TimePartitioning.Type.DAY)
                    .setField(table.getPartitionColumn())
                    .build());
        }

        bigQuery.create(TableInfo.of(tableId, definition.build()));
        log.info("[LOAD] created table {} (partitionColumn={})",
                 tableId.getTable(), table.getPartitionColumn());
        return true;
    }

    private Job writeRows(WarehouseTarget target, TableId tableId, WarehouseTable table) throws IOException {
        WriteChannelConfiguration config = WriteChannelConfiguration.newBuilder(tableId)
                .setFormatOptions(FormatOptions.json())
                .setSchema(table.schema())
                .setWriteDisposition(JobInfo.WriteDisposition.WRITE_TRUNCATE)
                .setCreateDisposition(JobInfo.CreateDisposition.CREATE_NEVER)
                .setIgnoreUnknownValues(false)
                .setMaxBadRecords(0)
                .build();

        String jobName = "tripstar-" + table.getName().replace('_', '-') + "-"
                + UUID.randomUUID().toString().substring(0, 8);
        JobId.Builder jobId = JobId.newBuilder().setJob(jobName).setProject(target.getProject());
        String location = properties.getWarehouse().getLocation();
        if (location != null && !location.isBlank()) {
            jobId.setLocation(location);
        }

        TableDataWriteChannel writer = bigQuery.writer(jobId.build(), config);
        try (OutputStream out = Channels.newOutputStream(writer)) {
            for (Map<String, Object> row : table.getRows()) {
                out.write(toJsonLine(row));
            }
        }

        Job job = writer.getJob();
        log.info("[LOAD] BigQuery load job submitted: {}", jobName);

        try {
            long timeoutSec = properties.getWarehouse().getLoadTimeout().getSeconds();
            job = job.waitFor(RetryOption.totalTimeout(Duration.ofSeconds(timeoutSec)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WarehouseLoadException(table.getName(),
                    "Interrupted waiting for BigQuery job " + jobName, e);
        }

        if (job == null) {
            throw new WarehouseLoadException(table.getName(),
                    "BigQuery job timed out or no longer exists: " + jobName);
        }
        if (job.getStatus().getError() != null) {
            BigQueryError err = job.getStatus().getError();
            throw new WarehouseLoadException(table.getName(),
                    "BigQuery load failed [" + jobName + "]: " + err.getMessage());
        }
        return job;
    }

    private byte[] toJsonLine(Map<String, Object> row) throws JsonProcessingException {
        Map<String, Object> json = new LinkedHashMap<>(row.size());
        for (Map.Entry<String, Object> e : row.entrySet()) {
            Object v = e.getValue();
            json.put(e.getKey(), v instanceof LocalDateTime ldt ? DATETIME_FORMAT.format(ldt) : v);
        }
        return (om.writeValueAsString(json) + "\n").getBytes(StandardCharsets.UTF_8);
    }
}
