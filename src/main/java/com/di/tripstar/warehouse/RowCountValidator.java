package com.di.tripstar.warehouse;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.TableResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Row-count reconciliation between what the pipeline computed and what the
 * warehouse holds.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RowCountValidator {

    private final BigQuery bigQuery;

    /**
     * Counts {@code table} in BigQuery and reconciles it with {@code expectedRows}.
     *
     * @param tolerancePct acceptable deviation in percent (0 = exact)
     */
    public ValidationResult validateTable(WarehouseTarget target, String table,
                                          long expectedRows, double tolerancePct) {
        long actual = countRows(target, table);
        return reconcile(table, expectedRows, actual, tolerancePct);
    }

    public ValidationResult reconcile(String table, long expected, long actual, double tolerancePct) {
        long    delta    = actual - expected;
        double  deltaPct = expected == 0 ? (actual == 0 ? 0.0 : 100.0)
                         : Math.abs(delta) / (double) expected * 100.0;
        boolean passed   = deltaPct <= tolerancePct;

        String detail = String.format(
                "%s: expected=%d actual=%d delta=%+d (%.2f%% vs tolerance %.2f%%) %s",
                table, expected, actual, delta, deltaPct, tolerancePct,
                passed ? "PASS" : "FAIL");

        if (passed) {
            log.info("[VALIDATE] {}", detail);
        } else {
            log.warn("[VALIDATE] {}", detail);
        }

        return ValidationResult.builder()
                .table(table)
                .expectedRows(expected)
                .actualRows(actual)
                .deltaRows(delta)
                .deltaPct(deltaPct)
                .tolerancePct(tolerancePct)
                .passed(passed)
                .detail(detail)
                .build();
    }

    long countRows(WarehouseTarget target, String table) {
        String sql = "SELECT COUNT(*) AS cnt FROM " + target.qualified(table);
        try {
            QueryJobConfiguration cfg = QueryJobConfiguration.newBuilder(sql)
                    .setUseLegacySql(false)
                    .build();
            TableResult result = bigQuery.query(cfg);
            long cnt = result.iterateAll().iterator().next().get("cnt").getLongValue();
            log.debug("[VALIDATE] BigQuery count {} = {}", target.qualified(table), cnt);
            return cnt;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("BigQuery count interrupted for " + target.qualified(table), e);
        }
    }
}
