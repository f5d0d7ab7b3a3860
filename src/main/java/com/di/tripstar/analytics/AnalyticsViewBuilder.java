package com.di.tripstar.analytics;

import com.di.tripstar.aspect.LogTransaction;
import com.di.tripstar.config.TripStarProperties;
import com.di.tripstar.transform.dimension.DatetimeDimension;
import com.di.tripstar.transform.dimension.DropoffLocationDimension;
import com.di.tripstar.transform.dimension.PassengerCountDimension;
import com.di.tripstar.transform.dimension.PaymentTypeDimension;
import com.di.tripstar.transform.dimension.PickupLocationDimension;
import com.di.tripstar.transform.dimension.RateCodeDimension;
import com.di.tripstar.transform.dimension.TripDistanceDimension;
import com.di.tripstar.transform.fact.FactTable;
import com.di.tripstar.warehouse.RowCountValidator;
import com.di.tripstar.warehouse.ValidationResult;
import com.di.tripstar.warehouse.WarehouseTarget;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.QueryJobConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rebuilds {@code tbl_analytics} inside BigQuery from the loaded star schema and
 * reconciles its row count.
 *
 * <p>All joins are INNER: every fact row is expected to resolve, so the table
 * holds exactly one row per fact and a shortfall shows up in the count check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsViewBuilder {

    public static final String TABLE = "tbl_analytics";

    private final BigQuery           bigQuery;
    private final RowCountValidator  rowCountValidator;
    private final TripStarProperties properties;

    public String renderSql(WarehouseTarget t) {
        return "CREATE OR REPLACE TABLE " + t.qualified(TABLE) + " AS\n"
             + "SELECT\n"
             + "  f.trip_id,\n"
             + "  f.VendorID,\n"
             + "  dt.tpep_pickup_datetime,\n"
             + "  dt.tpep_dropoff_datetime,\n"
             + "  pc.passenger_count,\n"
             + "  td.trip_distance,\n"
             + "  rc.rate_code_name,\n"
             + "  pl.pickup_latitude,\n"
             + "  pl.pickup_longitude,\n"
             + "  dl.dropoff_latitude,\n"
             + "  dl.dropoff_longitude,\n"
             + "  pt.payment_type_name,\n"
             + "  f.fare_amount,\n"
             + "  f.extra,\n"
             + "  f.mta_tax,\n"
             + "  f.tip_amount,\n"
             + "  f.tolls_amount,\n"
             + "  f.improvement_surcharge,\n"
             + "  f.total_amount\n"
             + "FROM " + t.qualified(FactTable.TABLE) + " f\n"
             + "INNER JOIN " + t.qualified(DatetimeDimension.TABLE) + " dt ON f.datetime_id = dt.datetime_id\n"
             + "INNER JOIN " + t.qualified(PassengerCountDimension.TABLE) + " pc ON f.passenger_count_id = pc.passenger_count_id\n"
             + "INNER JOIN " + t.qualified(TripDistanceDimension.TABLE) + " td ON f.trip_distance_id = td.trip_distance_id\n"
             + "INNER JOIN " + t.qualified(RateCodeDimension.TABLE) + " rc ON f.rate_code_id = rc.rate_code_id\n"
             + "INNER JOIN " + t.qualified(PickupLocationDimension.TABLE) + " pl ON f.pickup_location_id = pl.pickup_location_id\n"
             + "INNER JOIN " + t.qualified(DropoffLocationDimension.TABLE) + " dl ON f.dropoff_location_id = dl.dropoff_location_id\n"
             + "INNER JOIN " + t.qualified(PaymentTypeDimension.TABLE) + " pt ON f.payment_type_id = pt.payment_type_id";
    }

    /**
     * Runs the CREATE OR REPLACE statement, then counts the result.
     *
     * @param expectedRows rows the in-process join produced for this run
     */
    @LogTransaction(
            eventType = "ANALYTICS_BUILD",
            transactionContext = "analytics_view",
            parameterNames = {"target", "expectedRows"})
    public ValidationResult materialize(WarehouseTarget target, long expectedRows) {
        String sql = renderSql(target);
        log.info("[ANALYTICS] rebuilding {}", target.qualified(TABLE));
        log.debug("[ANALYTICS] SQL:\n{}", sql);

        QueryJobConfiguration config = QueryJobConfiguration.newBuilder(sql)
                .setUseLegacySql(false)
                .build();
        try {
            bigQuery.query(config);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while building " + TABLE, e);
        }

        return rowCountValidator.validateTable(target, TABLE, expectedRows,
                properties.getWarehouse().getRowCountTolerancePct());
    }
}
