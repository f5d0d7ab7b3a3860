package com.di.tripstar.report;

import com.di.tripstar.report.dto.HourlyAverageFare;
import com.di.tripstar.report.dto.PassengerCountTrips;
import com.di.tripstar.report.dto.PickupLocationTrips;
import com.di.tripstar.transform.dimension.DatetimeDimension;
import com.di.tripstar.transform.dimension.PassengerCountDimension;
import com.di.tripstar.transform.dimension.PickupLocationDimension;
import com.di.tripstar.transform.fact.FactTable;
import com.di.tripstar.warehouse.WarehouseTarget;
import com.di.tripstar.warehouse.WarehouseTargetResolver;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.QueryParameterValue;
import com.google.cloud.bigquery.TableResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Analytical queries over the loaded star schema.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripReportService {

    public static final int MAX_LIMIT = 1000;

    private final BigQuery                bigQuery;
    private final WarehouseTargetResolver targetResolver;

    /** Pickup locations with the most trips. */
    public List<PickupLocationTrips> topPickupLocations(int limit) {
        WarehouseTarget t = targetResolver.resolveDefault();
        String sql = "SELECT a.pickup_location_id, a.pickup_latitude, a.pickup_longitude, COUNT(*) AS trips\n"
                   + "FROM " + t.qualified(PickupLocationDimension.TABLE) + " a\n"
                   + "JOIN " + t.qualified(FactTable.TABLE) + " b ON a.pickup_location_id = b.pickup_location_id\n"
                   + "GROUP BY a.pickup_location_id, a.pickup_latitude, a.pickup_longitude\n"
                   + "ORDER BY trips DESC, a.pickup_location_id\n"
                   + "LIMIT @limit";
        return run(withLimit(sql, limit), row -> PickupLocationTrips.builder()
                .pickupLocationId(row.get("pickup_location_id").getLongValue())
                .pickupLatitude(row.get("pickup_latitude").getDoubleValue())
                .pickupLongitude(row.get("pickup_longitude").getDoubleValue())
                .trips(row.get("trips").getLongValue())
                .build());
    }

    /** Trip totals per passenger count. */
    public List<PassengerCountTrips> tripsByPassengerCount(int limit) {
        WarehouseTarget t = targetResolver.resolveDefault();
        String sql = "SELECT a.passenger_count, COUNT(*) AS total_number_trips\n"
                   + "FROM " + t.qualified(PassengerCountDimension.TABLE) + " a\n"
                   + "JOIN " + t.qualified(FactTable.TABLE) + " b ON a.passenger_count_id = b.passenger_count_id\n"
                   + "GROUP BY a.passenger_count\n"
                   + "ORDER BY total_number_trips DESC, a.passenger_count\n"
                   + "LIMIT @limit";
        return run(withLimit(sql, limit), row -> PassengerCountTrips.builder()
                .passengerCount((int) row.get("passenger_count").getLongValue())
                .totalNumberTrips(row.get("total_number_trips").getLongValue())
                .build());
    }

    /** Average fare per pickup hour, highest first. */
    public List<HourlyAverageFare> averageFareByHour() {
        WarehouseTarget t = targetResolver.resolveDefault();
        String sql = "SELECT a.pick_hour, AVG(b.fare_amount) AS avg_fare_amount\n"
                   + "FROM " + t.qualified(DatetimeDimension.TABLE) + " a\n"
                   + "JOIN " + t.qualified(FactTable.TABLE) + " b ON a.datetime_id = b.datetime_id\n"
                   + "GROUP BY a.pick_hour\n"
                   + "ORDER BY avg_fare_amount DESC";
        QueryJobConfiguration cfg = QueryJobConfiguration.newBuilder(sql).setUseLegacySql(false).build();
        return run(cfg, row -> HourlyAverageFare.builder()
                .pickHour((int) row.get("pick_hour").getLongValue())
                .avgFareAmount(row.get("avg_fare_amount").getDoubleValue())
                .build());
    }

    private QueryJobConfiguration withLimit(String sql, int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
        return QueryJobConfiguration.newBuilder(sql)
                .setUseLegacySql(false)
                .addNamedParameter("limit", QueryParameterValue.int64(limit))
                .build();
    }

    private <T> List<T> run(QueryJobConfiguration cfg, Function<FieldValueList, T> mapper) {
        log.debug("[REPORT] SQL:\n{}", cfg.getQuery());
        TableResult result;
        try {
            result = bigQuery.query(cfg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running report query", e);
        }
        List<T> out = new ArrayList<>();
        for (FieldValueList row : result.iterateAll()) {
            out.add(mapper.apply(row));
        }
        log.info("[REPORT] {} row(s)", out.size());
        return out;
    }
}
