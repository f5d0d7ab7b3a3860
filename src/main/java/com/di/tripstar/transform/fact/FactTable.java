package com.di.tripstar.transform.fact;

import com.di.tripstar.model.FactRow;
import com.di.tripstar.model.RejectedRow;
import com.di.tripstar.warehouse.ColumnDefinition;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.di.tripstar.warehouse.ColumnDefinition.nullable;
import static com.di.tripstar.warehouse.ColumnDefinition.required;
import static com.di.tripstar.warehouse.ColumnType.FLOAT64;
import static com.di.tripstar.warehouse.ColumnType.INT64;
import static com.di.tripstar.warehouse.ColumnType.STRING;

/**
 * Immutable output of {@link FactBuilder}: fact rows ordered by {@code trip_id},
 * plus the trips dropped for unresolved dimension keys.
 */
@Value
public class FactTable {

    public static final String TABLE = "fact_table";

    public static final List<ColumnDefinition> COLUMNS = List.of(
            required("trip_id", INT64),
            required("VendorID", INT64),
            required("datetime_id", INT64),
            required("passenger_count_id", INT64),
            required("trip_distance_id", INT64),
            required("rate_code_id", INT64),
            nullable("store_and_fwd_flag", STRING),
            required("pickup_location_id", INT64),
            required("dropoff_location_id", INT64),
            required("payment_type_id", INT64),
            required("fare_amount", FLOAT64),
            required("extra", FLOAT64),
            required("mta_tax", FLOAT64),
            required("tip_amount", FLOAT64),
            required("tolls_amount", FLOAT64),
            required("improvement_surcharge", FLOAT64),
            required("total_amount", FLOAT64));

    List<FactRow>     rows;
    List<RejectedRow> orphans;
    long              duplicatesRemoved;

    public FactTable(List<FactRow> rows, List<RejectedRow> orphans, long duplicatesRemoved) {
        this.rows              = List.copyOf(rows);
        this.orphans           = List.copyOf(orphans);
        this.duplicatesRemoved = duplicatesRemoved;
    }

    public int size() {
        return rows.size();
    }

    public static Map<String, Object> toColumns(FactRow row) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("trip_id", row.getTripId());
        m.put("VendorID", row.getVendorId());
        m.put("datetime_id", row.getDatetimeId());
        m.put("passenger_count_id", row.getPassengerCountId());
        m.put("trip_distance_id", row.getTripDistanceId());
        m.put("rate_code_id", row.getRateCodeId());
        m.put("store_and_fwd_flag", row.getStoreAndFwdFlag());
        m.put("pickup_location_id", row.getPickupLocationId());
        m.put("dropoff_location_id", row.getDropoffLocationId());
        m.put("payment_type_id", row.getPaymentTypeId());
        m.put("fare_amount", row.getFareAmount());
        m.put("extra", row.getExtra());
        m.put("mta_tax", row.getMtaTax());
        m.put("tip_amount", row.getTipAmount());
        m.put("tolls_amount", row.getTollsAmount());
        m.put("improvement_surcharge", row.getImprovementSurcharge());
        m.put("total_amount", row.getTotalAmount());
        return m;
    }
}
