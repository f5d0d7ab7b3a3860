package com.di.tripstar.transform.dimension;

import com.di.tripstar.model.PassengerCountDimRow;
import com.di.tripstar.model.TripRecord;
import com.di.tripstar.warehouse.ColumnDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.di.tripstar.warehouse.ColumnDefinition.required;
import static com.di.tripstar.warehouse.ColumnType.INT64;

/** {@code passenger_count_dim}. */
public final class PassengerCountDimension implements DimensionDefinition<Integer, PassengerCountDimRow> {

    public static final PassengerCountDimension INSTANCE = new PassengerCountDimension();

    public static final String TABLE      = "passenger_count_dim";
    public static final String KEY_COLUMN = "passenger_count_id";

    private static final List<ColumnDefinition> COLUMNS = List.of(
            required(KEY_COLUMN, INT64),
            required("passenger_count", INT64));

    private PassengerCountDimension() {}

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public String keyColumn() {
        return KEY_COLUMN;
    }

    @Override
    public Integer naturalKey(TripRecord record) {
        return record.getPassengerCount();
    }

    @Override
    public PassengerCountDimRow toRow(long surrogateKey, TripRecord first) {
        return PassengerCountDimRow.builder()
                .passengerCountId(surrogateKey)
                .passengerCount(first.getPassengerCount())
                .build();
    }

    @Override
    public List<ColumnDefinition> columns() {
        return COLUMNS;
    }

    @Override
    public Map<String, Object> toColumns(PassengerCountDimRow row) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(KEY_COLUMN, row.getPassengerCountId());
        m.put("passenger_count", row.getPassengerCount());
        return m;
    }
}
