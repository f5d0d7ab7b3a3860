package com.di.tripstar.transform.dimension;

import com.di.tripstar.model.TripDistanceDimRow;
import com.di.tripstar.model.TripRecord;
import com.di.tripstar.warehouse.ColumnDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.di.tripstar.warehouse.ColumnDefinition.required;
import static com.di.tripstar.warehouse.ColumnType.FLOAT64;
import static com.di.tripstar.warehouse.ColumnType.INT64;

/** {@code trip_distance_dim}. */
public final class TripDistanceDimension implements DimensionDefinition<Double, TripDistanceDimRow> {

    public static final TripDistanceDimension INSTANCE = new TripDistanceDimension();

    public static final String TABLE      = "trip_distance_dim";
    public static final String KEY_COLUMN = "trip_distance_id";

    private static final List<ColumnDefinition> COLUMNS = List.of(
            required(KEY_COLUMN, INT64),
            required("trip_distance", FLOAT64));

    private TripDistanceDimension() {}

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public String keyColumn() {
        return KEY_COLUMN;
    }

    @Override
    public Double naturalKey(TripRecord record) {
        return record.getTripDistance();
    }

    @Override
    public TripDistanceDimRow toRow(long surrogateKey, TripRecord first) {
        return TripDistanceDimRow.builder()
                .tripDistanceId(surrogateKey)
                .tripDistance(first.getTripDistance())
                .build();
    }

    @Override
    public List<ColumnDefinition> columns() {
        return COLUMNS;
    }

    @Override
    public Map<String, Object> toColumns(TripDistanceDimRow row) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(KEY_COLUMN, row.getTripDistanceId());
        m.put("trip_distance", row.getTripDistance());
        return m;
    }
}
