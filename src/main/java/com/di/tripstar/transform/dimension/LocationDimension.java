package com.di.tripstar.transform.dimension;

import com.di.tripstar.model.Coordinate;
import com.di.tripstar.model.LocationDimRow;
import com.di.tripstar.model.TripRecord;
import com.di.tripstar.warehouse.ColumnDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.di.tripstar.warehouse.ColumnDefinition.required;
import static com.di.tripstar.warehouse.ColumnType.FLOAT64;
import static com.di.tripstar.warehouse.ColumnType.INT64;

/**
 * Shared shape of the pickup and dropoff location dimensions; subclasses pick
 * the coordinate and the column prefix.
 */
abstract class LocationDimension implements DimensionDefinition<Coordinate, LocationDimRow> {

    private final String                 table;
    private final String                 keyColumn;
    private final String                 latitudeColumn;
    private final String                 longitudeColumn;
    private final List<ColumnDefinition> columns;

    LocationDimension(String prefix) {
        this.table           = prefix + "_location_dim";
        this.keyColumn       = prefix + "_location_id";
        this.latitudeColumn  = prefix + "_latitude";
        this.longitudeColumn = prefix + "_longitude";
        this.columns = List.of(
                required(keyColumn, INT64),
                required(latitudeColumn, FLOAT64),
                required(longitudeColumn, FLOAT64));
    }

    @Override
    public String tableName() {
        return table;
    }

    @Override
    public String keyColumn() {
        return keyColumn;
    }

    @Override
    public LocationDimRow toRow(long surrogateKey, TripRecord first) {
        Coordinate c = naturalKey(first);
        return LocationDimRow.builder()
                .locationId(surrogateKey)
                .latitude(c.latitude())
                .longitude(c.longitude())
                .build();
    }

    @Override
    public List<ColumnDefinition> columns() {
        return columns;
    }

    @Override
    public Map<String, Object> toColumns(LocationDimRow row) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(keyColumn, row.getLocationId());
        m.put(latitudeColumn, row.getLatitude());
        m.put(longitudeColumn, row.getLongitude());
        return m;
    }
}
