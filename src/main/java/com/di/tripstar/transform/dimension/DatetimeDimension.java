package com.di.tripstar.transform.dimension;

import com.di.tripstar.model.DatetimeDimRow;
import com.di.tripstar.model.TripRecord;
import com.di.tripstar.model.TripWindow;
import com.di.tripstar.warehouse.ColumnDefinition;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.di.tripstar.warehouse.ColumnDefinition.required;
import static com.di.tripstar.warehouse.ColumnType.DATETIME;
import static com.di.tripstar.warehouse.ColumnType.INT64;

/**
 * {@code datetime_dim}: one row per distinct (pickup, dropoff) pair with the
 * calendar parts of both instants.
 */
public final class DatetimeDimension implements DimensionDefinition<TripWindow, DatetimeDimRow> {

    public static final DatetimeDimension INSTANCE = new DatetimeDimension();

    public static final String TABLE          = "datetime_dim";
    public static final String KEY_COLUMN     = "datetime_id";
    public static final String PICKUP_COLUMN  = "tpep_pickup_datetime";
    public static final String DROPOFF_COLUMN = "tpep_dropoff_datetime";

    private static final List<ColumnDefinition> COLUMNS = List.of(
            required(KEY_COLUMN, INT64),
            required(PICKUP_COLUMN, DATETIME),
            required("pick_hour", INT64),
            required("pick_day", INT64),
            required("pick_month", INT64),
            required("pick_year", INT64),
            required("pick_weekday", INT64),
            required(DROPOFF_COLUMN, DATETIME),
            required("drop_hour", INT64),
            required("drop_day", INT64),
            required("drop_month", INT64),
            required("drop_year", INT64),
            required("drop_weekday", INT64));

    private DatetimeDimension() {}

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public String keyColumn() {
        return KEY_COLUMN;
    }

    @Override
    public TripWindow naturalKey(TripRecord record) {
        return record.tripWindow();
    }

    @Override
    public DatetimeDimRow toRow(long surrogateKey, TripRecord first) {
        LocalDateTime pick = first.getPickupDatetime();
        LocalDateTime drop = first.getDropoffDatetime();
        return DatetimeDimRow.builder()
                .datetimeId(surrogateKey)
                .tpepPickupDatetime(pick)
                .pickHour(pick.getHour())
                .pickDay(pick.getDayOfMonth())
                .pickMonth(pick.getMonthValue())
                .pickYear(pick.getYear())
                .pickWeekday(pick.getDayOfWeek().getValue())
                .tpepDropoffDatetime(drop)
                .dropHour(drop.getHour())
                .dropDay(drop.getDayOfMonth())
                .dropMonth(drop.getMonthValue())
                .dropYear(drop.getYear())
                .dropWeekday(drop.getDayOfWeek().getValue())
                .build();
    }

    @Override
    public List<ColumnDefinition> columns() {
        return COLUMNS;
    }

    @Override
    public Map<String, Object> toColumns(DatetimeDimRow row) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(KEY_COLUMN, row.getDatetimeId());
        m.put(PICKUP_COLUMN, row.getTpepPickupDatetime());
        m.put("pick_hour", row.getPickHour());
        m.put("pick_day", row.getPickDay());
        m.put("pick_month", row.getPickMonth());
        m.put("pick_year", row.getPickYear());
        m.put("pick_weekday", row.getPickWeekday());
        m.put(DROPOFF_COLUMN, row.getTpepDropoffDatetime());
        m.put("drop_hour", row.getDropHour());
        m.put("drop_day", row.getDropDay());
        m.put("drop_month", row.getDropMonth());
        m.put("drop_year", row.getDropYear());
        m.put("drop_weekday", row.getDropWeekday());
        return m;
    }

    @Override
    public String partitionColumn() {
        return PICKUP_COLUMN;
    }
}
