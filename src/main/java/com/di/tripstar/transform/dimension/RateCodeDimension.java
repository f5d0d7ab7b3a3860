package com.di.tripstar.transform.dimension;

import com.di.tripstar.model.RateCode;
import com.di.tripstar.model.RateCodeDimRow;
import com.di.tripstar.model.TripRecord;
import com.di.tripstar.warehouse.ColumnDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.di.tripstar.warehouse.ColumnDefinition.required;
import static com.di.tripstar.warehouse.ColumnType.INT64;
import static com.di.tripstar.warehouse.ColumnType.STRING;

/** {@code rate_code_dim}: rate code and its TLC name. */
public final class RateCodeDimension implements DimensionDefinition<Integer, RateCodeDimRow> {

    public static final RateCodeDimension INSTANCE = new RateCodeDimension();

    public static final String TABLE      = "rate_code_dim";
    public static final String KEY_COLUMN = "rate_code_id";

    private static final List<ColumnDefinition> COLUMNS = List.of(
            required(KEY_COLUMN, INT64),
            required("RatecodeID", INT64),
            required("rate_code_name", STRING));

    private RateCodeDimension() {}

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
        return record.getRateCodeId();
    }

    @Override
    public RateCodeDimRow toRow(long surrogateKey, TripRecord first) {
        return RateCodeDimRow.builder()
                .rateCodeId(surrogateKey)
                .rateCode(first.getRateCodeId())
                .rateCodeName(RateCode.nameOf(first.getRateCodeId()))
                .build();
    }

    @Override
    public List<ColumnDefinition> columns() {
        return COLUMNS;
    }

    @Override
    public Map<String, Object> toColumns(RateCodeDimRow row) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(KEY_COLUMN, row.getRateCodeId());
        m.put("RatecodeID", row.getRateCode());
        m.put("rate_code_name", row.getRateCodeName());
        return m;
    }
}
