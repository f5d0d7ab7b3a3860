package com.di.tripstar.warehouse;

import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A named table ready for loading: explicit column definitions plus rows keyed
 * by column name.
 *
 * <p>{@code partitionColumn}, when set, must name a {@link ColumnType#DATETIME}
 * column; the table is then created with DAY time partitioning on it.
 */
@Value
@Builder
public class WarehouseTable {

    String name;

    @Singular
    List<ColumnDefinition> columns;

    List<Map<String, Object>> rows;

    String partitionColumn;

    public int rowCount() {
        return rows == null ? 0 : rows.size();
    }

    public Schema schema() {
        return Schema.of(columns.stream().map(ColumnDefinition::toField).toArray(Field[]::new));
    }
}
