package com.di.tripstar.transform;

import com.di.tripstar.transform.dimension.DimensionDefinition;
import com.di.tripstar.transform.dimension.DimensionTable;
import com.di.tripstar.transform.fact.FactTable;
import com.di.tripstar.warehouse.WarehouseTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a {@link StarSchema} onto the warehouse tables to load: the seven
 * dimensions in load order followed by {@code fact_table}.
 */
public final class WarehouseTables {

    private WarehouseTables() {}

    /**
     * @param partitionDimensions create dimensions that declare a partition column
     *                            (only {@code datetime_dim}) with DAY time partitioning
     */
    public static List<WarehouseTable> of(StarSchema schema, boolean partitionDimensions) {
        List<WarehouseTable> tables = new ArrayList<>();
        for (DimensionTable<?, ?> dimension : schema.getDimensions().all()) {
            tables.add(toTable(dimension, partitionDimensions));
        }
        tables.add(WarehouseTable.builder()
                .name(FactTable.TABLE)
                .columns(FactTable.COLUMNS)
                .rows(schema.getFacts().getRows().stream().map(FactTable::toColumns).toList())
                .build());
        return List.copyOf(tables);
    }

    private static <K extends Comparable<? super K>, R> WarehouseTable toTable(
            DimensionTable<K, R> dimension, boolean partition) {
        DimensionDefinition<K, R> definition = dimension.getDefinition();
        List<Map<String, Object>> rows = dimension.getRows().stream().map(definition::toColumns).toList();
        return WarehouseTable.builder()
                .name(definition.tableName())
                .columns(definition.columns())
                .rows(rows)
                .partitionColumn(partition ? definition.partitionColumn() : null)
                .build();
    }
}
