package com.di.tripstar.transform;

import com.di.tripstar.TripFixtures;
import com.di.tripstar.extract.RawTripTable;
import com.di.tripstar.transform.dimension.DimensionBuilder;
import com.di.tripstar.transform.dimension.TripDimensions;
import com.di.tripstar.transform.fact.FactBuilder;
import com.di.tripstar.warehouse.WarehouseTable;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.StandardSQLTypeName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WarehouseTables Tests")
class WarehouseTablesTest {

    private static StarSchema sampleSchema() {
        RawTripTable   raw  = TripFixtures.sample();
        TripDimensions dims = new DimensionBuilder().buildAll(raw);
        return new StarSchema(dims, new FactBuilder().build(raw, dims));
    }

    @Test
    @DisplayName("Should list the seven dimensions then fact_table")
    void testTableOrder() {
        List<String> names = WarehouseTables.of(sampleSchema(), false).stream().map(WarehouseTable::getName).toList();

        assertEquals(List.of("datetime_dim", "passenger_count_dim", "trip_distance_dim", "rate_code_dim",
                             "pickup_location_dim", "dropoff_location_dim", "payment_type_dim", "fact_table"), names);
    }

    @Test
    @DisplayName("Should carry every row with an explicit schema")
    void testRowsAndSchema() {
        StarSchema schema = sampleSchema();
        List<WarehouseTable> tables = WarehouseTables.of(schema, false);

        WarehouseTable datetime = tables.get(0);
        assertEquals(schema.getDimensions().getDatetime().size(), datetime.rowCount());
        Field pickup = datetime.schema().getFields().get("tpep_pickup_datetime");
        assertEquals(StandardSQLTypeName.DATETIME, pickup.getType().getStandardType());
        assertEquals(Field.Mode.REQUIRED, pickup.getMode());
        assertInstanceOf(LocalDateTime.class, datetime.getRows().get(0).get("tpep_pickup_datetime"));

        WarehouseTable fact = tables.get(7);
        assertEquals(schema.getFacts().size(), fact.rowCount());
        assertEquals(Field.Mode.NULLABLE, fact.schema().getFields().get("store_and_fwd_flag").getMode());
    }

    @Test
    @DisplayName("Should partition only datetime_dim, and only when enabled")
    void testPartitioning() {
        StarSchema schema = sampleSchema();

        assertTrue(WarehouseTables.of(schema, false).stream().allMatch(t -> t.getPartitionColumn() == null));

        List<WarehouseTable> partitioned = WarehouseTables.of(schema, true);
        assertEquals("tpep_pickup_datetime", partitioned.get(0).getPartitionColumn());
        assertTrue(partitioned.subList(1, partitioned.size()).stream().allMatch(t -> t.getPartitionColumn() == null));
    }
}
