package com.di.tripstar.transform.dimension;

import com.di.tripstar.TripFixtures;
import com.di.tripstar.extract.RawTripTable;
import com.di.tripstar.model.Coordinate;
import com.di.tripstar.model.LocationDimRow;
import com.di.tripstar.model.RateCodeDimRow;
import com.di.tripstar.model.TripDistanceDimRow;
import com.di.tripstar.model.TripRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.di.tripstar.TripFixtures.trip;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DimensionBuilder Tests")
class DimensionBuilderTest {

    private final DimensionBuilder builder = new DimensionBuilder();

    // ============================================================================
    // Keys
    // ============================================================================

    @Test
    @DisplayName("Should produce one row per distinct natural key for every dimension")
    void testNaturalKeysUnique() {
        TripDimensions dims = builder.buildAll(TripFixtures.sample());

        assertEquals(6, dims.getDatetime().size());
        assertEquals(4, dims.getPassengerCount().size());
        assertEquals(8, dims.getTripDistance().size());
        assertEquals(3, dims.getRateCode().size());
        assertEquals(8, dims.getPickupLocation().size());
        assertEquals(8, dims.getDropoffLocation().size());
        assertEquals(3, dims.getPaymentType().size());

        for (DimensionTable<?, ?> d : dims.all()) {
            assertEquals(d.size(), d.getSurrogateKeys().size(), d.tableName());
            assertEquals(d.size(), new HashSet<>(d.getSurrogateKeys().keySet()).size(), d.tableName());
        }
    }

    @Test
    @DisplayName("Should assign dense surrogate keys 1..n in ascending natural-key order")
    void testDenseSortedKeys() {
        TripDimensions dims = builder.buildAll(TripFixtures.sample());

        for (DimensionTable<?, ?> d : dims.all()) {
            assertDenseAndSorted(d);
        }

        List<Integer> rateCodes = dims.getRateCode().getRows().stream().map(RateCodeDimRow::getRateCode).toList();
        assertEquals(List.of(1, 2, 3), rateCodes);
    }

    private static <K extends Comparable<? super K>> void assertDenseAndSorted(DimensionTable<K, ?> d) {
        List<Map.Entry<K, Long>> byKey = d.getSurrogateKeys().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .collect(Collectors.toList());
        for (int i = 0; i < byKey.size(); i++) {
            assertEquals(i + 1L, byKey.get(i).getValue(), d.tableName() + " key of " + byKey.get(i).getKey());
        }
    }

    @Test
    @DisplayName("Should give identical rows and keys when rerun on identical input")
    void testRerunStable() {
        RawTripTable raw = TripFixtures.sample();

        TripDimensions first  = builder.buildAll(raw);
        TripDimensions second = builder.buildAll(raw);

        for (int i = 0; i < first.all().size(); i++) {
            assertEquals(first.all().get(i).getRows(), second.all().get(i).getRows());
            assertEquals(first.all().get(i).getSurrogateKeys(), second.all().get(i).getSurrogateKeys());
        }
    }

    @Test
    @DisplayName("Should not depend on input order")
    void testInputOrderIndependent() {
        List<TripRecord> records  = TripFixtures.sample().getRecords();
        List<TripRecord> reversed = new ArrayList<>(records);
        java.util.Collections.reverse(reversed);

        assertEquals(builder.build(records, TripDistanceDimension.INSTANCE).getRows(),
                     builder.build(reversed, TripDistanceDimension.INSTANCE).getRows());
    }

    @Test
    @DisplayName("Should add exactly one pickup row for a new coordinate")
    void testNewPickupCoordinate() {
        List<TripRecord> records = new ArrayList<>(TripFixtures.sample().getRecords());
        int before = builder.build(records, PickupLocationDimension.INSTANCE).size();

        records.add(trip().recordNumber(99).pickupLatitude(40.1).pickupLongitude(-74.1).build());
        DimensionTable<Coordinate, LocationDimRow> after = builder.build(records, PickupLocationDimension.INSTANCE);

        assertEquals(before + 1, after.size());
        long key = after.surrogateKeyOf(new Coordinate(40.1, -74.1)).orElseThrow();
        LocationDimRow row = after.rowById(key).orElseThrow();
        assertEquals(40.1, row.getLatitude());
        assertEquals(-74.1, row.getLongitude());
    }

    // ============================================================================
    // Descriptive columns
    // ============================================================================

    @Test
    @DisplayName("Should keep the first occurrence and count conflicting descriptive values")
    void testFirstWinsConflict() {
        // natural key is the distance; the row carries a name derived from the vendor
        DimensionDefinition<Double, String> byDistance = new DimensionDefinition<>() {
            public String tableName() { return "test_dim"; }
            public String keyColumn() { return "test_id"; }
            public Double naturalKey(TripRecord r) { return r.getTripDistance(); }
            public String toRow(long key, TripRecord first) { return "vendor-" + first.getVendorId(); }
            public List<com.di.tripstar.warehouse.ColumnDefinition> columns() { return List.of(); }
            public Map<String, Object> toColumns(String row) { return Map.of(); }
        };

        DimensionTable<Double, String> table = builder.build(List.of(
                trip().recordNumber(1).tripDistance(1.0).vendorId(2).build(),
                trip().recordNumber(2).tripDistance(1.0).vendorId(1).build(),
                trip().recordNumber(3).tripDistance(1.0).vendorId(2).build()), byDistance);

        assertEquals(List.of("vendor-2"), table.getRows());
        assertEquals(1, table.getConflicts());
    }

    @Test
    @DisplayName("Should report no conflicts for the sample data")
    void testNoConflictsInSample() {
        assertEquals(0, builder.buildAll(TripFixtures.sample()).totalConflicts());
    }

    @Test
    @DisplayName("Should reject an empty trip table")
    void testEmptyInput() {
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(List.of(), TripDistanceDimension.INSTANCE));
    }

    @Test
    @DisplayName("Should resolve lookups by natural key and by surrogate key")
    void testLookups() {
        DimensionTable<Double, TripDistanceDimRow> d = builder.build(List.of(
                trip().tripDistance(3.0).build(),
                trip().tripDistance(1.0).build()), TripDistanceDimension.INSTANCE);

        assertEquals(1L, d.surrogateKeyOf(1.0).orElseThrow());
        assertEquals(2L, d.surrogateKeyOf(3.0).orElseThrow());
        assertTrue(d.surrogateKeyOf(2.0).isEmpty());
        assertEquals(3.0, d.rowById(2).orElseThrow().getTripDistance());
        assertTrue(d.rowById(0).isEmpty());
        assertTrue(d.rowById(3).isEmpty());
        Set<Long> ids = new HashSet<>(d.getSurrogateKeys().values());
        assertEquals(Set.of(1L, 2L), ids);
    }
}
