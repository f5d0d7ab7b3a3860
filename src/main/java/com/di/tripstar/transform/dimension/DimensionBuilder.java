package com.di.tripstar.transform.dimension;

import com.di.tripstar.aspect.ErrorCategory;
import com.di.tripstar.aspect.LogTransaction;
import com.di.tripstar.extract.RawTripTable;
import com.di.tripstar.model.TripRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds dimension tables from raw trips.
 *
 * <p>Each distinct natural key yields exactly one row. Surrogate keys are dense,
 * start at 1 and follow ascending natural-key order. Descriptive columns come
 * from the first trip (file order) carrying the key; later trips with the same key
 * but different descriptive values are counted as
 * {@link ErrorCategory#DUPLICATE_KEY_WARNING}.
 */
@Slf4j
@Service
public class DimensionBuilder {

    private static final int CONFLICT_LOG_LIMIT = 10;

    public <K extends Comparable<? super K>, R> DimensionTable<K, R> build(
            List<TripRecord> records, DimensionDefinition<K, R> definition) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("Cannot build " + definition.tableName() + " from an empty trip table");
        }

        TreeMap<K, TripRecord> firstByKey = new TreeMap<>();
        long conflicts = 0;
        for (TripRecord record : records) {
            K key = definition.naturalKey(record);
            TripRecord first = firstByKey.putIfAbsent(key, record);
            if (first != null && !definition.toRow(0, first).equals(definition.toRow(0, record))) {
                if (conflicts++ < CONFLICT_LOG_LIMIT) {
                    log.warn("[DIMENSIONS] {} {}: key {} at record {} differs from record {}; keeping the first",
                             ErrorCategory.DUPLICATE_KEY_WARNING, definition.tableName(), key,
                             record.getRecordNumber(), first.getRecordNumber());
                }
            }
        }

        List<R>      rows = new ArrayList<>(firstByKey.size());
        Map<K, Long> keys = new HashMap<>(firstByKey.size() * 2);
        long next = 1;
        for (Map.Entry<K, TripRecord> e : firstByKey.entrySet()) {
            rows.add(definition.toRow(next, e.getValue()));
            keys.put(e.getKey(), next);
            next++;
        }

        if (conflicts > 0) {
            log.warn("[DIMENSIONS] {}: {} duplicate-key conflict(s)", definition.tableName(), conflicts);
        }
        log.debug("[DIMENSIONS] {}: {} row(s) from {} trip(s)", definition.tableName(), rows.size(), records.size());
        return new DimensionTable<>(definition, rows, keys, conflicts);
    }

    @LogTransaction(
            eventType = "DIMENSION_BUILD",
            transactionContext = "dimension_build",
            parameterNames = {"rawTrips"})
    public TripDimensions buildAll(RawTripTable rawTrips) {
        List<TripRecord> records = rawTrips.getRecords();
        TripDimensions dimensions = TripDimensions.builder()
                .datetime(build(records, DatetimeDimension.INSTANCE))
                .passengerCount(build(records, PassengerCountDimension.INSTANCE))
                .tripDistance(build(records, TripDistanceDimension.INSTANCE))
                .rateCode(build(records, RateCodeDimension.INSTANCE))
                .pickupLocation(build(records, PickupLocationDimension.INSTANCE))
                .dropoffLocation(build(records, DropoffLocationDimension.INSTANCE))
                .paymentType(build(records, PaymentTypeDimension.INSTANCE))
                .build();

        dimensions.all().forEach(d -> log.info("[DIMENSIONS] {} -> {} row(s)", d.tableName(), d.size()));
        return dimensions;
    }
}
