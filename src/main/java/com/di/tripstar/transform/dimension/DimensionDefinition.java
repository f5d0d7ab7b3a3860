package com.di.tripstar.transform.dimension;

import com.di.tripstar.model.TripRecord;
import com.di.tripstar.warehouse.ColumnDefinition;

import java.util.List;
import java.util.Map;

/**
 * Describes one dimension of the trip star schema: how to derive its natural key
 * from a trip, how to build a row for a surrogate key, and its warehouse layout.
 *
 * <p>Natural keys are ordered by {@link Comparable}; surrogate keys follow that
 * order, so reruns over the same input assign the same keys.
 *
 * <p>Duplicate-key conflicts can only arise for definitions whose rows carry
 * columns not derived from the natural key. The seven trip dimensions derive every
 * descriptive column from their key, so they never report one.
 *
 * @param <K> natural key type
 * @param <R> dimension row type; its equality decides whether two trips sharing
 *            a natural key also agree on the descriptive columns
 */
public interface DimensionDefinition<K extends Comparable<? super K>, R> {

    String tableName();

    /** Surrogate key column, e.g. {@code datetime_id}. */
    String keyColumn();

    K naturalKey(TripRecord record);

    R toRow(long surrogateKey, TripRecord first);

    /** Warehouse columns, surrogate key first. */
    List<ColumnDefinition> columns();

    /** Column name to value, in {@link #columns()} order. */
    Map<String, Object> toColumns(R row);

    /** DATETIME column to partition on when partitioning is enabled; {@code null} for none. */
    default String partitionColumn() {
        return null;
    }
}
