package com.di.tripstar.warehouse;

/**
 * Writes one table to the warehouse, creating it when absent and replacing
 * whatever it held before.
 */
public interface WarehouseLoader {

    /**
     * @throws WarehouseLoadException when the table cannot be created, written or verified
     */
    TableLoadResult load(WarehouseTarget target, WarehouseTable table);
}
