package com.di.tripstar.warehouse;

/**
 * Raised when writing a table to the warehouse fails. Earlier tables of the same
 * run are not rolled back.
 */
public class WarehouseLoadException extends RuntimeException {

    private final String tableName;

    public WarehouseLoadException(String tableName, String message) {
        super(message);
        this.tableName = tableName;
    }

    public WarehouseLoadException(String tableName, String message, Throwable cause) {
        super(message, cause);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
