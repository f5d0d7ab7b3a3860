package com.di.tripstar.warehouse;

import com.google.cloud.bigquery.Field;

import java.util.Objects;

/**
 * Name, type and nullability of one warehouse column.
 */
public record ColumnDefinition(String name, ColumnType type, boolean required) {

    public ColumnDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static ColumnDefinition required(String name, ColumnType type) {
        return new ColumnDefinition(name, type, true);
    }

    public static ColumnDefinition nullable(String name, ColumnType type) {
        return new ColumnDefinition(name, type, false);
    }

    public Field toField() {
        return Field.newBuilder(name, type.sqlType())
                .setMode(required ? Field.Mode.REQUIRED : Field.Mode.NULLABLE)
                .build();
    }
}
