package com.di.tripstar.warehouse;

import com.google.cloud.bigquery.StandardSQLTypeName;

/**
 * Column types used by the star schema, mapped onto BigQuery standard SQL types.
 */
public enum ColumnType {

    INT64(StandardSQLTypeName.INT64),
    FLOAT64(StandardSQLTypeName.FLOAT64),
    STRING(StandardSQLTypeName.STRING),
    DATETIME(StandardSQLTypeName.DATETIME);

    private final StandardSQLTypeName sqlType;

    ColumnType(StandardSQLTypeName sqlType) {
        this.sqlType = sqlType;
    }

    public StandardSQLTypeName sqlType() {
        return sqlType;
    }
}
