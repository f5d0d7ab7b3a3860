package com.di.tripstar.transform.dimension;

import com.di.tripstar.model.PaymentType;
import com.di.tripstar.model.PaymentTypeDimRow;
import com.di.tripstar.model.TripRecord;
import com.di.tripstar.warehouse.ColumnDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.di.tripstar.warehouse.ColumnDefinition.required;
import static com.di.tripstar.warehouse.ColumnType.INT64;
import static com.di.tripstar.warehouse.ColumnType.STRING;

/** {@code payment_type_dim}: payment code and its TLC name. */
public final class PaymentTypeDimension implements DimensionDefinition<Integer, PaymentTypeDimRow> {

    public static final PaymentTypeDimension INSTANCE = new PaymentTypeDimension();

    public static final String TABLE      = "payment_type_dim";
    public static final String KEY_COLUMN = "payment_type_id";

    private static final List<ColumnDefinition> COLUMNS = List.of(
            required(KEY_COLUMN, INT64),
            required("payment_type", INT64),
            required("payment_type_name", STRING));

    private PaymentTypeDimension() {}

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public String keyColumn() {
        return KEY_COLUMN;
    }

    @Override
    public Integer naturalKey(TripRecord record) {
        return record.getPaymentType();
    }

    @Override
    public PaymentTypeDimRow toRow(long surrogateKey, TripRecord first) {
        return PaymentTypeDimRow.builder()
                .paymentTypeId(surrogateKey)
                .paymentType(first.getPaymentType())
                .paymentTypeName(PaymentType.nameOf(first.getPaymentType()))
                .build();
    }

    @Override
    public List<ColumnDefinition> columns() {
        return COLUMNS;
    }

    @Override
    public Map<String, Object> toColumns(PaymentTypeDimRow row) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(KEY_COLUMN, row.getPaymentTypeId());
        m.put("payment_type", row.getPaymentType());
        m.put("payment_type_name", row.getPaymentTypeName());
        return m;
    }
}
