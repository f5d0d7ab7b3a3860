package com.di.tripstar.analytics;

import com.di.tripstar.config.TripStarProperties;
import com.di.tripstar.warehouse.RowCountValidator;
import com.di.tripstar.warehouse.ValidationResult;
import com.di.tripstar.warehouse.WarehouseTarget;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.QueryJobConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AnalyticsViewBuilder Tests")
class AnalyticsViewBuilderTest {

    private final WarehouseTarget target = WarehouseTarget.of("proj-123", "uber_ds");

    private BigQuery             bigQuery;
    private RowCountValidator    validator;
    private AnalyticsViewBuilder builder;

    @BeforeEach
    void setUp() {
        bigQuery  = mock(BigQuery.class);
        validator = mock(RowCountValidator.class);
        builder   = new AnalyticsViewBuilder(bigQuery, validator, new TripStarProperties());
    }

    @Test
    @DisplayName("Should render a CREATE OR REPLACE with an inner join per dimension")
    void testRenderSql() {
        String sql = builder.renderSql(target);

        assertTrue(sql.startsWith("CREATE OR REPLACE TABLE `proj-123.uber_ds.tbl_analytics` AS"));
        assertEquals(7, sql.split("INNER JOIN", -1).length - 1);
        assertFalse(sql.contains("LEFT JOIN"));
        assertTrue(sql.contains("FROM `proj-123.uber_ds.fact_table` f"));
        assertTrue(sql.contains("`proj-123.uber_ds.payment_type_dim` pt ON f.payment_type_id = pt.payment_type_id"));
        for (String column : new String[]{"trip_id", "VendorID", "tpep_pickup_datetime", "rate_code_name",
                "pickup_latitude", "dropoff_longitude", "payment_type_name", "total_amount"}) {
            assertTrue(sql.contains("." + column), column);
        }
    }

    @Test
    @DisplayName("Should run the statement and reconcile the analytics count exactly")
    void testMaterialize() throws Exception {
        ValidationResult passed = ValidationResult.builder().passed(true).expectedRows(8).actualRows(8).build();
        when(validator.validateTable(any(WarehouseTarget.class), anyString(), anyLong(), anyDouble()))
                .thenReturn(passed);

        ValidationResult result = builder.materialize(target, 8);

        ArgumentCaptor<QueryJobConfiguration> captor = ArgumentCaptor.forClass(QueryJobConfiguration.class);
        verify(bigQuery).query(captor.capture());
        assertEquals(builder.renderSql(target), captor.getValue().getQuery());
        assertFalse(captor.getValue().useLegacySql());
        verify(validator).validateTable(eq(target), eq("tbl_analytics"), eq(8L), eq(0.0));
        assertSame(passed, result);
    }
}
