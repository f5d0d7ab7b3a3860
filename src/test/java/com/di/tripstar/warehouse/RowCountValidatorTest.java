package com.di.tripstar.warehouse;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.TableResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RowCountValidator Tests")
class RowCountValidatorTest {

    private BigQuery          bigQuery;
    private RowCountValidator validator;

    @BeforeEach
    void setUp() {
        bigQuery  = mock(BigQuery.class);
        validator = new RowCountValidator(bigQuery);
    }

    // ============================================================================
    // Reconciliation
    // ============================================================================

    @ParameterizedTest(name = "expected={0} actual={1} threshold={2} -> {3}")
    @CsvSource({
        "8,    8,    0.0, true",
        "8,    7,    0.0, false",
        "8,    9,    0.0, false",
        "1000, 995,  1.0, true",
        "1000, 980,  1.0, false",
        "0,    0,    0.0, true",
        "0,    3,    50.0, false"
    })
    @DisplayName("Should pass only within the threshold")
    void testReconcile(long expected, long actual, double threshold, boolean passed) {
        ValidationResult result = validator.reconcile("fact_table", expected, actual, threshold);

        assertEquals(passed, result.isPassed());
        assertEquals(actual - expected, result.getDeltaRows());
        assertTrue(result.getDetail().endsWith(passed ? "PASS" : "FAIL"));
    }

    @Test
    @DisplayName("Should report the percentage deviation")
    void testDeltaPct() {
        ValidationResult result = validator.reconcile("fact_table", 200, 190, 10.0);

        assertEquals(5.0, result.getDeltaPct(), 1e-9);
        assertEquals(-10, result.getDeltaRows());
        assertEquals("fact_table", result.getTable());
    }

    // ============================================================================
    // Warehouse count
    // ============================================================================

    @Test
    @DisplayName("Should count the table in BigQuery and reconcile the result")
    void testValidateTable() throws Exception {
        TableResult result = mock(TableResult.class);
        FieldValueList row = FieldValueList.of(
                List.of(FieldValue.of(FieldValue.Attribute.PRIMITIVE, "8")),
                Field.of("cnt", LegacySQLTypeName.INTEGER));
        when(result.iterateAll()).thenReturn(List.of(row));
        when(bigQuery.query(any(QueryJobConfiguration.class))).thenReturn(result);

        ValidationResult validation = validator.validateTable(
                WarehouseTarget.of("proj-123", "uber_ds"), "tbl_analytics", 8, 0.0);

        assertTrue(validation.isPassed());
        assertEquals(8, validation.getActualRows());

        ArgumentCaptor<QueryJobConfiguration> captor = ArgumentCaptor.forClass(QueryJobConfiguration.class);
        verify(bigQuery).query(captor.capture());
        assertEquals("SELECT COUNT(*) AS cnt FROM `proj-123.uber_ds.tbl_analytics`", captor.getValue().getQuery());
    }
}
