package com.di.tripstar.extract;

import com.di.tripstar.model.RejectedRow;
import com.di.tripstar.model.TripRecord;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts raw trip CSV into {@link TripRecord}s.
 *
 * <p>The header row locates columns by name, so column order is free. A data
 * row with a missing or malformed value becomes a {@link RejectedRow}; a file
 * with no header or a missing required column raises {@link TripInputException}.
 */
@Slf4j
@Component
public class TripCsvParser {

    public static final String VENDOR_ID             = "VendorID";
    public static final String PICKUP_DATETIME       = "tpep_pickup_datetime";
    public static final String DROPOFF_DATETIME      = "tpep_dropoff_datetime";
    public static final String PASSENGER_COUNT       = "passenger_count";
    public static final String TRIP_DISTANCE         = "trip_distance";
    public static final String PICKUP_LONGITUDE      = "pickup_longitude";
    public static final String PICKUP_LATITUDE       = "pickup_latitude";
    public static final String RATECODE_ID           = "RatecodeID";
    public static final String STORE_AND_FWD_FLAG    = "store_and_fwd_flag";
    public static final String DROPOFF_LONGITUDE     = "dropoff_longitude";
    public static final String DROPOFF_LATITUDE      = "dropoff_latitude";
    public static final String PAYMENT_TYPE          = "payment_type";
    public static final String FARE_AMOUNT           = "fare_amount";
    public static final String EXTRA                 = "extra";
    public static final String MTA_TAX               = "mta_tax";
    public static final String TIP_AMOUNT            = "tip_amount";
    public static final String TOLLS_AMOUNT          = "tolls_amount";
    public static final String IMPROVEMENT_SURCHARGE = "improvement_surcharge";
    public static final String TOTAL_AMOUNT          = "total_amount";

    public static final List<String> REQUIRED_COLUMNS = List.of(
            VENDOR_ID, PICKUP_DATETIME, DROPOFF_DATETIME, PASSENGER_COUNT, TRIP_DISTANCE,
            PICKUP_LONGITUDE, PICKUP_LATITUDE, RATECODE_ID, STORE_AND_FWD_FLAG,
            DROPOFF_LONGITUDE, DROPOFF_LATITUDE, PAYMENT_TYPE, FARE_AMOUNT, EXTRA, MTA_TAX,
            TIP_AMOUNT, TOLLS_AMOUNT, IMPROVEMENT_SURCHARGE, TOTAL_AMOUNT);

    /** Both formats resolve strictly: an impossible date such as Feb 30 is malformed, not adjusted. */
    private static final List<DateTimeFormatter> TIMESTAMP_FORMATS = List.of(
            new DateTimeFormatterBuilder()
                    .appendPattern("uuuu-MM-dd HH:mm:ss")
                    .optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                    .optionalEnd()
                    .toFormatter()
                    .withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME);

    /**
     * Reads every row of {@code reader}. The reader is not closed.
     */
    public RawTripTable parse(String sourceUri, Reader reader) throws IOException {
        CSVReader csv = new CSVReaderBuilder(reader).build();

        Map<String, Integer> header = readHeader(csv, sourceUri);
        List<TripRecord>  records  = new ArrayList<>();
        List<RejectedRow> rejected = new ArrayList<>();

        long recordNumber = 0;
        String[] line;
        while ((line = readNext(csv, sourceUri)) != null) {
            if (isBlank(line)) {
                continue;
            }
            recordNumber++;
            try {
                records.add(toRecord(recordNumber, line, header));
            } catch (IllegalArgumentException e) {
                rejected.add(new RejectedRow(recordNumber, e.getMessage()));
            }
        }

        log.debug("[EXTRACT] parsed {} data row(s) from {}: valid={} rejected={}",
                  recordNumber, sourceUri, records.size(), rejected.size());
        return new RawTripTable(sourceUri, records, rejected);
    }

    private Map<String, Integer> readHeader(CSVReader csv, String sourceUri) throws IOException {
        String[] header = readNext(csv, sourceUri);
        if (header == null || isBlank(header)) {
            throw new TripInputException("Raw trip file is empty: " + sourceUri);
        }

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            index.putIfAbsent(name, i);
        }

        List<String> missing = REQUIRED_COLUMNS.stream().filter(c -> !index.containsKey(c)).toList();
        if (!missing.isEmpty()) {
            throw new TripInputException("Raw trip file " + sourceUri + " is missing required column(s): " + missing);
        }
        return index;
    }

    private String[] readNext(CSVReader csv, String sourceUri) throws IOException {
        try {
            return csv.readNext();
        } catch (CsvValidationException e) {
            throw new TripInputException("Unreadable CSV in " + sourceUri + " at line " + e.getLineNumber(), e);
        }
    }

    private TripRecord toRecord(long recordNumber, String[] line, Map<String, Integer> header) {
        Row row = new Row(line, header);
        return TripRecord.builder()
                .recordNumber(recordNumber)
                .vendorId(row.intValue(VENDOR_ID))
                .pickupDatetime(row.timestamp(PICKUP_DATETIME))
                .dropoffDatetime(row.timestamp(DROPOFF_DATETIME))
                .passengerCount(row.intValue(PASSENGER_COUNT))
                .tripDistance(row.doubleValue(TRIP_DISTANCE))
                .pickupLongitude(row.doubleValue(PICKUP_LONGITUDE))
                .pickupLatitude(row.doubleValue(PICKUP_LATITUDE))
                .rateCodeId(row.intValue(RATECODE_ID))
                .storeAndFwdFlag(row.text(STORE_AND_FWD_FLAG))
                .dropoffLongitude(row.doubleValue(DROPOFF_LONGITUDE))
                .dropoffLatitude(row.doubleValue(DROPOFF_LATITUDE))
                .paymentType(row.intValue(PAYMENT_TYPE))
                .fareAmount(row.doubleValue(FARE_AMOUNT))
                .extra(row.doubleValue(EXTRA))
                .mtaTax(row.doubleValue(MTA_TAX))
                .tipAmount(row.doubleValue(TIP_AMOUNT))
                .tollsAmount(row.doubleValue(TOLLS_AMOUNT))
                .improvementSurcharge(row.doubleValue(IMPROVEMENT_SURCHARGE))
                .totalAmount(row.doubleValue(TOTAL_AMOUNT))
                .build();
    }

    private static boolean isBlank(String[] line) {
        for (String v : line) {
            if (v != null && !v.isBlank()) {
                return false;
            }
        }
        return true;
    }

    /** One CSV line addressed by column name; conversion failures are IllegalArgumentException. */
    private static final class Row {

        private final String[]             values;
        private final Map<String, Integer> header;

        Row(String[] values, Map<String, Integer> header) {
            this.values = values;
            this.header = header;
        }

        /** Text columns may be empty but must be present. */
        String text(String column) {
            int i = header.get(column);
            if (i >= values.length || values[i] == null) {
                throw new IllegalArgumentException("missing value for " + column);
            }
            return values[i].trim();
        }

        String required(String column) {
            String v = text(column);
            if (v.isEmpty()) {
                throw new IllegalArgumentException("missing value for " + column);
            }
            return v;
        }

        int intValue(String column) {
            String v = required(column);
            try {
                // pandas exports integer columns holding nulls as floats ("1.0")
                return new BigDecimal(v).intValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                throw new IllegalArgumentException("malformed integer for " + column + ": '" + v + "'");
            }
        }

        double doubleValue(String column) {
            String v = required(column);
            double d;
            try {
                d = Double.parseDouble(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("malformed number for " + column + ": '" + v + "'");
            }
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("non-finite number for " + column + ": '" + v + "'");
            }
            return d;
        }

        /** BigQuery DATETIME keeps microseconds, so finer timestamps are rejected rather than collapsed. */
        LocalDateTime timestamp(String column) {
            String v = required(column);
            for (DateTimeFormatter format : TIMESTAMP_FORMATS) {
                LocalDateTime parsed;
                try {
                    parsed = LocalDateTime.parse(v, format);
                } catch (DateTimeParseException ignored) {
                    // try the next accepted format
                    continue;
                }
                if (parsed.getNano() % 1_000 != 0) {
                    throw new IllegalArgumentException(
                            "timestamp finer than microseconds for " + column + ": '" + v + "'");
                }
                return parsed;
            }
            throw new IllegalArgumentException("malformed timestamp for " + column + ": '" + v + "'");
        }
    }
}
