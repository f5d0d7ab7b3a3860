package com.di.tripstar.extract;

import com.di.tripstar.aspect.LogTransaction;
import com.di.tripstar.config.TripStarProperties;
import com.di.tripstar.model.RejectedRow;
import com.di.tripstar.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;

/**
 * Reads the raw trip file into a {@link RawTripTable} and applies the
 * rejected-row policy: malformed rows are skipped and logged with their reason,
 * but too many of them, or no valid row at all, fails the extraction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RawTripExtractor {

    private final TripSourceRegistry sourceRegistry;
    private final TripCsvParser      parser;
    private final TripStarProperties properties;

    @LogTransaction(
            eventType = "TRIP_EXTRACT",
            transactionContext = "raw_extract",
            parameterNames = {"sourceUri"})
    public RawTripTable extract(String sourceUri) {
        if (sourceUri == null || sourceUri.isBlank()) {
            throw new TripInputException("No raw trip source configured (tripstar.source.uri)");
        }
        long startMs = System.currentTimeMillis();
        log.info("[EXTRACT] reading {}", InputValidator.sanitizeForLogging(sourceUri));

        RawTripTable table;
        try (Reader reader = sourceRegistry.open(sourceUri)) {
            table = parser.parse(sourceUri, reader);
        } catch (IOException e) {
            throw new TripInputException("Failed to read raw trip file " + sourceUri + ": " + e.getMessage(), e);
        }

        logRejected(table);

        long maxRejected = properties.getExtract().getMaxRejectedRows();
        if (table.getRejected().size() > maxRejected) {
            throw new TripInputException(String.format(
                    "%d row(s) rejected in %s, above the limit of %d",
                    table.getRejected().size(), sourceUri, maxRejected));
        }
        if (table.isEmpty()) {
            throw new TripInputException("No valid trip rows in " + sourceUri);
        }

        log.info("[EXTRACT] {} valid row(s), {} rejected, in {} ms",
                 table.size(), table.getRejected().size(), System.currentTimeMillis() - startMs);
        return table;
    }

    private void logRejected(RawTripTable table) {
        int limit  = properties.getExtract().getRejectedRowLogLimit();
        int logged = 0;
        for (RejectedRow row : table.getRejected()) {
            if (logged++ >= limit) {
                log.warn("[EXTRACT] ... {} more rejected row(s) not logged individually",
                         table.getRejected().size() - limit);
                break;
            }
            log.warn("[EXTRACT] rejected record {}: {}", row.getRecordNumber(), row.getReason());
        }
    }
}
