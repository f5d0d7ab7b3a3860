package com.di.tripstar.transform.fact;

import com.di.tripstar.aspect.ErrorCategory;
import com.di.tripstar.aspect.LogTransaction;
import com.di.tripstar.extract.RawTripTable;
import com.di.tripstar.model.FactRow;
import com.di.tripstar.model.RejectedRow;
import com.di.tripstar.model.TripRecord;
import com.di.tripstar.transform.dimension.DimensionTable;
import com.di.tripstar.transform.dimension.TripDimensions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Builds {@code fact_table} from raw trips and the run's dimensions.
 *
 * <p>Exact duplicate trips collapse to one fact row. A trip whose natural key is
 * missing from any dimension is an orphan: it is dropped and reported, never
 * given a placeholder key. {@code trip_id} is assigned 1..n over the surviving
 * trips in file order.
 */
@Slf4j
@Service
public class FactBuilder {

    private static final int ORPHAN_LOG_LIMIT = 10;

    @LogTransaction(
            eventType = "FACT_BUILD",
            transactionContext = "fact_build",
            parameterNames = {"rawTrips"})
    public FactTable build(RawTripTable rawTrips, TripDimensions dimensions) {
        Set<TripRecord> unique = new LinkedHashSet<>(rawTrips.getRecords());
        long duplicates = rawTrips.size() - unique.size();
        if (duplicates > 0) {
            log.info("[FACTS] {} duplicate trip row(s) removed", duplicates);
        }

        List<FactRow>     rows    = new ArrayList<>(unique.size());
        List<RejectedRow> orphans = new ArrayList<>();
        long nextTripId = 1;

        for (TripRecord r : unique) {
            Resolver resolver = new Resolver(r);
            long datetimeId        = resolver.key(dimensions.getDatetime(), r.tripWindow());
            long passengerCountId  = resolver.key(dimensions.getPassengerCount(), r.getPassengerCount());
            long tripDistanceId    = resolver.key(dimensions.getTripDistance(), r.getTripDistance());
            long rateCodeId        = resolver.key(dimensions.getRateCode(), r.getRateCodeId());
            long pickupLocationId  = resolver.key(dimensions.getPickupLocation(), r.pickupLocation());
            long dropoffLocationId = resolver.key(dimensions.getDropoffLocation(), r.dropoffLocation());
            long paymentTypeId     = resolver.key(dimensions.getPaymentType(), r.getPaymentType());

            if (resolver.missing != null) {
                RejectedRow orphan = new RejectedRow(r.getRecordNumber(), resolver.missing);
                if (orphans.size() < ORPHAN_LOG_LIMIT) {
                    log.warn("[FACTS] {} record {}: {}", ErrorCategory.REFERENTIAL_ERROR,
                             orphan.getRecordNumber(), orphan.getReason());
                }
                orphans.add(orphan);
                continue;
            }

            rows.add(FactRow.builder()
                    .tripId(nextTripId++)
                    .vendorId(r.getVendorId())
                    .datetimeId(datetimeId)
                    .passengerCountId(passengerCountId)
                    .tripDistanceId(tripDistanceId)
                    .rateCodeId(rateCodeId)
                    .storeAndFwdFlag(r.getStoreAndFwdFlag())
                    .pickupLocationId(pickupLocationId)
                    .dropoffLocationId(dropoffLocationId)
                    .paymentTypeId(paymentTypeId)
                    .fareAmount(r.getFareAmount())
                    .extra(r.getExtra())
                    .mtaTax(r.getMtaTax())
                    .tipAmount(r.getTipAmount())
                    .tollsAmount(r.getTollsAmount())
                    .improvementSurcharge(r.getImprovementSurcharge())
                    .totalAmount(r.getTotalAmount())
                    .build());
        }

        if (!orphans.isEmpty()) {
            log.warn("[FACTS] {} orphan trip(s) dropped", orphans.size());
        }
        log.info("[FACTS] fact_table -> {} row(s)", rows.size());
        return new FactTable(rows, orphans, duplicates);
    }

    /** Looks up surrogate keys for one trip, remembering the first miss. */
    private static final class Resolver {

        private final TripRecord record;
        private String missing;

        Resolver(TripRecord record) {
            this.record = record;
        }

        <K extends Comparable<? super K>> long key(DimensionTable<K, ?> dimension, K naturalKey) {
            OptionalLong key = dimension.surrogateKeyOf(naturalKey);
            if (key.isPresent()) {
                return key.getAsLong();
            }
            if (missing == null) {
                missing = "no " + dimension.tableName() + " row for natural key " + naturalKey
                        + " (record " + record.getRecordNumber() + ")";
            }
            return 0L;
        }
    }
}
