package com.di.tripstar.analytics;

import com.di.tripstar.model.AnalyticsRow;
import com.di.tripstar.model.DatetimeDimRow;
import com.di.tripstar.model.FactRow;
import com.di.tripstar.model.LocationDimRow;
import com.di.tripstar.model.PassengerCountDimRow;
import com.di.tripstar.model.PaymentTypeDimRow;
import com.di.tripstar.model.RateCodeDimRow;
import com.di.tripstar.model.TripDistanceDimRow;
import com.di.tripstar.transform.StarSchema;
import com.di.tripstar.transform.dimension.TripDimensions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * In-process equivalent of the {@code tbl_analytics} query: fact rows inner-joined
 * with every dimension. A fact row whose key finds no dimension row is left out.
 */
public final class AnalyticsJoin {

    private AnalyticsJoin() {}

    public static List<AnalyticsRow> denormalize(StarSchema schema) {
        TripDimensions d = schema.getDimensions();
        List<AnalyticsRow> out = new ArrayList<>(schema.getFacts().size());

        for (FactRow f : schema.getFacts().getRows()) {
            Optional<DatetimeDimRow>       dt = d.getDatetime().rowById(f.getDatetimeId());
            Optional<PassengerCountDimRow> pc = d.getPassengerCount().rowById(f.getPassengerCountId());
            Optional<TripDistanceDimRow>   td = d.getTripDistance().rowById(f.getTripDistanceId());
            Optional<RateCodeDimRow>       rc = d.getRateCode().rowById(f.getRateCodeId());
            Optional<LocationDimRow>       pl = d.getPickupLocation().rowById(f.getPickupLocationId());
            Optional<LocationDimRow>       dl = d.getDropoffLocation().rowById(f.getDropoffLocationId());
            Optional<PaymentTypeDimRow>    pt = d.getPaymentType().rowById(f.getPaymentTypeId());

            if (dt.isEmpty() || pc.isEmpty() || td.isEmpty() || rc.isEmpty()
                    || pl.isEmpty() || dl.isEmpty() || pt.isEmpty()) {
                continue;
            }

            out.add(AnalyticsRow.builder()
                    .tripId(f.getTripId())
                    .vendorId(f.getVendorId())
                    .tpepPickupDatetime(dt.get().getTpepPickupDatetime())
                    .tpepDropoffDatetime(dt.get().getTpepDropoffDatetime())
                    .passengerCount(pc.get().getPassengerCount())
                    .tripDistance(td.get().getTripDistance())
                    .rateCodeName(rc.get().getRateCodeName())
                    .pickupLatitude(pl.get().getLatitude())
                    .pickupLongitude(pl.get().getLongitude())
                    .dropoffLatitude(dl.get().getLatitude())
                    .dropoffLongitude(dl.get().getLongitude())
                    .paymentTypeName(pt.get().getPaymentTypeName())
                    .fareAmount(f.getFareAmount())
                    .extra(f.getExtra())
                    .mtaTax(f.getMtaTax())
                    .tipAmount(f.getTipAmount())
                    .tollsAmount(f.getTollsAmount())
                    .improvementSurcharge(f.getImprovementSurcharge())
                    .totalAmount(f.getTotalAmount())
                    .build());
        }
        return out;
    }
}
