package com.di.tripstar.transform.dimension;

import com.di.tripstar.model.Coordinate;
import com.di.tripstar.model.DatetimeDimRow;
import com.di.tripstar.model.LocationDimRow;
import com.di.tripstar.model.PassengerCountDimRow;
import com.di.tripstar.model.PaymentTypeDimRow;
import com.di.tripstar.model.RateCodeDimRow;
import com.di.tripstar.model.TripDistanceDimRow;
import com.di.tripstar.model.TripWindow;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * The seven dimension tables of one run.
 */
@Value
@Builder
public class TripDimensions {

    @NonNull DimensionTable<TripWindow, DatetimeDimRow>       datetime;
    @NonNull DimensionTable<Integer, PassengerCountDimRow>    passengerCount;
    @NonNull DimensionTable<Double, TripDistanceDimRow>       tripDistance;
    @NonNull DimensionTable<Integer, RateCodeDimRow>          rateCode;
    @NonNull DimensionTable<Coordinate, LocationDimRow>       pickupLocation;
    @NonNull DimensionTable<Coordinate, LocationDimRow>       dropoffLocation;
    @NonNull DimensionTable<Integer, PaymentTypeDimRow>       paymentType;

    /** All dimensions in load order. */
    public List<DimensionTable<?, ?>> all() {
        return List.of(datetime, passengerCount, tripDistance, rateCode,
                       pickupLocation, dropoffLocation, paymentType);
    }

    public long totalConflicts() {
        return all().stream().mapToLong(DimensionTable::getConflicts).sum();
    }
}
