package com.di.tripstar.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One raw trip as read from the source CSV.
 *
 * <p>Equality covers every CSV column; {@link #recordNumber} only locates the
 * record in the source file for diagnostics, so two identical lines compare equal.
 */
@Value
@Builder
public class TripRecord {

    @EqualsAndHashCode.Exclude
    long recordNumber;

    int           vendorId;
    LocalDateTime pickupDatetime;
    LocalDateTime dropoffDatetime;
    int           passengerCount;
    double        tripDistance;
    double        pickupLongitude;
    double        pickupLatitude;
    int           rateCodeId;
    String        storeAndFwdFlag;
    double        dropoffLongitude;
    double        dropoffLatitude;
    int           paymentType;

    // ---- fare components --------------------------------------------------
    double fareAmount;
    double extra;
    double mtaTax;
    double tipAmount;
    double tollsAmount;
    double improvementSurcharge;
    double totalAmount;

    public Coordinate pickupLocation() {
        return new Coordinate(pickupLatitude, pickupLongitude);
    }

    public Coordinate dropoffLocation() {
        return new Coordinate(dropoffLatitude, dropoffLongitude);
    }

    public TripWindow tripWindow() {
        return new TripWindow(pickupDatetime, dropoffDatetime);
    }
}
