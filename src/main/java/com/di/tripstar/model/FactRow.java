package com.di.tripstar.model;

import lombok.Builder;
import lombok.Value;

/**
 * Row of {@code fact_table}: surrogate-key references plus trip measures.
 */
@Value
@Builder
public class FactRow {

    long   tripId;
    int    vendorId;

    // ---- dimension references ---------------------------------------------
    long   datetimeId;
    long   passengerCountId;
    long   tripDistanceId;
    long   rateCodeId;
    String storeAndFwdFlag;
    long   pickupLocationId;
    long   dropoffLocationId;
    long   paymentTypeId;

    // ---- measures ----------------------------------------------------------
    double fareAmount;
    double extra;
    double mtaTax;
    double tipAmount;
    double tollsAmount;
    double improvementSurcharge;
    double totalAmount;
}
