package com.di.tripstar.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One trip with every dimension attribute flattened in; shape of {@code tbl_analytics}.
 */
@Value
@Builder
public class AnalyticsRow {
    long          tripId;
    int           vendorId;
    LocalDateTime tpepPickupDatetime;
    LocalDateTime tpepDropoffDatetime;
    int           passengerCount;
    double        tripDistance;
    String        rateCodeName;
    double        pickupLatitude;
    double        pickupLongitude;
    double        dropoffLatitude;
    double        dropoffLongitude;
    String        paymentTypeName;
    double        fareAmount;
    double        extra;
    double        mtaTax;
    double        tipAmount;
    double        tollsAmount;
    double        improvementSurcharge;
    double        totalAmount;
}
