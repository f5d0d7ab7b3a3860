package com.di.tripstar.report.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trip count for one pickup location.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PickupLocationTrips {

    private long pickupLocationId;
    private double pickupLatitude;
    private double pickupLongitude;
    private long trips;
}
