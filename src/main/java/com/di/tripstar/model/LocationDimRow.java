package com.di.tripstar.model;

import lombok.Builder;
import lombok.Value;

/**
 * Row of {@code pickup_location_dim} or {@code dropoff_location_dim}; the two
 * tables share a shape and differ only in column names.
 */
@Value
@Builder
public class LocationDimRow {
    long   locationId;
    double latitude;
    double longitude;
}
