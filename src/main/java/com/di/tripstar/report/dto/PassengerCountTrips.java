package com.di.tripstar.report.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trip count for one passenger count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PassengerCountTrips {

    private int passengerCount;
    private long totalNumberTrips;
}
