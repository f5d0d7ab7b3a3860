package com.di.tripstar.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PassengerCountDimRow {
    long passengerCountId;
    int  passengerCount;
}
