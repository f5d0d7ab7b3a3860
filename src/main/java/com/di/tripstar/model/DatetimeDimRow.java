package com.di.tripstar.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Row of {@code datetime_dim}: pickup/dropoff instants and their calendar parts.
 * Weekday is ISO (1 = Monday .. 7 = Sunday).
 */
@Value
@Builder
public class DatetimeDimRow {

    long          datetimeId;

    LocalDateTime tpepPickupDatetime;
    int           pickHour;
    int           pickDay;
    int           pickMonth;
    int           pickYear;
    int           pickWeekday;

    LocalDateTime tpepDropoffDatetime;
    int           dropHour;
    int           dropDay;
    int           dropMonth;
    int           dropYear;
    int           dropWeekday;
}
