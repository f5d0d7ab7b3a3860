package com.di.tripstar.report.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Average fare for one pickup hour of the day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HourlyAverageFare {

    private int pickHour;
    private double avgFareAmount;
}
