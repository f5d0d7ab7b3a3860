package com.di.tripstar.report;

import com.di.tripstar.report.dto.HourlyAverageFare;
import com.di.tripstar.report.dto.PassengerCountTrips;
import com.di.tripstar.report.dto.PickupLocationTrips;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only analytical queries against the loaded star schema.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>GET</td><td>/api/reports/top-pickup-locations?limit=10</td>
 *     <td>Pickup locations ranked by trip count</td></tr>
 * <tr><td>GET</td><td>/api/reports/trips-by-passenger-count?limit=10</td>
 *     <td>Trip totals per passenger count</td></tr>
 * <tr><td>GET</td><td>/api/reports/average-fare-by-hour</td>
 *     <td>Average fare per pickup hour</td></tr>
 * </table>
 */
@RestController
@RequestMapping("/api/reports")
@Slf4j
@RequiredArgsConstructor
public class TripReportController {

    private final TripReportService reportService;

    @GetMapping("/top-pickup-locations")
    public List<PickupLocationTrips> topPickupLocations(@RequestParam(defaultValue = "10") int limit) {
        log.info("[CONTROLLER] GET /api/reports/top-pickup-locations limit={}", limit);
        return reportService.topPickupLocations(limit);
    }

    @GetMapping("/trips-by-passenger-count")
    public List<PassengerCountTrips> tripsByPassengerCount(@RequestParam(defaultValue = "10") int limit) {
        log.info("[CONTROLLER] GET /api/reports/trips-by-passenger-count limit={}", limit);
        return reportService.tripsByPassengerCount(limit);
    }

    @GetMapping("/average-fare-by-hour")
    public List<HourlyAverageFare> averageFareByHour() {
        log.info("[CONTROLLER] GET /api/reports/average-fare-by-hour");
        return reportService.averageFareByHour();
    }
}
