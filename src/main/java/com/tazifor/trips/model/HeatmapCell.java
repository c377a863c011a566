package com.tazifor.trips.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Pickup density on a 0.001° grid.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HeatmapCell(double lat, double lon, long intensity, Double avgDuration, Double avgSpeed) {
}
