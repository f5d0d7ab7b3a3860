package com.di.tripstar.model;

import java.util.Comparator;

/**
 * Latitude/longitude pair, ordered by latitude then longitude.
 */
public record Coordinate(double latitude, double longitude) implements Comparable<Coordinate> {

    private static final Comparator<Coordinate> ORDER = Comparator
            .comparingDouble(Coordinate::latitude)
            .thenComparingDouble(Coordinate::longitude);

    @Override
    public int compareTo(Coordinate other) {
        return ORDER.compare(this, other);
    }
}
