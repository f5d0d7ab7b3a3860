package com.di.tripstar.model;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * Pickup and dropoff instants of a trip; natural key of {@code datetime_dim}.
 */
public record TripWindow(LocalDateTime pickup, LocalDateTime dropoff) implements Comparable<TripWindow> {

    private static final Comparator<TripWindow> ORDER = Comparator
            .comparing(TripWindow::pickup)
            .thenComparing(TripWindow::dropoff);

    public TripWindow {
        Objects.requireNonNull(pickup, "pickup");
        Objects.requireNonNull(dropoff, "dropoff");
    }

    @Override
    public int compareTo(TripWindow other) {
        return ORDER.compare(this, other);
    }
}
