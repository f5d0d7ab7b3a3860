package com.di.tripstar.transform.dimension;

import com.di.tripstar.model.Coordinate;
import com.di.tripstar.model.TripRecord;

/** {@code pickup_location_dim}. */
public final class PickupLocationDimension extends LocationDimension {

    public static final PickupLocationDimension INSTANCE = new PickupLocationDimension();

    public static final String TABLE      = "pickup_location_dim";
    public static final String KEY_COLUMN = "pickup_location_id";

    private PickupLocationDimension() {
        super("pickup");
    }

    @Override
    public Coordinate naturalKey(TripRecord record) {
        return record.pickupLocation();
    }
}
