package com.di.tripstar.transform.dimension;

import com.di.tripstar.model.Coordinate;
import com.di.tripstar.model.TripRecord;

/** {@code dropoff_location_dim}. */
public final class DropoffLocationDimension extends LocationDimension {

    public static final DropoffLocationDimension INSTANCE = new DropoffLocationDimension();

    public static final String TABLE      = "dropoff_location_dim";
    public static final String KEY_COLUMN = "dropoff_location_id";

    private DropoffLocationDimension() {
        super("dropoff");
    }

    @Override
    public Coordinate naturalKey(TripRecord record) {
        return record.dropoffLocation();
    }
}
