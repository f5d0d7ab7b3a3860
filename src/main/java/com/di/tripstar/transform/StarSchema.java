package com.di.tripstar.transform;

import com.di.tripstar.transform.dimension.TripDimensions;
import com.di.tripstar.transform.fact.FactTable;
import lombok.NonNull;
import lombok.Value;

/**
 * Dimensions and facts of one run, ready for loading.
 */
@Value
public class StarSchema {
    @NonNull TripDimensions dimensions;
    @NonNull FactTable      facts;
}
