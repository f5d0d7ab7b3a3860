package com.di.tripstar.extract;

import com.di.tripstar.model.RejectedRow;
import com.di.tripstar.model.TripRecord;
import lombok.Value;

import java.util.List;

/**
 * Immutable result of extraction: valid trips in file order plus the rows
 * that were skipped and why.
 */
@Value
public class RawTripTable {

    String            sourceUri;
    List<TripRecord>  records;
    List<RejectedRow> rejected;

    public RawTripTable(String sourceUri, List<TripRecord> records, List<RejectedRow> rejected) {
        this.sourceUri = sourceUri;
        this.records   = List.copyOf(records);
        this.rejected  = List.copyOf(rejected);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
