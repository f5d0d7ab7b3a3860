package com.di.tripstar.model;

import lombok.Value;

/**
 * A source record that did not make it into the star schema, with the reason.
 */
@Value
public class RejectedRow {

    /** 1-based data record number in the source file (header excluded). */
    long   recordNumber;
    String reason;
}
