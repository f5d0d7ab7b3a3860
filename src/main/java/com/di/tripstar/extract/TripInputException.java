package com.di.tripstar.extract;

/**
 * The raw trip input cannot be used at all: missing or unreadable file, no
 * header, missing required columns, no valid rows, or too many rejected rows.
 */
public class TripInputException extends RuntimeException {

    public TripInputException(String message) {
        super(message);
    }

    public TripInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
