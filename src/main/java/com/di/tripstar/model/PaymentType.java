package com.di.tripstar.model;

/**
 * TLC payment type codes and their display names.
 */
public enum PaymentType {

    CREDIT_CARD(1, "Credit card"),
    CASH(2, "Cash"),
    NO_CHARGE(3, "No charge"),
    DISPUTE(4, "Dispute"),
    UNKNOWN(5, "Unknown"),
    VOIDED_TRIP(6, "Voided trip");

    private final int    code;
    private final String displayName;

    PaymentType(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Display name for a code; codes outside 1..6 map to {@code "Unknown"}. */
    public static String nameOf(int code) {
        for (PaymentType pt : values()) {
            if (pt.code == code) {
                return pt.displayName;
            }
        }
        return UNKNOWN.displayName;
    }
}
