package com.di.tripstar.model;

/**
 * TLC rate codes ({@code RatecodeID}) and their display names.
 */
public enum RateCode {

    STANDARD(1, "Standard rate"),
    JFK(2, "JFK"),
    NEWARK(3, "Newark"),
    NASSAU_OR_WESTCHESTER(4, "Nassau or Westchester"),
    NEGOTIATED(5, "Negotiated fare"),
    GROUP_RIDE(6, "Group ride");

    public static final String UNKNOWN_NAME = "Unknown";

    private final int    code;
    private final String displayName;

    RateCode(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static String nameOf(int code) {
        for (RateCode rc : values()) {
            if (rc.code == code) {
                return rc.displayName;
            }
        }
        return UNKNOWN_NAME;
    }
}
