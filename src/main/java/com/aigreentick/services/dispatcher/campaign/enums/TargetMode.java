package com.aigreentick.services.dispatcher.campaign.enums;

public enum TargetMode {
    INCLUDE("include"),
    ALL("all");

    private final String value;

    TargetMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Case-insensitive lookup, defaulting to INCLUDE for null or unknown values.
     */
    public static TargetMode fromValue(String value) {
        if (value == null) {
            return INCLUDE;
        }
        for (TargetMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        return INCLUDE;
    }
}
