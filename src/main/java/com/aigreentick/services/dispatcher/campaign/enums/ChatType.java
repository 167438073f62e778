package com.aigreentick.services.dispatcher.campaign.enums;

import java.util.Optional;

/**
 * Destination classification used for allow-list filtering.
 */
public enum ChatType {
    PRIVATE("private"),
    GROUP("group"),
    SUPERGROUP("supergroup"),
    CHANNEL("channel");

    private final String value;

    ChatType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<ChatType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String lowerValue = value.trim().toLowerCase();
        for (ChatType type : values()) {
            if (type.value.equals(lowerValue)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
