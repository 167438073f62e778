package com.aigreentick.services.dispatcher.dispatch.exception;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;

/**
 * A destination that is filtered out or unreachable. Not an error: the sender loop logs a
 * skipped event and moves on.
 */
public class SkipTargetException extends RuntimeException {

    public static final String UNRESOLVED_PEER = "unresolved_peer";
    public static final String TYPE_DISABLED_PREFIX = "type_disabled:";

    private final String reason;

    public SkipTargetException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static SkipTargetException unresolved(long destinationId) {
        return new SkipTargetException(UNRESOLVED_PEER, "Peer resolution failed for " + destinationId);
    }

    public static SkipTargetException typeDisabled(long destinationId, ChatType type) {
        return new SkipTargetException(TYPE_DISABLED_PREFIX + type.getValue(),
                "Chat type " + type.getValue() + " is disabled for " + destinationId);
    }

    public String getReason() {
        return reason;
    }
}
