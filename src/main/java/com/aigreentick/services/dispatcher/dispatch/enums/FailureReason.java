package com.aigreentick.services.dispatcher.dispatch.enums;

/**
 * Analytics grouping for failed deliveries. Never drives control flow.
 */
public enum FailureReason {
    RATE_LIMITED("rate-limited"),
    REQUIRES_PEER_INITIATION("requires-peer-initiation"),
    FORBIDDEN_NOT_ALLOWED("forbidden/not-allowed"),
    FORBIDDEN_BLOCKED("forbidden/blocked"),
    FORBIDDEN_NOT_MEMBER("forbidden/not-member"),
    MUTED_RESTRICTED("muted/restricted"),
    DEACTIVATED_ACCOUNT("deactivated-account"),
    PEER_INVALID("peer/invalid"),
    RATE_SLOWMODE("rate/slowmode"),
    UNKNOWN("unknown");

    private final String value;

    FailureReason(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
