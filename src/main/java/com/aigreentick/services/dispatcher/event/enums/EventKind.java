package com.aigreentick.services.dispatcher.event.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of records written to the campaign event log.
 */
public enum EventKind {
    ATTEMPT("attempt"),
    SENT("sent"),
    SENT_AFTER_FW("sent_after_fw"),
    FLOODWAIT("floodwait"),
    SKIPPED("skipped"),
    FAILED("failed"),
    CLIENT_CONNECT("client_connect"),
    CLIENT_CONNECT_FAIL("client_connect_fail"),
    DISCOVER_FAIL("discover_fail");

    public static final Set<EventKind> DELIVERED = EnumSet.of(SENT, SENT_AFTER_FW);

    private final String value;

    EventKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
