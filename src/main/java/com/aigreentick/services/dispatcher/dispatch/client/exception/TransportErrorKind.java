package com.aigreentick.services.dispatcher.dispatch.client.exception;

/**
 * Structured provider error variants reported by transports.
 */
public enum TransportErrorKind {
    RATE_LIMITED,
    PEER_INITIATION_REQUIRED,
    WRITE_FORBIDDEN,
    BLOCKED,
    NOT_MEMBER,
    RESTRICTED,
    ACCOUNT_DEACTIVATED,
    PEER_INVALID,
    SLOWMODE,
    CONNECTION,
    UNKNOWN
}
