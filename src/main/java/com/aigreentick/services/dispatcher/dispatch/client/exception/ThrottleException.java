package com.aigreentick.services.dispatcher.dispatch.client.exception;

/**
 * Provider flood-wait: retry after {@link #getWaitSeconds()} seconds.
 */
public class ThrottleException extends TransportException {

    private final int waitSeconds;

    public ThrottleException(int waitSeconds) {
        super(TransportErrorKind.RATE_LIMITED, "Flood wait of " + waitSeconds + "s requested");
        if (waitSeconds < 0) {
            throw new IllegalArgumentException("waitSeconds must be >= 0");
        }
        this.waitSeconds = waitSeconds;
    }

    public int getWaitSeconds() {
        return waitSeconds;
    }
}
