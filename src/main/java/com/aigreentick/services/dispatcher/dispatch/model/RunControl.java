package com.aigreentick.services.dispatcher.dispatch.model;

/**
 * Cooperative cancellation, polled by sender loops at each target boundary.
 */
@FunctionalInterface
public interface RunControl {

    boolean isRunning();
}
