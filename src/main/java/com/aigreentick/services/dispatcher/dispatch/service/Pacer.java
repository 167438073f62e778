package com.aigreentick.services.dispatcher.dispatch.service;

import java.time.Duration;

/**
 * Blocking pause used between sends and during flood waits.
 */
public interface Pacer {

    void pause(Duration duration) throws InterruptedException;
}
