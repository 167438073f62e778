package com.aigreentick.services.dispatcher.event.service;

import com.aigreentick.services.dispatcher.event.model.EventRecord;

/**
 * Write-only, append-only campaign telemetry. Implementations must be safe for concurrent
 * use by several sender loops and must not throw on storage failure.
 */
public interface EventSink {

    void append(EventRecord record);
}
