package com.aigreentick.services.dispatcher.dispatch.client;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.aigreentick.services.dispatcher.dispatch.service.Pacer;

/**
 * Records requested pauses instead of sleeping.
 */
public class RecordingPacer implements Pacer {

    private final List<Duration> pauses = new CopyOnWriteArrayList<>();

    @Override
    public void pause(Duration duration) {
        pauses.add(duration);
    }

    public List<Duration> getPauses() {
        return List.copyOf(pauses);
    }
}
