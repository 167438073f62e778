package com.aigreentick.services.dispatcher.dispatch.service.impl;

import java.time.Duration;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dispatcher.dispatch.service.Pacer;

@Component
public class ThreadSleepPacer implements Pacer {

    @Override
    public void pause(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        Thread.sleep(duration.toMillis());
    }
}
