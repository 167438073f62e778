package com.aigreentick.services.dispatcher.dispatch.service.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class SendPacingTest {

    @Test
    void testInterval_WhenRateIsFive_WaitsTwelveSeconds() {
        assertEquals(12.0, SendPacing.intervalSeconds(5));
        assertEquals(Duration.ofSeconds(12), SendPacing.interval(5));
    }

    @Test
    void testInterval_WhenRateIsSixty_WaitsOneSecond() {
        assertEquals(1.0, SendPacing.intervalSeconds(60));
    }

    @Test
    void testInterval_WhenRateAboveSixty_ClampsToOneSecond() {
        assertEquals(1.0, SendPacing.intervalSeconds(600));
        assertEquals(Duration.ofSeconds(1), SendPacing.interval(1000));
    }

    @Test
    void testInterval_WhenRateNotDivisor_KeepsFraction() {
        assertEquals(8571, SendPacing.interval(7).toMillis());
        assertEquals(60.0 / 7, SendPacing.intervalSeconds(7), 1e-9);
    }

    @Test
    void testInterval_WhenRateNotPositive_Throws() {
        assertThrows(IllegalArgumentException.class, () -> SendPacing.intervalSeconds(0));
        assertThrows(IllegalArgumentException.class, () -> SendPacing.intervalSeconds(-3));
    }

    @Test
    void testFloodWait_AddsOneSecond() {
        assertEquals(Duration.ofSeconds(8), SendPacing.floodWait(7));
        assertEquals(Duration.ofSeconds(1), SendPacing.floodWait(0));
    }
}
