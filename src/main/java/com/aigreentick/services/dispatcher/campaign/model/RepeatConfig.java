package com.aigreentick.services.dispatcher.campaign.model;

/**
 * Cycle settings stored with a campaign. The dispatcher runs each campaign once and does
 * not read these values.
 */
public record RepeatConfig(boolean enabled, int restSeconds) {

    public static final int DEFAULT_REST_SECONDS = 60;

    public static RepeatConfig disabled() {
        return new RepeatConfig(false, DEFAULT_REST_SECONDS);
    }
}
