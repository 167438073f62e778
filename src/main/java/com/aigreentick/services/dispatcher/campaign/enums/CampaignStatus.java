package com.aigreentick.services.dispatcher.campaign.enums;

/**
 * Lifecycle status of a campaign run.
 * SLEEPING is reserved by the front end between repeat cycles and is never written here.
 */
public enum CampaignStatus {
    RUNNING("running"),
    STOPPED("stopped"),
    COMPLETED("completed"),
    SLEEPING("sleeping");

    private final String value;

    CampaignStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
