package com.aigreentick.services.dispatcher.campaign.exception;

public class CampaignNotFoundException extends RuntimeException {

    public CampaignNotFoundException(Long campaignId) {
        super("Campaign not found: " + campaignId);
    }
}
