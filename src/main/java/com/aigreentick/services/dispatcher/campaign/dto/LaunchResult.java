package com.aigreentick.services.dispatcher.campaign.dto;

public record LaunchResult(
        Long campaignId,
        String status,
        int senderAccounts) {
}
