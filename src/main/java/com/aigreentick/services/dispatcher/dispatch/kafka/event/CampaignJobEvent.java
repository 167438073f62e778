package com.aigreentick.services.dispatcher.dispatch.kafka.event;

import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignJobEvent {
    private String jobId; // Unique job identifier

    private Long campaignId;

    private Long ownerId;

    private Long submittedAt; // Epoch millis

    /**
     * Creates the one-shot job for a freshly launched campaign.
     */
    public static CampaignJobEvent createForCampaign(Long campaignId, Long ownerId) {
        return CampaignJobEvent.builder()
                .jobId(UUID.randomUUID().toString())
                .campaignId(campaignId)
                .ownerId(ownerId)
                .submittedAt(System.currentTimeMillis())
                .build();
    }
}
