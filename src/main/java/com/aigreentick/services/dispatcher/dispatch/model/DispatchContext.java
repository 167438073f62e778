package com.aigreentick.services.dispatcher.dispatch.model;

import java.time.LocalDateTime;

import com.aigreentick.services.dispatcher.campaign.model.CampaignSpec;
import com.aigreentick.services.dispatcher.event.enums.EventKind;
import com.aigreentick.services.dispatcher.event.model.EventRecord;

/**
 * Everything a single campaign run needs, passed explicitly to each collaborator.
 */
public record DispatchContext(CampaignSpec spec, RunControl runControl) {

    public Long campaignId() {
        return spec.id();
    }

    public Long ownerId() {
        return spec.ownerId();
    }

    public boolean isRunning() {
        return runControl.isRunning();
    }

    /**
     * Event builder pre-filled with owner, campaign and timestamp.
     */
    public EventRecord.EventRecordBuilder event(EventKind kind) {
        return EventRecord.builder()
                .ownerId(spec.ownerId())
                .campaignId(spec.id())
                .occurredAt(LocalDateTime.now())
                .kind(kind);
    }
}
