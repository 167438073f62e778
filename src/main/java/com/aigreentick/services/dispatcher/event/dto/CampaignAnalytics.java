package com.aigreentick.services.dispatcher.event.dto;

import java.util.List;
import java.util.Map;

import com.aigreentick.services.dispatcher.event.model.EventRecord;

/**
 * Aggregated view of one campaign's event log.
 */
public record CampaignAnalytics(
        Long campaignId,
        Map<String, Long> countsByKind,
        long sent,
        long uniqueDestinationsReached,
        List<ReasonTally> topFailureReasons,
        List<ReasonTally> topSkipReasons,
        Map<String, Long> countsByChatType,
        List<EventRecord> recent) {

    public long count(String kind) {
        return countsByKind.getOrDefault(kind, 0L);
    }

    public record ReasonTally(String reason, long count) {
    }
}
