package com.aigreentick.services.dispatcher.event.service.impl;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dispatcher.event.dto.CampaignAnalytics;
import com.aigreentick.services.dispatcher.event.dto.CampaignAnalytics.ReasonTally;
import com.aigreentick.services.dispatcher.event.enums.EventKind;
import com.aigreentick.services.dispatcher.event.model.CampaignEvent;
import com.aigreentick.services.dispatcher.event.repository.CampaignEventRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-side aggregation over the campaign event log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignAnalyticsService {

    private static final String UNKNOWN = "unknown";

    private final CampaignEventRepository eventRepository;

    @Transactional(readOnly = true)
    public CampaignAnalytics summarize(Long campaignId, int topN, int recentN) {
        if (topN < 1 || recentN < 0) {
            throw new IllegalArgumentException("topN must be >= 1 and recentN >= 0");
        }

        Map<String, Long> countsByKind = new LinkedHashMap<>();
        for (EventKind kind : EventKind.values()) {
            countsByKind.put(kind.getValue(), 0L);
        }
        for (CampaignEventRepository.KindCount row : eventRepository.countByKind(campaignId)) {
            countsByKind.put(row.getKind().getValue(), row.getTotal());
        }

        long sent = countsByKind.get(EventKind.SENT.getValue())
                + countsByKind.get(EventKind.SENT_AFTER_FW.getValue());
        long reached = eventRepository.countDistinctDestinations(campaignId, EventKind.DELIVERED);

        Map<String, Long> byType = new LinkedHashMap<>();
        for (CampaignEventRepository.ChatTypeCount row : eventRepository.countByChatType(
                campaignId, EnumSet.of(EventKind.ATTEMPT, EventKind.SENT, EventKind.SENT_AFTER_FW))) {
            String key = row.getChatType() != null ? row.getChatType().getValue() : UNKNOWN;
            byType.merge(key, row.getTotal(), Long::sum);
        }

        List<CampaignEvent> recent = recentN == 0
                ? List.of()
                : eventRepository.findByCampaignIdOrderByOccurredAtDescIdDesc(campaignId, PageRequest.of(0, recentN));

        log.debug("Analytics computed. campaignId={} sent={} reached={}", campaignId, sent, reached);

        return new CampaignAnalytics(
                campaignId,
                countsByKind,
                sent,
                reached,
                topReasons(campaignId, EventKind.FAILED, topN),
                topReasons(campaignId, EventKind.SKIPPED, topN),
                byType,
                recent.stream().map(CampaignEvent::toRecord).toList());
    }

    private List<ReasonTally> topReasons(Long campaignId, EventKind kind, int topN) {
        return eventRepository.topReasons(campaignId, kind, PageRequest.of(0, topN)).stream()
                .map(row -> new ReasonTally(row.getReason() != null ? row.getReason() : UNKNOWN, row.getTotal()))
                .toList();
    }
}
