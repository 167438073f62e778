package com.aigreentick.services.dispatcher.event.service.impl;

import org.springframework.stereotype.Service;

import com.aigreentick.services.dispatcher.event.model.CampaignEvent;
import com.aigreentick.services.dispatcher.event.model.EventRecord;
import com.aigreentick.services.dispatcher.event.repository.CampaignEventRepository;
import com.aigreentick.services.dispatcher.event.service.EventSink;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaEventSink implements EventSink {

    private final CampaignEventRepository eventRepository;

    @Override
    public void append(EventRecord record) {
        try {
            eventRepository.save(CampaignEvent.from(record));
        } catch (Exception e) {
            // Telemetry loss must not stop delivery
            log.error("Failed to append event. campaignId={} kind={} destination={}",
                    record.campaignId(), record.kind(), record.destinationId(), e);
        }
    }
}
