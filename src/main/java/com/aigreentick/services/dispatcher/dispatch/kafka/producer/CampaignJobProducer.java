package com.aigreentick.services.dispatcher.dispatch.kafka.producer;

import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dispatcher.dispatch.kafka.event.CampaignJobEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignJobProducer {
    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${kafka.topics.campaign-jobs.name}")
    private String topicName;

    /**
     * Publishes a run request for the campaign, keyed by campaign id.
     */
    public CompletableFuture<SendResult<String, Object>> submit(Long campaignId, Long ownerId) {
        CampaignJobEvent event = CampaignJobEvent.createForCampaign(campaignId, ownerId);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(
                topicName,
                String.valueOf(campaignId),
                event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish campaign job. campaignId={} jobId={}",
                        campaignId, event.getJobId(), ex);
            } else {
                log.info("Campaign job published. campaignId={} jobId={} partition={} offset={}",
                        campaignId,
                        event.getJobId(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
        });

        return future;
    }
}
