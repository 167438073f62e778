package com.aigreentick.services.dispatcher.dispatch.kafka.consumer;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dispatcher.dispatch.kafka.event.CampaignJobEvent;
import com.aigreentick.services.dispatcher.dispatch.model.DispatchRunResult;
import com.aigreentick.services.dispatcher.dispatch.service.CampaignDispatcher;

import lombok.extern.slf4j.Slf4j;

/**
 * Kafka consumer for campaign run requests.
 *
 * The record is acknowledged before the run starts, so a job is executed at most once.
 * The run itself happens on the campaign executor and can take hours; the listener thread
 * returns immediately.
 */
@Slf4j
@Component
public class CampaignJobConsumer {

    private final CampaignDispatcher campaignDispatcher;
    private final ExecutorService campaignExecutor;

    public CampaignJobConsumer(
            CampaignDispatcher campaignDispatcher,
            @Qualifier("campaignExecutor") ExecutorService campaignExecutor) {
        this.campaignDispatcher = campaignDispatcher;
        this.campaignExecutor = campaignExecutor;
    }

    @KafkaListener(
        topics = "${kafka.topics.campaign-jobs.name}",
        groupId = "${spring.kafka.consumer.group-id}",
        containerFactory = "campaignJobListenerFactory"
    )
    public void consumeCampaignJob(
            @Payload CampaignJobEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.info("Received campaign job: campaignId={} jobId={} partition={} offset={}",
                event.getCampaignId(), event.getJobId(), partition, offset);

        acknowledgment.acknowledge();

        if (event.getCampaignId() == null) {
            log.warn("Dropping campaign job without campaignId. jobId={}", event.getJobId());
            return;
        }

        try {
            campaignExecutor.execute(() -> run(event));
        } catch (RejectedExecutionException e) {
            log.error("Campaign executor rejected job. campaignId={} jobId={}",
                    event.getCampaignId(), event.getJobId(), e);
        }
    }

    private void run(CampaignJobEvent event) {
        try {
            DispatchRunResult result = campaignDispatcher.dispatch(event.getCampaignId());
            if (!result.ok()) {
                log.warn("Campaign job finished without running. campaignId={} error={}",
                        event.getCampaignId(), result.error());
            }
        } catch (Exception e) {
            log.error("Campaign job failed. campaignId={} jobId={}", event.getCampaignId(), event.getJobId(), e);
        }
    }
}
