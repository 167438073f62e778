package com.aigreentick.services.dispatcher.dispatch.kafka.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class KafkaTopicConfig {

    @Value("${kafka.topics.campaign-jobs.name}")
    private String campaignJobsTopicName;

    @Value("${kafka.topics.campaign-jobs.partitions:6}")
    private int campaignJobsPartitions;

    @Value("${kafka.topics.campaign-jobs.replicas:1}")
    private int campaignJobsReplicas;

    /**
     * Run requests, one record per launched campaign. Keyed by campaignId.
     */
    @Bean
    public NewTopic campaignJobsTopic() {
        NewTopic topic = TopicBuilder.name(campaignJobsTopicName)
                .partitions(campaignJobsPartitions)
                .replicas(campaignJobsReplicas)
                .config("retention.ms", "604800000") // 7 days
                .config("min.insync.replicas", "1")
                .build();

        log.info("=== Campaign Jobs Topic Configuration ===");
        log.info("  - Name: {}", campaignJobsTopicName);
        log.info("  - Partitions: {}", campaignJobsPartitions);
        log.info("  - Replicas: {}", campaignJobsReplicas);
        log.info("  - Retention: 7 days");

        return topic;
    }
}
