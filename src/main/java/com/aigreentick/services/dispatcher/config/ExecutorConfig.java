package com.aigreentick.services.dispatcher.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${campaign.executor.max-concurrent-campaigns:20}")
    private int maxConcurrentCampaigns;

    @Value("${campaign.executor.queue-capacity:100}")
    private int queueCapacity;

    /**
     * Runs whole campaigns. Each task blocks for the life of the campaign.
     */
    @Bean(name = "campaignExecutor", destroyMethod = "shutdown")
    public ExecutorService campaignExecutor() {
        log.info("Initializing campaignExecutor:");
        log.info("  - Max concurrent campaigns: {}", maxConcurrentCampaigns);
        log.info("  - Queue capacity: {} runs", queueCapacity);

        return new ThreadPoolExecutor(
                maxConcurrentCampaigns,
                maxConcurrentCampaigns,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r);
                    t.setName("campaign-" + t.getId());
                    t.setDaemon(false);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        log.warn("Campaign executor saturated! Rejected run. Queue: {}/{}, Active: {}/{}",
                                e.getQueue().size(), queueCapacity,
                                e.getActiveCount(), e.getMaximumPoolSize());
                        super.rejectedExecution(r, e);
                    }
                });
    }

    /**
     * One thread per connected sender of a running campaign. Unbounded because the number of
     * senders is bounded by linked accounts.
     */
    @Bean(name = "senderExecutor", destroyMethod = "shutdown")
    public ExecutorService senderExecutor() {
        log.info("Initializing senderExecutor (cached)");
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("sender-" + t.getId());
            t.setDaemon(false);
            return t;
        });
    }
}
