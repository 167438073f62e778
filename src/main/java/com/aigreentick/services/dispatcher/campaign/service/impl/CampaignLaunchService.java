package com.aigreentick.services.dispatcher.campaign.service.impl;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dispatcher.account.repository.SenderAccountRepository;
import com.aigreentick.services.dispatcher.campaign.dto.CreateCampaignRequest;
import com.aigreentick.services.dispatcher.campaign.dto.LaunchResult;
import com.aigreentick.services.dispatcher.campaign.enums.CampaignStatus;
import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.campaign.enums.TargetMode;
import com.aigreentick.services.dispatcher.campaign.exception.CampaignNotFoundException;
import com.aigreentick.services.dispatcher.campaign.exception.CampaignValidationException;
import com.aigreentick.services.dispatcher.campaign.model.Campaign;
import com.aigreentick.services.dispatcher.campaign.model.MessagePayload;
import com.aigreentick.services.dispatcher.campaign.model.RepeatConfig;
import com.aigreentick.services.dispatcher.campaign.repository.CampaignRepository;
import com.aigreentick.services.dispatcher.dispatch.kafka.producer.CampaignJobProducer;

import lombok.extern.slf4j.Slf4j;

/**
 * Creates and stops campaigns. Starting a campaign only persists it and queues a run job;
 * delivery happens in the job consumer.
 */
@Slf4j
@Service
public class CampaignLaunchService {

    private static final Set<CampaignStatus> ACTIVE_STATUSES = EnumSet.of(CampaignStatus.RUNNING, CampaignStatus.SLEEPING);

    private final CampaignRepository campaignRepository;
    private final SenderAccountRepository accountRepository;
    private final CampaignSpecMapper specMapper;
    private final CampaignJobProducer jobProducer;
    private final int maxIncludeIds;
    private final int maxExcludeIds;

    public CampaignLaunchService(
            CampaignRepository campaignRepository,
            SenderAccountRepository accountRepository,
            CampaignSpecMapper specMapper,
            CampaignJobProducer jobProducer,
            @Value("${campaign.targets.max-include:100}") int maxIncludeIds,
            @Value("${campaign.targets.max-exclude:100}") int maxExcludeIds) {
        this.campaignRepository = campaignRepository;
        this.accountRepository = accountRepository;
        this.specMapper = specMapper;
        this.jobProducer = jobProducer;
        this.maxIncludeIds = maxIncludeIds;
        this.maxExcludeIds = maxExcludeIds;
    }

    /**
     * Validates the request, stores the campaign as RUNNING and submits its run job.
     *
     * @throws CampaignValidationException listing every problem found
     */
    public LaunchResult launch(CreateCampaignRequest request) {
        log.info("=== Campaign Launch Requested ===");
        log.info("OwnerId: {} | Mode: {}", request.getOwnerId(), request.getMode());

        MessagePayload message = new MessagePayload(request.getText(), request.getMedia(), request.getButtons());
        TargetMode mode = TargetMode.fromValue(request.getMode());
        List<Long> includeIds = request.getIncludeIds() != null ? request.getIncludeIds() : List.of();
        List<Long> excludeIds = request.getExcludeIds() != null ? request.getExcludeIds() : List.of();
        Set<ChatType> allowedTypes = specMapper.mergeChatTypes(request.getChatTypes());

        List<String> errors = new ArrayList<>();
        if (message.isEmpty()) {
            errors.add("Message needs text or a media attachment");
        }
        if (mode == TargetMode.INCLUDE && includeIds.isEmpty()) {
            errors.add("Include mode needs at least one target id");
        }
        if (includeIds.size() > maxIncludeIds) {
            errors.add("At most " + maxIncludeIds + " include ids are allowed, got " + includeIds.size());
        }
        if (excludeIds.size() > maxExcludeIds) {
            errors.add("At most " + maxExcludeIds + " exclude ids are allowed, got " + excludeIds.size());
        }
        if (allowedTypes.isEmpty()) {
            errors.add("At least one chat type must be enabled");
        }
        if (request.getRatePerMin() != null && request.getRatePerMin() <= 0) {
            errors.add("ratePerMin must be greater than 0");
        }

        long accounts = accountRepository.countByOwnerIdAndActiveTrue(request.getOwnerId());
        if (accounts == 0) {
            errors.add("Owner has no active sender accounts");
        }
        if (campaignRepository.existsByOwnerIdAndStatusIn(request.getOwnerId(), ACTIVE_STATUSES)) {
            errors.add("Owner already has a running campaign");
        }

        if (!errors.isEmpty()) {
            log.warn("Campaign launch rejected for owner {}: {}", request.getOwnerId(), errors);
            throw new CampaignValidationException(errors);
        }

        Campaign campaign = Campaign.builder()
                .ownerId(request.getOwnerId())
                .message(specMapper.writeMessage(message))
                .targetMode(mode)
                .includeIds(specMapper.writeIds(includeIds))
                .excludeIds(specMapper.writeIds(excludeIds))
                .chatTypes(specMapper.writeChatTypes(request.getChatTypes()))
                .ratePerMin(request.getRatePerMin())
                .status(CampaignStatus.RUNNING)
                .repeatEnabled(Boolean.TRUE.equals(request.getRepeatEnabled()))
                .repeatRestSeconds(request.getRepeatRestSeconds() != null
                        ? request.getRepeatRestSeconds()
                        : RepeatConfig.DEFAULT_REST_SECONDS)
                .build();
        campaign = campaignRepository.save(campaign);

        jobProducer.submit(campaign.getId(), campaign.getOwnerId());

        log.info("Campaign {} created and queued | Accounts: {}", campaign.getId(), accounts);
        return new LaunchResult(campaign.getId(), CampaignStatus.RUNNING.getValue(), (int) accounts);
    }

    /**
     * Marks the campaign STOPPED. Sender loops observe it at their next target.
     */
    @Transactional
    public void stop(Long campaignId) {
        int updated = campaignRepository.markStopped(campaignId, LocalDateTime.now());
        if (updated == 0) {
            throw new CampaignNotFoundException(campaignId);
        }
        log.info("Campaign {} stopped on request", campaignId);
    }
}
