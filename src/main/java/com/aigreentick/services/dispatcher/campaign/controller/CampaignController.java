package com.aigreentick.services.dispatcher.campaign.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.aigreentick.services.dispatcher.campaign.dto.CreateCampaignRequest;
import com.aigreentick.services.dispatcher.campaign.dto.LaunchResult;
import com.aigreentick.services.dispatcher.campaign.dto.ResponseMessage;
import com.aigreentick.services.dispatcher.campaign.exception.CampaignNotFoundException;
import com.aigreentick.services.dispatcher.campaign.repository.CampaignRepository;
import com.aigreentick.services.dispatcher.campaign.service.impl.CampaignLaunchService;
import com.aigreentick.services.dispatcher.event.dto.CampaignAnalytics;
import com.aigreentick.services.dispatcher.event.service.impl.CampaignAnalyticsService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST Controller for campaign operations.
 * Starting a campaign queues a run job and returns immediately.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignLaunchService launchService;
    private final CampaignAnalyticsService analyticsService;
    private final CampaignRepository campaignRepository;

    @PostMapping
    public ResponseEntity<ResponseMessage<LaunchResult>> startCampaign(
            @Valid @RequestBody CreateCampaignRequest request) {

        log.info("=== Start Campaign Request Received ===");
        LaunchResult result = launchService.launch(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ResponseMessage.success("Campaign " + result.campaignId() + " queued", result));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<ResponseMessage<Void>> stopCampaign(@PathVariable("id") Long id) {
        log.info("=== Stop Campaign Request Received === campaignId={}", id);
        launchService.stop(id);
        return ResponseEntity.ok(ResponseMessage.success("Campaign " + id + " stopped", null));
    }

    @GetMapping("/{id}/analytics")
    public ResponseEntity<ResponseMessage<CampaignAnalytics>> analytics(
            @PathVariable("id") Long id,
            @RequestParam(name = "top", defaultValue = "5") int top,
            @RequestParam(name = "recent", defaultValue = "20") int recent) {

        if (!campaignRepository.existsById(id)) {
            throw new CampaignNotFoundException(id);
        }
        CampaignAnalytics analytics = analyticsService.summarize(id, top, recent);
        return ResponseEntity.ok(ResponseMessage.success("Analytics for campaign " + id, analytics));
    }

    @GetMapping("/check")
    public ResponseEntity<String> checkRunning() {
        log.info("=== check Running Request Received ===");
        return ResponseEntity.ok("Campaign dispatcher is running");
    }
}
