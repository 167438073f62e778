package com.aigreentick.services.dispatcher.dispatch.service.impl;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.aigreentick.services.dispatcher.campaign.enums.CampaignStatus;
import com.aigreentick.services.dispatcher.campaign.exception.InvalidCampaignSpecException;
import com.aigreentick.services.dispatcher.campaign.model.Campaign;
import com.aigreentick.services.dispatcher.campaign.model.CampaignSpec;
import com.aigreentick.services.dispatcher.campaign.repository.CampaignRepository;
import com.aigreentick.services.dispatcher.campaign.service.impl.CampaignSpecMapper;
import com.aigreentick.services.dispatcher.dispatch.client.MessageTransport;
import com.aigreentick.services.dispatcher.dispatch.client.exception.ThrottleException;
import com.aigreentick.services.dispatcher.dispatch.exception.SkipTargetException;
import com.aigreentick.services.dispatcher.dispatch.model.ConnectedSender;
import com.aigreentick.services.dispatcher.dispatch.model.DispatchContext;
import com.aigreentick.services.dispatcher.dispatch.model.DispatchRunResult;
import com.aigreentick.services.dispatcher.dispatch.model.ResolvedPeer;
import com.aigreentick.services.dispatcher.dispatch.service.CampaignDispatcher;
import com.aigreentick.services.dispatcher.dispatch.service.Pacer;
import com.aigreentick.services.dispatcher.event.enums.EventKind;
import com.aigreentick.services.dispatcher.event.service.EventSink;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class CampaignDispatcherImpl implements CampaignDispatcher {

    static final String RECONNECT_FAILED = "reconnect_failed";

    private final CampaignRepository campaignRepository;
    private final CampaignSpecMapper specMapper;
    private final SenderPool senderPool;
    private final TargetResolver targetResolver;
    private final PeerResolver peerResolver;
    private final FailureClassifier failureClassifier;
    private final EventSink eventSink;
    private final Pacer pacer;
    private final ExecutorService senderExecutor;

    public CampaignDispatcherImpl(
            CampaignRepository campaignRepository,
            CampaignSpecMapper specMapper,
            SenderPool senderPool,
            TargetResolver targetResolver,
            PeerResolver peerResolver,
            FailureClassifier failureClassifier,
            EventSink eventSink,
            Pacer pacer,
            @Qualifier("senderExecutor") ExecutorService senderExecutor) {
        this.campaignRepository = campaignRepository;
        this.specMapper = specMapper;
        this.senderPool = senderPool;
        this.targetResolver = targetResolver;
        this.peerResolver = peerResolver;
        this.failureClassifier = failureClassifier;
        this.eventSink = eventSink;
        this.pacer = pacer;
        this.senderExecutor = senderExecutor;
    }

    @Override
    public DispatchRunResult dispatch(Long campaignId) {
        long startTime = System.currentTimeMillis();
        log.info("=== Campaign Run Started ===");
        log.info("CampaignId: {}", campaignId);

        Optional<Campaign> campaign;
        try {
            campaign = campaignRepository.findById(campaignId);
        } catch (RuntimeException e) {
            log.error("Campaign {}: failed to load campaign", campaignId, e);
            return DispatchRunResult.failed(campaignId, DispatchRunResult.LOAD_FAILED);
        }
        if (campaign.isEmpty()) {
            log.warn("Campaign {} not found, nothing to dispatch", campaignId);
            return DispatchRunResult.failed(campaignId, DispatchRunResult.NOT_FOUND);
        }

        CampaignSpec spec;
        try {
            spec = specMapper.toSpec(campaign.get());
        } catch (InvalidCampaignSpecException | IllegalArgumentException e) {
            log.error("Campaign {} has an invalid definition: {}", campaignId, e.getMessage());
            return DispatchRunResult.failed(campaignId, DispatchRunResult.INVALID_SPEC);
        }

        DispatchContext ctx = new DispatchContext(spec, () -> isRunning(campaignId));

        List<ConnectedSender> senders;
        try {
            senders = senderPool.connectAll(ctx);
        } catch (RuntimeException e) {
            log.error("Campaign {}: failed to load sender accounts", campaignId, e);
            return DispatchRunResult.failed(campaignId, DispatchRunResult.LOAD_FAILED);
        }
        if (senders.isEmpty()) {
            log.warn("Campaign {}: no sender account could be connected", campaignId);
            return DispatchRunResult.failed(campaignId, DispatchRunResult.NO_ACCOUNTS);
        }

        int targetCount = 0;
        try {
            List<Long> targets = targetResolver.resolve(ctx, senders.get(0));
            targetCount = targets.size();
            log.info("Campaign {} | Mode: {} | Targets: {} | Senders: {} | Rate: {}/min",
                    campaignId, spec.mode(), targetCount, senders.size(), spec.ratePerMin());

            if (!targets.isEmpty()) {
                runSenders(ctx, senders, targets);
            }
        } finally {
            senderPool.releaseAll(campaignId, senders);
            markCompleted(campaignId);
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("=== Campaign Run Completed ===");
        log.info("CampaignId: {} | Targets: {} | Senders: {} | Duration: {}ms",
                campaignId, targetCount, senders.size(), duration);
        return DispatchRunResult.completed(campaignId, targetCount, senders.size());
    }

    private void runSenders(DispatchContext ctx, List<ConnectedSender> senders, List<Long> targets) {
        List<List<Long>> partitions = TargetPartitioner.roundRobin(targets, senders.size());
        Duration interval = SendPacing.interval(ctx.spec().ratePerMin());

        List<CompletableFuture<Void>> futures = new ArrayList<>(senders.size());
        for (int i = 0; i < senders.size(); i++) {
            ConnectedSender sender = senders.get(i);
            List<Long> partition = partitions.get(i);
            futures.add(CompletableFuture.runAsync(
                    () -> runSender(ctx, sender, partition, interval), senderExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            log.error("Campaign {}: a sender loop terminated abnormally", ctx.campaignId(), e.getCause());
        }
    }

    /**
     * Delivers one partition. Returns early when the campaign leaves RUNNING, when the
     * transport cannot be re-established, or when the thread is interrupted.
     */
    private void runSender(DispatchContext ctx, ConnectedSender sender, List<Long> partition, Duration interval) {
        log.debug("Campaign {}: sender {} starting with {} targets",
                ctx.campaignId(), sender.label(), partition.size());

        for (Long destinationId : partition) {
            if (!ensureConnected(ctx, sender)) {
                return;
            }
            if (!ctx.isRunning()) {
                log.info("Campaign {} is no longer running, sender {} stops", ctx.campaignId(), sender.label());
                return;
            }

            try {
                deliver(ctx, sender, destinationId);
                pacer.pause(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Campaign {}: sender {} interrupted, abandoning its remaining targets",
                        ctx.campaignId(), sender.label());
                return;
            }
        }

        log.debug("Campaign {}: sender {} finished its partition", ctx.campaignId(), sender.label());
    }

    private void deliver(DispatchContext ctx, ConnectedSender sender, long destinationId)
            throws InterruptedException {
        MessageTransport transport = sender.transport();
        CampaignSpec spec = ctx.spec();

        ResolvedPeer peer;
        try {
            peer = peerResolver.resolve(transport, destinationId, spec.allowedTypes());
        } catch (SkipTargetException e) {
            log.debug("Campaign {}: skipping {} ({})", ctx.campaignId(), destinationId, e.getReason());
            eventSink.append(ctx.event(EventKind.SKIPPED)
                    .destinationId(destinationId)
                    .reason(e.getReason())
                    .account(sender.label())
                    .build());
            return;
        } catch (RuntimeException e) {
            recordFailure(ctx, sender, destinationId, null, e);
            return;
        }

        eventSink.append(ctx.event(EventKind.ATTEMPT)
                .destinationId(destinationId)
                .resolvedId(peer.resolvedId())
                .chatType(peer.type())
                .chatTitle(peer.title())
                .account(sender.label())
                .build());

        try {
            transport.send(spec.message(), peer.resolvedId());
            eventSink.append(ctx.event(EventKind.SENT)
                    .destinationId(destinationId)
                    .resolvedId(peer.resolvedId())
                    .chatType(peer.type())
                    .account(sender.label())
                    .build());
        } catch (ThrottleException e) {
            retryAfterFloodWait(ctx, sender, peer, e.getWaitSeconds());
        } catch (RuntimeException e) {
            recordFailure(ctx, sender, destinationId, peer, e);
        }
    }

    private void retryAfterFloodWait(DispatchContext ctx, ConnectedSender sender, ResolvedPeer peer, int waitSeconds)
            throws InterruptedException {
        log.info("Campaign {}: flood wait {}s on {} via {}",
                ctx.campaignId(), waitSeconds, peer.destinationId(), sender.label());
        eventSink.append(ctx.event(EventKind.FLOODWAIT)
                .destinationId(peer.destinationId())
                .resolvedId(peer.resolvedId())
                .chatType(peer.type())
                .waitSeconds(waitSeconds)
                .account(sender.label())
                .build());

        pacer.pause(SendPacing.floodWait(waitSeconds));

        try {
            sender.transport().send(ctx.spec().message(), peer.resolvedId());
            eventSink.append(ctx.event(EventKind.SENT_AFTER_FW)
                    .destinationId(peer.destinationId())
                    .resolvedId(peer.resolvedId())
                    .chatType(peer.type())
                    .account(sender.label())
                    .build());
        } catch (RuntimeException e) {
            // a second throttle is terminal as well
            recordFailure(ctx, sender, peer.destinationId(), peer, e);
        }
    }

    private void recordFailure(DispatchContext ctx, ConnectedSender sender, long destinationId,
            ResolvedPeer peer, RuntimeException error) {
        String reason = failureClassifier.classify(error).getValue();
        log.warn("Campaign {}: delivery to {} via {} failed [{}]: {}",
                ctx.campaignId(), destinationId, sender.label(), reason, error.getMessage());
        eventSink.append(ctx.event(EventKind.FAILED)
                .destinationId(destinationId)
                .resolvedId(peer != null ? peer.resolvedId() : null)
                .chatType(peer != null ? peer.type() : null)
                .reason(reason)
                .error(FailureClassifier.describe(error))
                .account(sender.label())
                .build());
    }

    private boolean ensureConnected(DispatchContext ctx, ConnectedSender sender) {
        MessageTransport transport = sender.transport();
        try {
            if (transport.isConnected()) {
                return true;
            }
            log.warn("Campaign {}: sender {} lost its connection, reconnecting", ctx.campaignId(), sender.label());
            transport.connect();
            if (transport.isConnected()) {
                return true;
            }
            reportReconnectFailure(ctx, sender, "transport reports not connected after reconnect");
        } catch (RuntimeException e) {
            reportReconnectFailure(ctx, sender, FailureClassifier.describe(e));
        }
        return false;
    }

    private void reportReconnectFailure(DispatchContext ctx, ConnectedSender sender, String error) {
        log.error("Campaign {}: sender {} could not reconnect, abandoning its remaining targets: {}",
                ctx.campaignId(), sender.label(), error);
        eventSink.append(ctx.event(EventKind.CLIENT_CONNECT_FAIL)
                .reason(RECONNECT_FAILED)
                .error(error)
                .account(sender.label())
                .build());
    }

    private boolean isRunning(Long campaignId) {
        try {
            return campaignRepository.findStatusById(campaignId)
                    .map(status -> status == CampaignStatus.RUNNING)
                    .orElse(false);
        } catch (RuntimeException e) {
            log.error("Campaign {}: status check failed, treating as stopped", campaignId, e);
            return false;
        }
    }

    private void markCompleted(Long campaignId) {
        try {
            campaignRepository.markCompleted(campaignId, LocalDateTime.now());
        } catch (RuntimeException e) {
            log.error("Campaign {}: failed to mark completed", campaignId, e);
        }
    }
}
