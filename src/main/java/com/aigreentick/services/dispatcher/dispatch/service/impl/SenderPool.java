package com.aigreentick.services.dispatcher.dispatch.service.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dispatcher.account.model.SenderAccount;
import com.aigreentick.services.dispatcher.account.repository.SenderAccountRepository;
import com.aigreentick.services.dispatcher.dispatch.client.MessageTransport;
import com.aigreentick.services.dispatcher.dispatch.client.MessageTransportFactory;
import com.aigreentick.services.dispatcher.dispatch.client.dto.DialogEntry;
import com.aigreentick.services.dispatcher.dispatch.model.ConnectedSender;
import com.aigreentick.services.dispatcher.dispatch.model.DispatchContext;
import com.aigreentick.services.dispatcher.event.enums.EventKind;
import com.aigreentick.services.dispatcher.event.service.EventSink;

import lombok.extern.slf4j.Slf4j;

/**
 * Opens and closes the transports of an owner's active sender accounts.
 */
@Slf4j
@Component
public class SenderPool {

    private final SenderAccountRepository accountRepository;
    private final MessageTransportFactory transportFactory;
    private final EventSink eventSink;
    private final boolean warmUpOnConnect;
    private final int warmUpLimit;

    public SenderPool(
            SenderAccountRepository accountRepository,
            MessageTransportFactory transportFactory,
            EventSink eventSink,
            @Value("${dispatch.sender.warm-up-on-connect:true}") boolean warmUpOnConnect,
            @Value("${dispatch.sender.warm-up-limit:1000}") int warmUpLimit) {
        this.accountRepository = accountRepository;
        this.transportFactory = transportFactory;
        this.eventSink = eventSink;
        this.warmUpOnConnect = warmUpOnConnect;
        this.warmUpLimit = warmUpLimit;
    }

    /**
     * Connects every active account of the campaign owner, in account id order. Accounts
     * that fail to connect are reported and left out.
     */
    public List<ConnectedSender> connectAll(DispatchContext ctx) {
        List<SenderAccount> accounts = accountRepository.findByOwnerIdAndActiveTrueOrderByIdAsc(ctx.ownerId());
        List<ConnectedSender> senders = new ArrayList<>(accounts.size());

        for (SenderAccount account : accounts) {
            MessageTransport transport = null;
            try {
                transport = transportFactory.open(account);
                transport.connect();
                if (!transport.isConnected()) {
                    throw new IllegalStateException("transport reports not connected after connect()");
                }
            } catch (RuntimeException e) {
                log.warn("Campaign {}: sender {} failed to connect: {}",
                        ctx.campaignId(), account.label(), e.getMessage());
                eventSink.append(ctx.event(EventKind.CLIENT_CONNECT_FAIL)
                        .account(account.label())
                        .error(FailureClassifier.describe(e))
                        .build());
                if (transport != null) {
                    disconnectQuietly(ctx.campaignId(), account.label(), transport);
                }
                continue;
            }

            eventSink.append(ctx.event(EventKind.CLIENT_CONNECT)
                    .account(account.label())
                    .build());
            if (warmUpOnConnect) {
                warmUp(ctx.campaignId(), account.label(), transport);
            }
            senders.add(new ConnectedSender(account, transport));
        }

        log.info("Campaign {}: {}/{} senders connected", ctx.campaignId(), senders.size(), accounts.size());
        return senders;
    }

    public void releaseAll(Long campaignId, List<ConnectedSender> senders) {
        for (ConnectedSender sender : senders) {
            disconnectQuietly(campaignId, sender.label(), sender.transport());
        }
    }

    private void warmUp(Long campaignId, String label, MessageTransport transport) {
        try (Stream<DialogEntry> dialogs = transport.enumerateChats()) {
            long seen = dialogs.limit(warmUpLimit).count();
            log.debug("Campaign {}: sender {} warmed {} dialogs", campaignId, label, seen);
        } catch (RuntimeException e) {
            log.warn("Campaign {}: dialog warm-up failed for {}: {}", campaignId, label, e.getMessage());
        }
    }

    private void disconnectQuietly(Long campaignId, String label, MessageTransport transport) {
        try {
            transport.disconnect();
        } catch (RuntimeException e) {
            log.warn("Campaign {}: disconnect failed for {}: {}", campaignId, label, e.getMessage());
        }
    }
}
