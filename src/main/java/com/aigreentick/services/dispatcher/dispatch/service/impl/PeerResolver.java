package com.aigreentick.services.dispatcher.dispatch.service.impl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.dispatch.client.MessageTransport;
import com.aigreentick.services.dispatcher.dispatch.client.dto.ChatDescriptor;
import com.aigreentick.services.dispatcher.dispatch.client.dto.DialogEntry;
import com.aigreentick.services.dispatcher.dispatch.exception.SkipTargetException;
import com.aigreentick.services.dispatcher.dispatch.model.ResolvedPeer;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a user-supplied chat id into a peer the current sender can address.
 *
 * The same chat can be written in several id encodings (bare, negative, channel-prefixed).
 * Each encoding is probed in a fixed order; when nothing answers, the sender's dialog list is
 * walked once to warm the provider-side cache and the probes are repeated.
 */
@Slf4j
@Component
public class PeerResolver {

    static final long CHANNEL_OFFSET = 1_000_000_000_000L;
    private static final String CHANNEL_PREFIX = "-100";

    private final int warmUpLimit;

    public PeerResolver(@Value("${dispatch.peer.warm-up-limit:1000}") int warmUpLimit) {
        this.warmUpLimit = warmUpLimit;
    }

    /**
     * Candidate encodings for {@code destinationId}, most likely first, without duplicates.
     */
    public List<Long> candidates(long destinationId) {
        Set<Long> ordered = new LinkedHashSet<>();
        ordered.add(destinationId);

        String decimal = Long.toString(destinationId);
        if (decimal.startsWith(CHANNEL_PREFIX)) {
            // a bare prefix has no suffix to decode, so only the id itself is probed
            if (decimal.length() > CHANNEL_PREFIX.length()) {
                long suffix = Long.parseLong(decimal.substring(CHANNEL_PREFIX.length()));
                ordered.add(suffix);
                ordered.add(-suffix);
            }
        } else if (destinationId != Long.MIN_VALUE && Math.abs(destinationId) < CHANNEL_OFFSET) {
            long magnitude = Math.abs(destinationId);
            ordered.add(-CHANNEL_OFFSET - magnitude);
            ordered.add(-magnitude);
            ordered.add(magnitude);
        }
        return new ArrayList<>(ordered);
    }

    /**
     * @throws SkipTargetException when no encoding resolves or the chat type is not allowed
     */
    public ResolvedPeer resolve(MessageTransport transport, long destinationId, Set<ChatType> allowedTypes) {
        List<Long> candidates = candidates(destinationId);

        ChatDescriptor descriptor = probe(transport, candidates);
        if (descriptor == null) {
            log.debug("No candidate resolved for {}, warming dialog cache", destinationId);
            warmUp(transport);
            descriptor = probe(transport, candidates);
        }
        if (descriptor == null) {
            throw SkipTargetException.unresolved(destinationId);
        }
        if (!allowedTypes.contains(descriptor.type())) {
            throw SkipTargetException.typeDisabled(destinationId, descriptor.type());
        }
        return new ResolvedPeer(destinationId, descriptor.id(), descriptor.type(), descriptor.title());
    }

    private ChatDescriptor probe(MessageTransport transport, List<Long> candidates) {
        for (Long candidate : candidates) {
            try {
                ChatDescriptor descriptor = transport.describeChat(candidate);
                // untyped descriptors cannot be filtered, treat them as a miss
                if (descriptor != null && descriptor.type() != null) {
                    return descriptor;
                }
            } catch (RuntimeException e) {
                log.debug("Candidate {} did not resolve: {}", candidate, e.getMessage());
            }
        }
        return null;
    }

    private void warmUp(MessageTransport transport) {
        try (Stream<DialogEntry> dialogs = transport.enumerateChats()) {
            long seen = dialogs.limit(warmUpLimit).count();
            log.debug("Dialog warm-up touched {} chats", seen);
        } catch (RuntimeException e) {
            log.warn("Dialog warm-up failed: {}", e.getMessage());
        }
    }
}
