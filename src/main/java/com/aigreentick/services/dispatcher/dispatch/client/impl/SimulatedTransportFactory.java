package com.aigreentick.services.dispatcher.dispatch.client.impl;

import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dispatcher.account.model.SenderAccount;
import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.campaign.model.MessagePayload;
import com.aigreentick.services.dispatcher.dispatch.client.MessageTransport;
import com.aigreentick.services.dispatcher.dispatch.client.MessageTransportFactory;
import com.aigreentick.services.dispatcher.dispatch.client.dto.ChatDescriptor;
import com.aigreentick.services.dispatcher.dispatch.client.dto.DialogEntry;
import com.aigreentick.services.dispatcher.dispatch.client.exception.ThrottleException;
import com.aigreentick.services.dispatcher.dispatch.client.exception.TransportErrorKind;
import com.aigreentick.services.dispatcher.dispatch.client.exception.TransportException;

import lombok.extern.slf4j.Slf4j;

/**
 * Simulated provider for load and local testing.
 * No network calls are made: chats are synthesised from their id encoding and sends fail or
 * throttle at fixed rates. Active when profile is 'stress-test' or 'mock'.
 */
@Slf4j
@Component
@Profile("stress-test | mock")
public class SimulatedTransportFactory implements MessageTransportFactory {

    private static final long CHANNEL_OFFSET = 1_000_000_000_000L;

    private static final int MIN_DELAY_MS = 50;
    private static final int MAX_DELAY_MS = 200;
    private static final double FAILURE_RATE = 0.05;
    private static final double THROTTLE_RATE = 0.02;
    private static final int MAX_THROTTLE_SECONDS = 5;

    private static final TransportErrorKind[] FAILURE_KINDS = {
            TransportErrorKind.PEER_INITIATION_REQUIRED,
            TransportErrorKind.WRITE_FORBIDDEN,
            TransportErrorKind.BLOCKED,
            TransportErrorKind.NOT_MEMBER,
            TransportErrorKind.RESTRICTED,
            TransportErrorKind.SLOWMODE
    };

    private final int dialogCount;

    public SimulatedTransportFactory(@Value("${dispatch.mock.dialog-count:25}") int dialogCount) {
        this.dialogCount = dialogCount;
    }

    @Override
    public MessageTransport open(SenderAccount account) {
        log.debug("Opening simulated transport for {}", account.label());
        return new SimulatedTransport(account.label());
    }

    static ChatType typeOf(long chatId) {
        if (chatId <= -CHANNEL_OFFSET) {
            return Math.floorMod(chatId, 2) == 0 ? ChatType.CHANNEL : ChatType.SUPERGROUP;
        }
        return chatId < 0 ? ChatType.GROUP : ChatType.PRIVATE;
    }

    private class SimulatedTransport implements MessageTransport {

        private final String label;
        private volatile boolean connected;

        SimulatedTransport(String label) {
            this.label = label;
        }

        @Override
        public void connect() {
            connected = true;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public void disconnect() {
            connected = false;
        }

        @Override
        public ChatDescriptor describeChat(long chatId) {
            requireConnected();
            if (chatId == 0) {
                throw new TransportException(TransportErrorKind.PEER_INVALID, "Chat 0 does not exist");
            }
            return new ChatDescriptor(chatId, typeOf(chatId), "Chat " + chatId);
        }

        @Override
        public Stream<DialogEntry> enumerateChats() {
            requireConnected();
            return LongStream.rangeClosed(1, dialogCount)
                    .mapToObj(i -> switch ((int) (i % 3)) {
                        case 0 -> -CHANNEL_OFFSET - i;
                        case 1 -> i;
                        default -> -i;
                    })
                    .map(id -> new DialogEntry(id, typeOf(id)));
        }

        @Override
        public void send(MessagePayload payload, long chatId) {
            requireConnected();
            simulateNetworkDelay();

            ThreadLocalRandom random = ThreadLocalRandom.current();
            double roll = random.nextDouble();
            if (roll < THROTTLE_RATE) {
                throw new ThrottleException(1 + random.nextInt(MAX_THROTTLE_SECONDS));
            }
            if (roll < THROTTLE_RATE + FAILURE_RATE) {
                TransportErrorKind kind = FAILURE_KINDS[random.nextInt(FAILURE_KINDS.length)];
                throw new TransportException(kind, "Simulated " + kind + " for chat " + chatId);
            }
            log.trace("Simulated send by {} to {}", label, chatId);
        }

        private void requireConnected() {
            if (!connected) {
                throw new TransportException(TransportErrorKind.CONNECTION, label + " is not connected");
            }
        }

        private void simulateNetworkDelay() {
            int delay = MIN_DELAY_MS + ThreadLocalRandom.current().nextInt(MAX_DELAY_MS - MIN_DELAY_MS + 1);
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(TransportErrorKind.CONNECTION, "Send interrupted", e);
            }
        }
    }
}
