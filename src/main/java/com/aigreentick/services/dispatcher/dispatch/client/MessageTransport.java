package com.aigreentick.services.dispatcher.dispatch.client;

import java.util.stream.Stream;

import com.aigreentick.services.dispatcher.campaign.model.MessagePayload;
import com.aigreentick.services.dispatcher.dispatch.client.dto.ChatDescriptor;
import com.aigreentick.services.dispatcher.dispatch.client.dto.DialogEntry;
import com.aigreentick.services.dispatcher.dispatch.client.exception.ThrottleException;
import com.aigreentick.services.dispatcher.dispatch.client.exception.TransportException;

/**
 * Connection to the messaging provider on behalf of one sender account.
 *
 * <p>Every call is a provider round-trip. Provider-side failures surface as
 * {@link TransportException}; provider rate limiting on {@link #send} surfaces as
 * {@link ThrottleException}. Instances are used by a single sender loop at a time.
 */
public interface MessageTransport {

    void connect();

    boolean isConnected();

    void disconnect();

    /**
     * Looks up a chat by one of its id encodings.
     *
     * @throws TransportException if the id is unknown or unreachable for this account
     */
    ChatDescriptor describeChat(long chatId);

    /**
     * Lists the chats visible to this account. The stream is lazy; callers bound it with
     * {@code limit} and must close it.
     */
    Stream<DialogEntry> enumerateChats();

    /**
     * @throws ThrottleException when the provider asks to wait before sending again
     * @throws TransportException on any other provider error
     */
    void send(MessagePayload payload, long chatId);
}
