package com.aigreentick.services.dispatcher.dispatch.client;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.campaign.model.MessagePayload;
import com.aigreentick.services.dispatcher.dispatch.client.dto.ChatDescriptor;
import com.aigreentick.services.dispatcher.dispatch.client.dto.DialogEntry;
import com.aigreentick.services.dispatcher.dispatch.client.exception.TransportErrorKind;
import com.aigreentick.services.dispatcher.dispatch.client.exception.TransportException;

/**
 * Scriptable in-memory transport. Chats are looked up by exact id encoding; send failures are
 * queued per resolved id and consumed in order.
 */
public class FakeTransport implements MessageTransport {

    private final Map<Long, ChatDescriptor> chats = new HashMap<>();
    private final List<DialogEntry> dialogs = new ArrayList<>();
    private final Map<Long, Deque<RuntimeException>> sendFailures = new HashMap<>();
    private final Map<Long, RuntimeException> describeFailures = new HashMap<>();

    private final List<Long> sent = Collections.synchronizedList(new ArrayList<>());
    private final List<Long> describeCalls = Collections.synchronizedList(new ArrayList<>());

    private boolean connected;
    private int connectCalls;
    private int disconnectCalls;
    private int enumerateCalls;
    private int dropConnectionAfterSends = -1;
    private boolean failReconnect;
    private RuntimeException enumerateFailure;
    private Runnable onEnumerate;

    public FakeTransport chat(long encodedId, long resolvedId, ChatType type, String title) {
        chats.put(encodedId, new ChatDescriptor(resolvedId, type, title));
        return this;
    }

    public FakeTransport chat(long id, ChatType type) {
        return chat(id, id, type, "Chat " + id);
    }

    public FakeTransport dialog(long id, ChatType type) {
        dialogs.add(new DialogEntry(id, type));
        return this;
    }

    public FakeTransport failSend(long resolvedId, RuntimeException... errors) {
        Deque<RuntimeException> queue = sendFailures.computeIfAbsent(resolvedId, k -> new ArrayDeque<>());
        for (RuntimeException error : errors) {
            queue.add(error);
        }
        return this;
    }

    public FakeTransport failDescribe(long encodedId, RuntimeException error) {
        describeFailures.put(encodedId, error);
        return this;
    }

    public FakeTransport dropConnectionAfterSends(int sends, boolean failReconnect) {
        this.dropConnectionAfterSends = sends;
        this.failReconnect = failReconnect;
        return this;
    }

    public FakeTransport failEnumerate(RuntimeException error) {
        this.enumerateFailure = error;
        return this;
    }

    /**
     * Runs once per enumeration, before the dialogs are returned.
     */
    public FakeTransport onEnumerate(Runnable action) {
        this.onEnumerate = action;
        return this;
    }

    @Override
    public synchronized void connect() {
        connectCalls++;
        if (connectCalls > 1 && failReconnect) {
            throw new TransportException(TransportErrorKind.CONNECTION, "reconnect refused");
        }
        connected = true;
    }

    @Override
    public synchronized boolean isConnected() {
        return connected;
    }

    @Override
    public synchronized void disconnect() {
        disconnectCalls++;
        connected = false;
    }

    @Override
    public ChatDescriptor describeChat(long chatId) {
        describeCalls.add(chatId);
        RuntimeException failure = describeFailures.get(chatId);
        if (failure != null) {
            throw failure;
        }
        ChatDescriptor descriptor = chats.get(chatId);
        if (descriptor == null) {
            throw new TransportException(TransportErrorKind.PEER_INVALID, "unknown chat " + chatId);
        }
        return descriptor;
    }

    @Override
    public synchronized Stream<DialogEntry> enumerateChats() {
        enumerateCalls++;
        if (onEnumerate != null) {
            onEnumerate.run();
        }
        if (enumerateFailure != null) {
            throw enumerateFailure;
        }
        return new ArrayList<>(dialogs).stream();
    }

    @Override
    public synchronized void send(MessagePayload payload, long chatId) {
        Deque<RuntimeException> failures = sendFailures.get(chatId);
        RuntimeException failure = failures != null ? failures.poll() : null;
        if (failure != null) {
            throw failure;
        }
        sent.add(chatId);
        if (dropConnectionAfterSends >= 0 && sent.size() >= dropConnectionAfterSends) {
            connected = false;
        }
    }

    public List<Long> getSent() {
        return new ArrayList<>(sent);
    }

    public List<Long> getDescribeCalls() {
        return new ArrayList<>(describeCalls);
    }

    public synchronized int getEnumerateCalls() {
        return enumerateCalls;
    }

    public synchronized int getConnectCalls() {
        return connectCalls;
    }

    public synchronized int getDisconnectCalls() {
        return disconnectCalls;
    }
}
