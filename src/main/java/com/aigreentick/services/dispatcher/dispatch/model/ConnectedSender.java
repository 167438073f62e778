package com.aigreentick.services.dispatcher.dispatch.model;

import com.aigreentick.services.dispatcher.account.model.SenderAccount;
import com.aigreentick.services.dispatcher.dispatch.client.MessageTransport;

public record ConnectedSender(SenderAccount account, MessageTransport transport) {

    public String label() {
        return account.label();
    }
}
