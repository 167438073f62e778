package com.aigreentick.services.dispatcher.dispatch.client;

import com.aigreentick.services.dispatcher.account.model.SenderAccount;

/**
 * Builds a not-yet-connected transport from a sender account's session handle.
 */
public interface MessageTransportFactory {

    MessageTransport open(SenderAccount account);
}
