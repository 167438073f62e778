package com.aigreentick.services.dispatcher.dispatch.client.exception;

import java.util.Objects;

public class TransportException extends RuntimeException {

    private final TransportErrorKind kind;

    public TransportException(TransportErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TransportException(TransportErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TransportErrorKind getKind() {
        return kind;
    }
}
