package com.aigreentick.services.dispatcher.dispatch.service.impl;

import org.springframework.stereotype.Service;

import com.aigreentick.services.dispatcher.dispatch.client.exception.TransportException;
import com.aigreentick.services.dispatcher.dispatch.enums.FailureReason;

/**
 * Maps delivery failures to the analytics reason taxonomy.
 *
 * Classification is driven by the structured {@link TransportException#getKind()} reported
 * by the transport; anything that is not a transport error is UNKNOWN. The result is only
 * used to group failed events, a failure is terminal for its destination either way.
 */
@Service
public class FailureClassifier {

    public FailureReason classify(Throwable error) {
        if (!(error instanceof TransportException transportError)) {
            return FailureReason.UNKNOWN;
        }
        return switch (transportError.getKind()) {
            case RATE_LIMITED -> FailureReason.RATE_LIMITED;
            case PEER_INITIATION_REQUIRED -> FailureReason.REQUIRES_PEER_INITIATION;
            case WRITE_FORBIDDEN -> FailureReason.FORBIDDEN_NOT_ALLOWED;
            case BLOCKED -> FailureReason.FORBIDDEN_BLOCKED;
            case NOT_MEMBER -> FailureReason.FORBIDDEN_NOT_MEMBER;
            case RESTRICTED -> FailureReason.MUTED_RESTRICTED;
            case ACCOUNT_DEACTIVATED -> FailureReason.DEACTIVATED_ACCOUNT;
            case PEER_INVALID -> FailureReason.PEER_INVALID;
            case SLOWMODE -> FailureReason.RATE_SLOWMODE;
            case CONNECTION, UNKNOWN -> FailureReason.UNKNOWN;
        };
    }

    /**
     * Free-form error text stored next to the classified reason.
     */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank()
                ? error.getClass().getSimpleName()
                : error.getClass().getSimpleName() + ": " + message;
    }
}
