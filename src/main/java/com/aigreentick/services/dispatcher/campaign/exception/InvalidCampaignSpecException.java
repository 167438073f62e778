package com.aigreentick.services.dispatcher.campaign.exception;

/**
 * Raised when a stored campaign cannot be turned into a usable spec.
 */
public class InvalidCampaignSpecException extends RuntimeException {

    public InvalidCampaignSpecException(String message) {
        super(message);
    }

    public InvalidCampaignSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
