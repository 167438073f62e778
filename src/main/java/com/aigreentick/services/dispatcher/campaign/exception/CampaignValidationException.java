package com.aigreentick.services.dispatcher.campaign.exception;

import java.util.List;

/**
 * Pre-launch validation failure. Carries every problem found, not just the first.
 */
public class CampaignValidationException extends RuntimeException {

    private final List<String> errors;

    public CampaignValidationException(List<String> errors) {
        super("Cannot start campaign: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public CampaignValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
