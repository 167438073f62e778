package com.aigreentick.services.dispatcher.dispatch.model;

/**
 * Summary of one dispatcher run. {@code ok=false} only for run-fatal conditions.
 */
public record DispatchRunResult(
        Long campaignId,
        boolean ok,
        String error,
        int targets,
        int senders) {

    public static final String NOT_FOUND = "not_found";
    public static final String INVALID_SPEC = "invalid_spec";
    public static final String NO_ACCOUNTS = "no_accounts";
    public static final String LOAD_FAILED = "load_failed";

    public static DispatchRunResult completed(Long campaignId, int targets, int senders) {
        return new DispatchRunResult(campaignId, true, null, targets, senders);
    }

    public static DispatchRunResult failed(Long campaignId, String error) {
        return new DispatchRunResult(campaignId, false, error, 0, 0);
    }
}
