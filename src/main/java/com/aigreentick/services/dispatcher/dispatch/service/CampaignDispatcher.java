package com.aigreentick.services.dispatcher.dispatch.service;

import com.aigreentick.services.dispatcher.dispatch.model.DispatchRunResult;

/**
 * Runs one campaign to completion across all of its owner's sender accounts.
 */
public interface CampaignDispatcher {

    /**
     * Blocks until every sender loop has finished. Never throws; run-fatal conditions,
     * including a failed campaign or account lookup, are reported through
     * {@link DispatchRunResult#error()}.
     */
    DispatchRunResult dispatch(Long campaignId);
}
