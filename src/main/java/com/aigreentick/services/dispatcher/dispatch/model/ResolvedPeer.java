package com.aigreentick.services.dispatcher.dispatch.model;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;

/**
 * Outcome of peer resolution: the encoding that answered and what it describes.
 */
public record ResolvedPeer(long destinationId, long resolvedId, ChatType type, String title) {
}
