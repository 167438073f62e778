package com.aigreentick.services.dispatcher.event.model;

import java.time.LocalDateTime;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.event.enums.EventKind;

import lombok.Builder;

/**
 * One append-only telemetry record. Only owner, kind and timestamp are always present.
 */
@Builder
public record EventRecord(
        Long ownerId,
        Long campaignId,
        LocalDateTime occurredAt,
        EventKind kind,
        Long destinationId,
        Long resolvedId,
        ChatType chatType,
        String chatTitle,
        String reason,
        String error,
        Integer waitSeconds,
        String account) {
}
