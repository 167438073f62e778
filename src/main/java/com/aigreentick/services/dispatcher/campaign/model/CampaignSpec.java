package com.aigreentick.services.dispatcher.campaign.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import com.aigreentick.services.dispatcher.campaign.enums.CampaignStatus;
import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.campaign.enums.TargetMode;

import lombok.Builder;

/**
 * Fully typed, defaults-applied view of a campaign as consumed by the dispatcher.
 */
@Builder
public record CampaignSpec(
        Long id,
        Long ownerId,
        MessagePayload message,
        TargetMode mode,
        List<Long> includeIds,
        Set<Long> excludeIds,
        Set<ChatType> allowedTypes,
        int ratePerMin,
        CampaignStatus status,
        LocalDateTime createdAt,
        RepeatConfig repeat) {

    public CampaignSpec {
        includeIds = includeIds == null ? List.of() : List.copyOf(includeIds);
        excludeIds = excludeIds == null ? Set.of() : Set.copyOf(excludeIds);
        allowedTypes = allowedTypes == null ? Set.of() : Set.copyOf(allowedTypes);
        if (ratePerMin <= 0) {
            throw new IllegalArgumentException("ratePerMin must be > 0");
        }
        if (mode == null) {
            mode = TargetMode.INCLUDE;
        }
        if (repeat == null) {
            repeat = RepeatConfig.disabled();
        }
    }

    public boolean allows(ChatType type) {
        return type != null && allowedTypes.contains(type);
    }
}
