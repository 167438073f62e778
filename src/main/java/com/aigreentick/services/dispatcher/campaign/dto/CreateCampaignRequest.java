package com.aigreentick.services.dispatcher.campaign.dto;

import java.util.List;
import java.util.Map;

import com.aigreentick.services.dispatcher.campaign.model.LinkButton;
import com.aigreentick.services.dispatcher.campaign.model.MediaAttachment;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class CreateCampaignRequest {

    @NotNull(message = "ownerId is required")
    private Long ownerId;

    private String text;

    private MediaAttachment media;

    private List<List<LinkButton>> buttons;

    private String mode; // "include" (default) or "all"

    private List<Long> includeIds;

    private List<Long> excludeIds;

    private Map<String, Boolean> chatTypes; // Missing types stay enabled

    @Positive(message = "ratePerMin must be greater than 0")
    private Integer ratePerMin; // Falls back to dispatch.default-rate-per-min

    private Boolean repeatEnabled;

    @PositiveOrZero(message = "repeatRestSeconds cannot be negative")
    private Integer repeatRestSeconds;
}
