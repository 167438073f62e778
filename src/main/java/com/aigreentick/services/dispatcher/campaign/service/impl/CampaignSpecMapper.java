package com.aigreentick.services.dispatcher.campaign.service.impl;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.campaign.enums.TargetMode;
import com.aigreentick.services.dispatcher.campaign.exception.InvalidCampaignSpecException;
import com.aigreentick.services.dispatcher.campaign.model.Campaign;
import com.aigreentick.services.dispatcher.campaign.model.CampaignSpec;
import com.aigreentick.services.dispatcher.campaign.model.MessagePayload;
import com.aigreentick.services.dispatcher.campaign.model.RepeatConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Converts between the stored {@link Campaign} row and the typed {@link CampaignSpec}.
 *
 * Default-merge rule, applied once here:
 * - mode: INCLUDE when missing
 * - chat types: every type enabled unless a stored toggle says otherwise
 * - rate: dispatch.default-rate-per-min when missing or not positive
 * - id lists: empty when missing
 * - repeat: disabled, 60s rest
 */
@Slf4j
@Component
public class CampaignSpecMapper {

    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> TOGGLES = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final int defaultRatePerMin;

    public CampaignSpecMapper(
            ObjectMapper objectMapper,
            @Value("${dispatch.default-rate-per-min:5}") int defaultRatePerMin) {
        this.objectMapper = objectMapper;
        this.defaultRatePerMin = defaultRatePerMin;
    }

    public CampaignSpec toSpec(Campaign campaign) {
        if (campaign.getOwnerId() == null) {
            throw new InvalidCampaignSpecException("Campaign " + campaign.getId() + " has no owner");
        }

        int rate = campaign.getRatePerMin() != null && campaign.getRatePerMin() > 0
                ? campaign.getRatePerMin()
                : defaultRatePerMin;

        RepeatConfig repeat = new RepeatConfig(
                Boolean.TRUE.equals(campaign.getRepeatEnabled()),
                campaign.getRepeatRestSeconds() != null
                        ? campaign.getRepeatRestSeconds()
                        : RepeatConfig.DEFAULT_REST_SECONDS);

        return CampaignSpec.builder()
                .id(campaign.getId())
                .ownerId(campaign.getOwnerId())
                .message(readMessage(campaign))
                .mode(campaign.getTargetMode() != null ? campaign.getTargetMode() : TargetMode.INCLUDE)
                .includeIds(readIds(campaign.getId(), "include_ids", campaign.getIncludeIds()))
                .excludeIds(new LinkedHashSet<>(readIds(campaign.getId(), "exclude_ids", campaign.getExcludeIds())))
                .allowedTypes(readAllowedTypes(campaign.getId(), campaign.getChatTypes()))
                .ratePerMin(rate)
                .status(campaign.getStatus())
                .createdAt(campaign.getCreatedAt())
                .repeat(repeat)
                .build();
    }

    /**
     * Merges stored toggles over the all-enabled defaults.
     */
    public Set<ChatType> mergeChatTypes(Map<String, ?> toggles) {
        Set<ChatType> allowed = EnumSet.allOf(ChatType.class);
        if (toggles == null) {
            return allowed;
        }
        for (Map.Entry<String, ?> entry : toggles.entrySet()) {
            ChatType.fromValue(entry.getKey()).ifPresentOrElse(
                    type -> {
                        if (toBoolean(entry.getValue())) {
                            allowed.add(type);
                        } else {
                            allowed.remove(type);
                        }
                    },
                    () -> log.debug("Ignoring unknown chat type toggle: {}", entry.getKey()));
        }
        return allowed;
    }

    public String writeMessage(MessagePayload message) {
        return write(message);
    }

    public String writeIds(List<Long> ids) {
        return write(ids == null ? List.of() : ids);
    }

    public String writeChatTypes(Map<String, Boolean> toggles) {
        return write(toggles == null ? Map.of() : toggles);
    }

    private MessagePayload readMessage(Campaign campaign) {
        String json = campaign.getMessage();
        if (json == null || json.isBlank()) {
            return MessagePayload.text(null);
        }
        try {
            return objectMapper.readValue(json, MessagePayload.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidCampaignSpecException(
                    "Campaign " + campaign.getId() + " has an unreadable message payload", e);
        }
    }

    private List<Long> readIds(Long campaignId, String column, String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<Long> ids = objectMapper.readValue(json, ID_LIST);
            if (ids == null) {
                return List.of();
            }
            List<Long> cleaned = new ArrayList<>(ids.size());
            for (Long id : ids) {
                if (id != null) {
                    cleaned.add(id);
                }
            }
            return cleaned;
        } catch (JsonProcessingException e) {
            throw new InvalidCampaignSpecException(
                    "Campaign " + campaignId + " has unreadable " + column, e);
        }
    }

    private Set<ChatType> readAllowedTypes(Long campaignId, String json) {
        if (json == null || json.isBlank()) {
            return mergeChatTypes(null);
        }
        try {
            return mergeChatTypes(objectMapper.readValue(json, TOGGLES));
        } catch (JsonProcessingException e) {
            throw new InvalidCampaignSpecException(
                    "Campaign " + campaignId + " has unreadable chat_types", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidCampaignSpecException("Failed to serialise campaign field", e);
        }
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        if (value instanceof String s) {
            String lower = s.trim().toLowerCase();
            return lower.equals("true") || lower.equals("1") || lower.equals("yes") || lower.equals("on");
        }
        return false;
    }
}
