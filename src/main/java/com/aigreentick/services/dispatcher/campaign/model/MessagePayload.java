package com.aigreentick.services.dispatcher.campaign.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Message content delivered to every destination of a campaign.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessagePayload(
        String text,
        MediaAttachment media,
        List<List<LinkButton>> buttons) {

    public MessagePayload {
        buttons = buttons == null ? List.of() : buttons.stream()
                .map(row -> row == null ? List.<LinkButton>of() : List.copyOf(row))
                .toList();
    }

    public static MessagePayload text(String text) {
        return new MessagePayload(text, null, List.of());
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasMedia() {
        return media != null && media.type() != null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return !hasText() && !hasMedia();
    }

    /**
     * Button rows keeping only buttons that carry a URL; rows left empty are dropped.
     */
    public List<List<LinkButton>> linkRows() {
        return buttons.stream()
                .map(row -> row.stream().filter(LinkButton::hasUrl).toList())
                .filter(row -> !row.isEmpty())
                .toList();
    }
}
