package com.aigreentick.services.dispatcher.campaign.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LinkButton(String text, String url) {

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
