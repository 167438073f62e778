package com.aigreentick.services.dispatcher.campaign.model;

import com.aigreentick.services.dispatcher.campaign.enums.MediaType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaAttachment(MediaType type, String path) {
}
