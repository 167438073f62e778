package com.aigreentick.services.dispatcher.dispatch.client.dto;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;

public record DialogEntry(long id, ChatType type) {
}
