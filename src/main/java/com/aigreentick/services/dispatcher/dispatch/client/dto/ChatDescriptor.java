package com.aigreentick.services.dispatcher.dispatch.client.dto;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;

public record ChatDescriptor(long id, ChatType type, String title) {
}
