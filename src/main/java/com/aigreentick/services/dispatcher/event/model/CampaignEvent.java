package com.aigreentick.services.dispatcher.event.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.event.enums.EventKind;

@Entity
@Table(
    name = "campaign_events",
    indexes = {
        @Index(name = "idx_event_campaign_kind", columnList = "campaign_id, kind"),
        @Index(name = "idx_event_owner_time", columnList = "owner_id, occurred_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CampaignEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "campaign_id")
    private Long campaignId;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32)
    private EventKind kind;

    @Column(name = "destination_id")
    private Long destinationId;

    @Column(name = "resolved_id")
    private Long resolvedId;

    @Enumerated(EnumType.STRING)
    @Column(name = "chat_type", length = 20)
    private ChatType chatType;

    @Column(name = "chat_title", length = 255)
    private String chatTitle;

    @Column(name = "reason", length = 100)
    private String reason;

    @Column(name = "error", length = 1000)
    private String error;

    @Column(name = "wait_seconds")
    private Integer waitSeconds;

    @Column(name = "account", length = 64)
    private String account;

    public static CampaignEvent from(EventRecord record) {
        return CampaignEvent.builder()
                .ownerId(record.ownerId())
                .campaignId(record.campaignId())
                .occurredAt(record.occurredAt() != null ? record.occurredAt() : LocalDateTime.now())
                .kind(record.kind())
                .destinationId(record.destinationId())
                .resolvedId(record.resolvedId())
                .chatType(record.chatType())
                .chatTitle(truncate(record.chatTitle(), 255))
                .reason(truncate(record.reason(), 100))
                .error(truncate(record.error(), 1000))
                .waitSeconds(record.waitSeconds())
                .account(truncate(record.account(), 64))
                .build();
    }

    public EventRecord toRecord() {
        return new EventRecord(ownerId, campaignId, occurredAt, kind, destinationId, resolvedId,
                chatType, chatTitle, reason, error, waitSeconds, account);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
