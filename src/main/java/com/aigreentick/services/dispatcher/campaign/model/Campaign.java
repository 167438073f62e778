package com.aigreentick.services.dispatcher.campaign.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

import com.aigreentick.services.dispatcher.campaign.enums.CampaignStatus;
import com.aigreentick.services.dispatcher.campaign.enums.TargetMode;

/**
 * Persisted campaign document. Loosely typed columns (JSON text) are turned into a
 * {@link CampaignSpec} once, at read time, by the spec mapper.
 */
@Entity
@Table(
    name = "campaigns",
    indexes = {
        @Index(name = "idx_campaign_owner_status", columnList = "owner_id, status")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    // {"text": ..., "media": {"type": ..., "path": ...}, "buttons": [[{"text": ..., "url": ...}]]}
    @Lob
    @Column(name = "message")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_mode", length = 20)
    private TargetMode targetMode;

    // JSON array of destination ids
    @Lob
    @Column(name = "include_ids")
    private String includeIds;

    @Lob
    @Column(name = "exclude_ids")
    private String excludeIds;

    // JSON object of chat type toggles, e.g. {"private": true, "channel": false}
    @Lob
    @Column(name = "chat_types")
    private String chatTypes;

    @Column(name = "rate_per_min")
    private Integer ratePerMin;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CampaignStatus status = CampaignStatus.RUNNING;

    @Column(name = "repeat_enabled")
    private Boolean repeatEnabled;

    @Column(name = "repeat_rest_seconds")
    private Integer repeatRestSeconds;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "stopped_at")
    private LocalDateTime stoppedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
