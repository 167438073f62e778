package com.aigreentick.services.dispatcher.account.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A linked, already-authenticated sender account. The session handle is opaque here;
 * decrypting it and building a transport from it is the transport factory's job.
 */
@Entity
@Table(
    name = "sender_accounts",
    indexes = {
        @Index(name = "idx_sender_owner", columnList = "owner_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SenderAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "phone", length = 32, unique = true)
    private String phone;

    @Lob
    @Column(name = "session_handle", nullable = false)
    private String sessionHandle;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean active = Boolean.TRUE;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * Label used in logs and connect events.
     */
    public String label() {
        return phone != null ? phone : "account-" + id;
    }
}
