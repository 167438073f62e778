package com.aigreentick.services.dispatcher.campaign.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dispatcher.campaign.enums.CampaignStatus;
import com.aigreentick.services.dispatcher.campaign.model.Campaign;

public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    /**
     * Reads only the status column. Polled by every sender loop once per target.
     */
    @Query("SELECT c.status FROM Campaign c WHERE c.id = :id")
    Optional<CampaignStatus> findStatusById(@Param("id") Long id);

    boolean existsByOwnerIdAndStatusIn(Long ownerId, Collection<CampaignStatus> statuses);

    /**
     * Unconditional completion write, overwrites a concurrent STOPPED.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Campaign c
                SET c.status = com.aigreentick.services.dispatcher.campaign.enums.CampaignStatus.COMPLETED,
                    c.completedAt = :completedAt
                WHERE c.id = :id
            """)
    int markCompleted(@Param("id") Long id, @Param("completedAt") LocalDateTime completedAt);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
                UPDATE Campaign c
                SET c.status = com.aigreentick.services.dispatcher.campaign.enums.CampaignStatus.STOPPED,
                    c.stoppedAt = :stoppedAt
                WHERE c.id = :id
            """)
    int markStopped(@Param("id") Long id, @Param("stoppedAt") LocalDateTime stoppedAt);
}
