package com.aigreentick.services.dispatcher.event.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.event.enums.EventKind;
import com.aigreentick.services.dispatcher.event.model.CampaignEvent;

/**
 * Read side of the event log. Writes only go through {@code save}.
 */
public interface CampaignEventRepository extends JpaRepository<CampaignEvent, Long> {

    @Query("""
                SELECT e.kind AS kind, COUNT(e) AS total
                FROM CampaignEvent e
                WHERE e.campaignId = :campaignId
                GROUP BY e.kind
            """)
    List<KindCount> countByKind(@Param("campaignId") Long campaignId);

    @Query("""
                SELECT COUNT(DISTINCT e.destinationId)
                FROM CampaignEvent e
                WHERE e.campaignId = :campaignId
                  AND e.kind IN :kinds
            """)
    long countDistinctDestinations(
            @Param("campaignId") Long campaignId,
            @Param("kinds") Collection<EventKind> kinds);

    @Query("""
                SELECT e.reason AS reason, COUNT(e) AS total
                FROM CampaignEvent e
                WHERE e.campaignId = :campaignId
                  AND e.kind = :kind
                GROUP BY e.reason
                ORDER BY COUNT(e) DESC
            """)
    List<ReasonCount> topReasons(
            @Param("campaignId") Long campaignId,
            @Param("kind") EventKind kind,
            Pageable pageable);

    @Query("""
                SELECT e.chatType AS chatType, COUNT(e) AS total
                FROM CampaignEvent e
                WHERE e.campaignId = :campaignId
                  AND e.kind IN :kinds
                GROUP BY e.chatType
                ORDER BY COUNT(e) DESC
            """)
    List<ChatTypeCount> countByChatType(
            @Param("campaignId") Long campaignId,
            @Param("kinds") Collection<EventKind> kinds);

    List<CampaignEvent> findByCampaignIdOrderByOccurredAtDescIdDesc(Long campaignId, Pageable pageable);

    interface KindCount {
        EventKind getKind();

        Long getTotal();
    }

    interface ReasonCount {
        String getReason();

        Long getTotal();
    }

    interface ChatTypeCount {
        ChatType getChatType();

        Long getTotal();
    }
}
