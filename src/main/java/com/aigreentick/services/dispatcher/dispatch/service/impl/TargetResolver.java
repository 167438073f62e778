package com.aigreentick.services.dispatcher.dispatch.service.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dispatcher.campaign.enums.TargetMode;
import com.aigreentick.services.dispatcher.campaign.model.CampaignSpec;
import com.aigreentick.services.dispatcher.dispatch.client.dto.DialogEntry;
import com.aigreentick.services.dispatcher.dispatch.model.ConnectedSender;
import com.aigreentick.services.dispatcher.dispatch.model.DispatchContext;
import com.aigreentick.services.dispatcher.event.enums.EventKind;
import com.aigreentick.services.dispatcher.event.service.EventSink;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Produces the ordered destination list for a run. Never throws: discovery problems are
 * recorded as a discover_fail event and yield no targets.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TargetResolver {

    private final EventSink eventSink;

    public List<Long> resolve(DispatchContext ctx, ConnectedSender firstSender) {
        CampaignSpec spec = ctx.spec();
        if (spec.mode() == TargetMode.INCLUDE) {
            return spec.includeIds().stream()
                    .filter(id -> !spec.excludeIds().contains(id))
                    .collect(Collectors.toCollection(ArrayList::new));
        }
        return discover(ctx, firstSender);
    }

    private List<Long> discover(DispatchContext ctx, ConnectedSender sender) {
        CampaignSpec spec = ctx.spec();
        try (Stream<DialogEntry> dialogs = sender.transport().enumerateChats()) {
            List<Long> targets = dialogs
                    .filter(dialog -> !spec.excludeIds().contains(dialog.id()))
                    .filter(dialog -> spec.allows(dialog.type()))
                    .map(DialogEntry::id)
                    .collect(Collectors.toCollection(ArrayList::new));
            log.info("Campaign {} discovered {} targets via {}", ctx.campaignId(), targets.size(), sender.label());
            return targets;
        } catch (RuntimeException e) {
            log.error("Campaign {} target discovery failed via {}: {}",
                    ctx.campaignId(), sender.label(), e.getMessage(), e);
            eventSink.append(ctx.event(EventKind.DISCOVER_FAIL)
                    .account(sender.label())
                    .error(FailureClassifier.describe(e))
                    .build());
            return new ArrayList<>();
        }
    }
}
