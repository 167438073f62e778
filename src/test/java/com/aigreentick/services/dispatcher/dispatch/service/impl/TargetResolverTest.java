package com.aigreentick.services.dispatcher.dispatch.service.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.aigreentick.services.dispatcher.account.model.SenderAccount;
import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.campaign.enums.TargetMode;
import com.aigreentick.services.dispatcher.campaign.model.CampaignSpec;
import com.aigreentick.services.dispatcher.campaign.model.MessagePayload;
import com.aigreentick.services.dispatcher.dispatch.client.FakeTransport;
import com.aigreentick.services.dispatcher.dispatch.client.RecordingEventSink;
import com.aigreentick.services.dispatcher.dispatch.client.exception.TransportErrorKind;
import com.aigreentick.services.dispatcher.dispatch.client.exception.TransportException;
import com.aigreentick.services.dispatcher.dispatch.model.ConnectedSender;
import com.aigreentick.services.dispatcher.dispatch.model.DispatchContext;
import com.aigreentick.services.dispatcher.event.enums.EventKind;
import com.aigreentick.services.dispatcher.event.model.EventRecord;

class TargetResolverTest {

    private RecordingEventSink eventSink;
    private TargetResolver targetResolver;
    private SenderAccount account;

    @BeforeEach
    void setUp() {
        eventSink = new RecordingEventSink();
        targetResolver = new TargetResolver(eventSink);
        account = SenderAccount.builder().id(1L).ownerId(9L).phone("+100").sessionHandle("s").build();
    }

    @Test
    void testResolve_WhenIncludeMode_RemovesExcludedKeepingOrder() {
        DispatchContext ctx = context(TargetMode.INCLUDE, List.of(5L, 3L, 8L, 3L, 1L), Set.of(8L),
                EnumSet.allOf(ChatType.class));

        List<Long> targets = targetResolver.resolve(ctx, sender(new FakeTransport()));

        assertEquals(List.of(5L, 3L, 3L, 1L), targets);
    }

    @Test
    void testResolve_WhenIncludeMode_DoesNotEnumerate() {
        FakeTransport transport = new FakeTransport();
        DispatchContext ctx = context(TargetMode.INCLUDE, List.of(1L), Set.of(), EnumSet.allOf(ChatType.class));

        targetResolver.resolve(ctx, sender(transport));

        assertEquals(0, transport.getEnumerateCalls());
    }

    @Test
    void testResolve_WhenAllMode_FiltersExcludedAndDisabledTypes() {
        FakeTransport transport = new FakeTransport()
                .dialog(1L, ChatType.PRIVATE)
                .dialog(-2L, ChatType.GROUP)
                .dialog(-1000000000003L, ChatType.CHANNEL)
                .dialog(4L, ChatType.PRIVATE)
                .dialog(-1000000000005L, ChatType.SUPERGROUP);
        DispatchContext ctx = context(TargetMode.ALL, List.of(), Set.of(4L),
                EnumSet.of(ChatType.PRIVATE, ChatType.GROUP, ChatType.SUPERGROUP));

        List<Long> targets = targetResolver.resolve(ctx, sender(transport));

        assertEquals(List.of(1L, -2L, -1000000000005L), targets);
        assertEquals(1, transport.getEnumerateCalls());
        assertTrue(eventSink.all().isEmpty());
    }

    @Test
    void testResolve_WhenDiscoveryFails_RecordsEventAndReturnsEmpty() {
        FakeTransport transport = new FakeTransport()
                .failEnumerate(new TransportException(TransportErrorKind.CONNECTION, "dialogs unavailable"));
        DispatchContext ctx = context(TargetMode.ALL, List.of(), Set.of(), EnumSet.allOf(ChatType.class));

        List<Long> targets = targetResolver.resolve(ctx, sender(transport));

        assertTrue(targets.isEmpty());
        List<EventRecord> failures = eventSink.ofKind(EventKind.DISCOVER_FAIL);
        assertEquals(1, failures.size());
        assertEquals(77L, failures.get(0).campaignId());
        assertTrue(failures.get(0).error().contains("dialogs unavailable"));
    }

    private ConnectedSender sender(FakeTransport transport) {
        return new ConnectedSender(account, transport);
    }

    private DispatchContext context(TargetMode mode, List<Long> include, Set<Long> exclude, Set<ChatType> types) {
        CampaignSpec spec = CampaignSpec.builder()
                .id(77L)
                .ownerId(9L)
                .message(MessagePayload.text("hello"))
                .mode(mode)
                .includeIds(include)
                .excludeIds(exclude)
                .allowedTypes(types)
                .ratePerMin(5)
                .build();
        return new DispatchContext(spec, () -> true);
    }
}
