package com.aigreentick.services.dispatcher.dispatch.service.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.aigreentick.services.dispatcher.campaign.enums.ChatType;
import com.aigreentick.services.dispatcher.dispatch.client.FakeTransport;
import com.aigreentick.services.dispatcher.dispatch.client.exception.TransportErrorKind;
import com.aigreentick.services.dispatcher.dispatch.client.exception.TransportException;
import com.aigreentick.services.dispatcher.dispatch.exception.SkipTargetException;
import com.aigreentick.services.dispatcher.dispatch.model.ResolvedPeer;

class PeerResolverTest {

    private static final Set<ChatType> ALL_TYPES = EnumSet.allOf(ChatType.class);

    private final PeerResolver resolver = new PeerResolver(1000);

    @Test
    void testCandidates_WhenChannelPrefixed_AddsSuffixBothSigns() {
        assertEquals(List.of(-1001234567890L, 1234567890L, -1234567890L),
                resolver.candidates(-1001234567890L));
    }

    @Test
    void testCandidates_WhenSmallPositive_AddsChannelNegativeAndPositiveForms() {
        assertEquals(List.of(12345L, -1000000012345L, -12345L),
                resolver.candidates(12345L));
    }

    @Test
    void testCandidates_WhenSmallNegative_AddsChannelAndPositiveForms() {
        assertEquals(List.of(-12345L, -1000000012345L, 12345L),
                resolver.candidates(-12345L));
    }

    @Test
    void testCandidates_WhenLargeUnprefixed_OnlyOriginal() {
        assertEquals(List.of(5_000_000_000_000L), resolver.candidates(5_000_000_000_000L));
        assertEquals(List.of(Long.MIN_VALUE), resolver.candidates(Long.MIN_VALUE));
    }

    @Test
    void testCandidates_WhenBarePrefix_OnlyOriginal() {
        assertEquals(List.of(-100L), resolver.candidates(-100L));
    }

    @Test
    void testCandidates_WhenZero_DropsDuplicates() {
        assertEquals(List.of(0L, -1_000_000_000_000L), resolver.candidates(0L));
    }

    @Test
    void testResolve_WhenOriginalEncodingKnown_ReturnsIt() {
        FakeTransport transport = new FakeTransport().chat(42L, ChatType.PRIVATE);

        ResolvedPeer peer = resolver.resolve(transport, 42L, ALL_TYPES);

        assertEquals(42L, peer.destinationId());
        assertEquals(42L, peer.resolvedId());
        assertEquals(ChatType.PRIVATE, peer.type());
        assertEquals(List.of(42L), transport.getDescribeCalls());
        assertEquals(0, transport.getEnumerateCalls());
    }

    @Test
    void testResolve_WhenOnlyChannelEncodingKnown_KeepsOriginalDestination() {
        FakeTransport transport = new FakeTransport()
                .chat(-1000000000777L, -1000000000777L, ChatType.CHANNEL, "News");

        ResolvedPeer peer = resolver.resolve(transport, 777L, ALL_TYPES);

        assertEquals(777L, peer.destinationId());
        assertEquals(-1000000000777L, peer.resolvedId());
        assertEquals("News", peer.title());
    }

    @Test
    void testResolve_WhenFirstPassMisses_WarmsUpOnceThenRetries() {
        FakeTransport transport = new FakeTransport();
        transport.onEnumerate(() -> transport.chat(-55L, ChatType.GROUP));

        ResolvedPeer peer = resolver.resolve(transport, 55L, ALL_TYPES);

        assertEquals(-55L, peer.resolvedId());
        assertEquals(1, transport.getEnumerateCalls());
        assertEquals(List.of(55L, -1000000000055L, -55L, 55L, -1000000000055L, -55L),
                transport.getDescribeCalls());
    }

    @Test
    void testResolve_WhenNothingResolves_SkipsAsUnresolved() {
        FakeTransport transport = new FakeTransport();

        SkipTargetException e = assertThrows(SkipTargetException.class,
                () -> resolver.resolve(transport, 99L, ALL_TYPES));

        assertEquals("unresolved_peer", e.getReason());
        assertEquals(1, transport.getEnumerateCalls());
    }

    @Test
    void testResolve_WhenWarmUpFails_StillSkipsAsUnresolved() {
        FakeTransport transport = new FakeTransport()
                .failEnumerate(new TransportException(TransportErrorKind.CONNECTION, "dialogs unavailable"));

        SkipTargetException e = assertThrows(SkipTargetException.class,
                () -> resolver.resolve(transport, 99L, ALL_TYPES));

        assertEquals(SkipTargetException.UNRESOLVED_PEER, e.getReason());
    }

    @Test
    void testResolve_WhenCandidateThrowsUnexpectedError_TriesNextCandidate() {
        FakeTransport transport = new FakeTransport()
                .failDescribe(5L, new IllegalStateException("flaky"))
                .chat(-1000000000005L, ChatType.CHANNEL);

        ResolvedPeer peer = resolver.resolve(transport, 5L, ALL_TYPES);

        assertEquals(-1000000000005L, peer.resolvedId());
        assertEquals(ChatType.CHANNEL, peer.type());
        assertEquals(List.of(5L, -1000000000005L), transport.getDescribeCalls());
        assertEquals(0, transport.getEnumerateCalls());
    }

    @Test
    void testResolve_WhenWarmUpThrowsUnexpectedError_RunsSecondPass() {
        FakeTransport transport = new FakeTransport()
                .failEnumerate(new IllegalStateException("dialog cursor closed"));

        SkipTargetException e = assertThrows(SkipTargetException.class,
                () -> resolver.resolve(transport, 8L, ALL_TYPES));

        assertEquals(SkipTargetException.UNRESOLVED_PEER, e.getReason());
        assertEquals(1, transport.getEnumerateCalls());
        assertEquals(6, transport.getDescribeCalls().size());
    }

    @Test
    void testResolve_WhenTypeNotAllowed_SkipsWithTypeReason() {
        FakeTransport transport = new FakeTransport().chat(-1000000000123L, ChatType.CHANNEL);

        SkipTargetException e = assertThrows(SkipTargetException.class,
                () -> resolver.resolve(transport, -1000000000123L, EnumSet.of(ChatType.PRIVATE, ChatType.GROUP)));

        assertEquals("type_disabled:channel", e.getReason());
    }
}
