package com.flagship.creator_ledger.content;

import com.flagship.creator_ledger.event.ContentPostedEvent;
import com.flagship.creator_ledger.event.LedgerEvent;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.ledger.ErrorCode;
import com.flagship.creator_ledger.ledger.LedgerException;
import com.flagship.creator_ledger.ledger.PlatformLedger;
import com.flagship.creator_ledger.outbox.OutboxEvent;
import com.flagship.creator_ledger.support.LedgerTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentServiceTest {

    private static final Address ALICE = Address.of("alice");
    private static final Address BOB = Address.of("bob");

    private LedgerTestFixture fixture;
    private PlatformLedger ledger;

    @BeforeEach
    void setUp() {
        fixture = LedgerTestFixture.create();
        ledger = fixture.getLedger();
        ledger.register(ALICE, "alice-profile");
        ledger.register(BOB, "bob-profile");
    }

    @Test
    @DisplayName("Posted content starts with zero counters and the call's timestamp")
    void testPost_InitialState() {
        fixture.getClock().advance(Duration.ofMinutes(5));

        Content content = ledger.postContent(ALICE, "hash1", true, false);

        assertEquals(ContentId.of(0), content.getId());
        assertEquals(ALICE, content.getCreator());
        assertEquals("hash1", content.getContentHash());
        assertEquals(LedgerTestFixture.START.plus(Duration.ofMinutes(5)), content.getTimestamp());
        assertTrue(content.isPremium());
        assertFalse(content.isTipEnabled());
        assertEquals(BigInteger.ZERO, content.getTotalTips());
        assertEquals(0L, content.getTotalEngagements());
    }

    @Test
    @DisplayName("Ids are dense across creators and total_content counts each creator's posts")
    void testPost_DenseIdsAcrossCreators() {
        assertEquals(0L, ledger.postContent(ALICE, "a0", false, true).getId().getValue());
        assertEquals(1L, ledger.postContent(BOB, "b0", false, true).getId().getValue());
        assertEquals(2L, ledger.postContent(ALICE, "a1", false, true).getId().getValue());

        assertEquals(3L, ledger.contentCount());
        assertEquals(2L, ledger.creatorStats(ALICE).getTotalContent());
        assertEquals(1L, ledger.creatorStats(BOB).getTotalContent());
    }

    @Test
    @DisplayName("Empty content hash is accepted")
    void testPost_EmptyHash() {
        Content content = ledger.postContent(ALICE, "", false, false);

        assertEquals("", ledger.content(content.getId()).getContentHash());
    }

    @Test
    @DisplayName("Only registered creators can post, and a rejected post does not consume an id")
    void testPost_NotACreator() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledger.postContent(Address.of("stranger"), "hash", false, false));

        assertEquals(ErrorCode.NOT_A_CREATOR, e.getErrorCode());
        assertEquals(0L, ledger.contentCount());
        assertEquals(0L, ledger.postContent(ALICE, "hash", false, false).getId().getValue());
    }

    @Test
    @DisplayName("Posting emits ContentPosted keyed by content id")
    void testPost_EmitsEvent() {
        ledger.postContent(ALICE, "hash1", true, true);

        List<OutboxEvent> events = fixture.getOutboxService()
            .getEventsForAggregate(LedgerEvent.CONTENT_AGGREGATE, "0");
        assertEquals(1, events.size());
        assertEquals(ContentPostedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertTrue(events.get(0).getPayload().contains("\"hash1\""));
    }

    @Test
    @DisplayName("Reading an unassigned id fails with NOT_FOUND")
    void testContent_NotFound() {
        LedgerException e = assertThrows(LedgerException.class, () -> ledger.content(ContentId.of(42)));

        assertEquals(ErrorCode.NOT_FOUND, e.getErrorCode());
    }
}
