package com.flagship.creator_ledger.engagement;

import com.flagship.creator_ledger.content.Content;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.ledger.ErrorCode;
import com.flagship.creator_ledger.ledger.LedgerException;
import com.flagship.creator_ledger.ledger.PlatformLedger;
import com.flagship.creator_ledger.support.LedgerTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngagementServiceTest {

    private static final Address CREATOR = Address.of("creator");
    private static final Address FAN = Address.of("fan");

    private LedgerTestFixture fixture;
    private PlatformLedger ledger;
    private ContentId free;
    private ContentId premium;

    @BeforeEach
    void setUp() {
        fixture = LedgerTestFixture.create();
        ledger = fixture.getLedger();
        ledger.register(CREATOR, "creator-profile");
        ledger.setSubscriptionFee(CREATOR, BigInteger.valueOf(100));
        free = ledger.postContent(CREATOR, "free", false, false).getId();
        premium = ledger.postContent(CREATOR, "premium", true, false).getId();
    }

    @Test
    @DisplayName("Engaging with free content counts once per user")
    void testEngage_FreeContent() {
        Content engaged = ledger.engage(FAN, free, "LIKE");

        assertEquals(1L, engaged.getTotalEngagements());
        assertEquals(1L, ledger.userEngagementScore(FAN));
    }

    @Test
    @DisplayName("Second engagement fails and counters stay put")
    void testEngage_Twice() {
        ledger.engage(FAN, free, "LIKE");

        LedgerException e = assertThrows(LedgerException.class, () -> ledger.engage(FAN, free, "SHARE"));

        assertEquals(ErrorCode.ALREADY_ENGAGED, e.getErrorCode());
        assertEquals(1L, ledger.content(free).getTotalEngagements());
        assertEquals(1L, ledger.userEngagementScore(FAN));
    }

    @Test
    @DisplayName("Score counts distinct engagements across content")
    void testEngage_ScoreAcrossContent() {
        ledger.subscribe(FAN, CREATOR);
        ledger.engage(FAN, free, "LIKE");
        ledger.engage(FAN, premium, "LIKE");
        ledger.engage(Address.of("other"), free, "LIKE");

        assertEquals(2L, ledger.userEngagementScore(FAN));
        assertEquals(2L, ledger.content(free).getTotalEngagements());
        assertEquals(0L, ledger.creatorStats(CREATOR).getEngagementScore());
    }

    @Test
    @DisplayName("Premium content needs an active subscription")
    void testEngage_PremiumWithoutSubscription() {
        LedgerException e = assertThrows(LedgerException.class, () -> ledger.engage(FAN, premium, "LIKE"));

        assertEquals(ErrorCode.NOT_SUBSCRIBED, e.getErrorCode());
        assertEquals(0L, ledger.content(premium).getTotalEngagements());
        assertEquals(0L, ledger.userEngagementScore(FAN));
    }

    @Test
    @DisplayName("Premium engagement fails at exactly the expiry instant")
    void testEngage_PremiumAtExpiry() {
        ledger.subscribe(FAN, CREATOR);
        fixture.getClock().advance(Duration.ofDays(30));

        LedgerException e = assertThrows(LedgerException.class, () -> ledger.engage(FAN, premium, "LIKE"));

        assertEquals(ErrorCode.NOT_SUBSCRIBED, e.getErrorCode());
    }

    @Test
    @DisplayName("A creator engaging with their own premium content also needs a subscription")
    void testEngage_OwnPremiumContent() {
        assertThrows(LedgerException.class, () -> ledger.engage(CREATOR, premium, "LIKE"));

        ledger.subscribe(CREATOR, CREATOR);
        assertEquals(1L, ledger.engage(CREATOR, premium, "LIKE").getTotalEngagements());
    }

    @Test
    @DisplayName("Missing content fails with NOT_FOUND")
    void testEngage_NotFound() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledger.engage(FAN, ContentId.of(7), "LIKE"));

        assertEquals(ErrorCode.NOT_FOUND, e.getErrorCode());
    }

    @Test
    @DisplayName("Blank engagement type is recorded as given")
    void testEngage_BlankType() {
        Content engaged = ledger.engage(FAN, free, " ");

        assertEquals(1L, engaged.getTotalEngagements());
        assertEquals(1L, ledger.userEngagementScore(FAN));
        assertEquals(2L, ledger.engage(Address.of("other-fan"), free, "").getTotalEngagements());
    }

    @Test
    @DisplayName("Missing engagement type is rejected")
    void testEngage_NullType() {
        assertThrows(IllegalArgumentException.class, () -> ledger.engage(FAN, free, null));
        assertEquals(0L, ledger.userEngagementScore(FAN));
    }

    @Test
    @DisplayName("Users that never engaged score zero")
    void testUserEngagementScore_Default() {
        assertEquals(0L, ledger.userEngagementScore(Address.of("nobody")));
    }
}
