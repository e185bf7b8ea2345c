package com.marketbot.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TickerIdentityTest {

    @Test
    void parse_shouldSplitKoreanSuffix() {
        TickerIdentity id = TickerIdentity.parse("005930.ks");

        assertEquals("005930", id.code);
        assertEquals(".KS", id.suffix);
        assertTrue(id.hasKoreanCode());
        assertEquals("005930", id.providerCode());
    }

    @Test
    void parse_shouldKeepUsTickerAsIs() {
        TickerIdentity id = TickerIdentity.parse(" AAPL ");

        assertEquals("AAPL", id.raw);
        assertNull(id.code);
        assertFalse(id.isKorean(Market.US));
        assertEquals("AAPL", id.providerCode());
        assertEquals(List.of("AAPL"), id.exchangeCandidates(Market.US));
        assertEquals(List.of("AAPL"), id.storageCandidates(Market.US));
    }

    @Test
    void parse_shouldRejectBlank() {
        assertThrows(IllegalArgumentException.class, () -> TickerIdentity.parse("  "));
        assertThrows(IllegalArgumentException.class, () -> TickerIdentity.parse(null));
    }

    @Test
    void exchangeCandidates_shouldFollowMarketPriority() {
        TickerIdentity id = TickerIdentity.parse("000660");

        assertEquals(List.of("000660.KQ", "000660.KS"), id.exchangeCandidates(Market.KOSDAQ));
        assertEquals(List.of("000660.KS", "000660.KQ"), id.exchangeCandidates(Market.KOSPI));
    }

    @Test
    void storageCandidates_shouldListRawFirstWithoutDuplicates() {
        TickerIdentity suffixed = TickerIdentity.parse("005930.KS");
        assertEquals(List.of("005930.KS", "005930", "005930.KQ"), suffixed.storageCandidates(Market.KOSPI));

        TickerIdentity bare = TickerIdentity.parse("005930");
        assertEquals(List.of("005930", "005930.KS", "005930.KQ"), bare.storageCandidates(Market.KOSPI));
    }

    @Test
    void isKorean_shouldDetectNumericTickerOutsideKoreanMarket() {
        assertTrue(TickerIdentity.parse("035720").isKorean(Market.US));
        assertTrue(TickerIdentity.parse("AAPL").isKorean(Market.KOSPI));
    }

    @Test
    void marketFromText_shouldAcceptAliases() {
        assertEquals(Market.US, Market.fromText("usa"));
        assertEquals(Market.KOSDAQ, Market.fromText(" kosdaq "));
        assertThrows(IllegalArgumentException.class, () -> Market.fromText("NYSE"));
    }
}
