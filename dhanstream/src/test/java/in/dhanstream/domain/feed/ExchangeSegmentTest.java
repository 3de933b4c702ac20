package in.dhanstream.domain.feed;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeSegmentTest {

    @Test
    void testWireCodes() {
        assertEquals(Optional.of(ExchangeSegment.IDX_I), ExchangeSegment.fromCode(0));
        assertEquals(Optional.of(ExchangeSegment.BSE_CURRENCY), ExchangeSegment.fromCode(7));
        assertEquals(Optional.of(ExchangeSegment.BSE_FNO), ExchangeSegment.fromCode(8));
        assertTrue(ExchangeSegment.fromCode(6).isEmpty(), "Code 6 is unassigned");
    }

    @Test
    void testLenientParse() {
        assertEquals(Optional.of(ExchangeSegment.NSE_FNO), ExchangeSegment.parse(" nse_fno "));
        assertEquals(Optional.of(ExchangeSegment.MCX_COMM), ExchangeSegment.parse("5"));
        assertTrue(ExchangeSegment.parse("NYSE").isEmpty());
        assertTrue(ExchangeSegment.parse(null).isEmpty());
    }

    @Test
    void testOrderAlertPairs() {
        assertEquals(ExchangeSegment.NSE_EQ, ExchangeSegment.fromExchangeAndSegment("NSE", "E"));
        assertEquals(ExchangeSegment.BSE_FNO, ExchangeSegment.fromExchangeAndSegment("bse", "d"));
        assertEquals(ExchangeSegment.MCX_COMM, ExchangeSegment.fromExchangeAndSegment("MCX", "M"));
        assertEquals(ExchangeSegment.NSE_EQ, ExchangeSegment.fromExchangeAndSegment(null, null), "Unknown falls back");
    }
}
