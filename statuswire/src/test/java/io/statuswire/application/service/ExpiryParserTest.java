package io.statuswire.application.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExpiryParserTest {

    @Test
    void parsesSupportedUnits() {
        assertEquals(Optional.of(Duration.ofMinutes(30)), ExpiryParser.parse("30m"));
        assertEquals(Optional.of(Duration.ofHours(1)), ExpiryParser.parse("1h"));
        assertEquals(Optional.of(Duration.ofDays(2)), ExpiryParser.parse("2d"));
        assertEquals(Optional.of(Duration.ofDays(7)), ExpiryParser.parse("1w"));
    }

    @Test
    void rejectsEverythingElse() {
        assertTrue(ExpiryParser.parse(null).isEmpty());
        assertTrue(ExpiryParser.parse("").isEmpty());
        assertTrue(ExpiryParser.parse("m").isEmpty());
        assertTrue(ExpiryParser.parse("10s").isEmpty());
        assertTrue(ExpiryParser.parse("xh").isEmpty());
        assertTrue(ExpiryParser.parse("0h").isEmpty());
        assertTrue(ExpiryParser.parse("-1d").isEmpty());
    }

    @Test
    void hugeAmountsAreRejectedInsteadOfOverflowing() {
        assertTrue(ExpiryParser.parse("99999999999999w").isEmpty());
        assertTrue(ExpiryParser.parse(Long.MAX_VALUE + "d").isEmpty());
        assertTrue(ExpiryParser.parse("3651d").isEmpty());
        assertEquals(Optional.of(ExpiryParser.MAX_EXPIRY), ExpiryParser.parse("3650d"));
    }
}
