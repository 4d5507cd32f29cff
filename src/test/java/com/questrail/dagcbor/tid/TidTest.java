package com.questrail.dagcbor.tid;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TidTest
{
    @Test
    void createRendersThirteenSortedDigits()
    {
        assertEquals("222236tg2qm22", Tid.create(1234567890L, 0).toString());
        assertEquals("222236tg2qm2b", Tid.create(1234567890L, 7).toString());
        assertEquals("3ke6kg3wk222z", Tid.create(1_700_000_000_000_000L, 31).toString());
    }

    @Test
    void parseRecoversTimestampAndClockId() throws Exception
    {
        Tid tid = Tid.parse("222236tg2qm22");
        assertEquals(1234567890L, tid.timestamp());
        assertEquals(0, tid.clockId());

        Tid other = Tid.parse("3ke6kg3wk222z");
        assertEquals(1_700_000_000_000_000L, other.timestamp());
        assertEquals(31, other.clockId());
    }

    @Test
    void parseInvertsCreate() throws Exception
    {
        Tid tid = Tid.create(1_712_345_678_901_234L, 1023);
        assertEquals(tid, Tid.parse(tid.toString()));
    }

    @Test
    void outOfRangeBitsAreMasked()
    {
        assertEquals(Tid.create(5, 1), Tid.create(5, 1025));
        assertEquals(Tid.create(0, 0), Tid.create(1L << 53, 0));
    }

    @Test
    void textOrderFollowsTimestampOrder()
    {
        Tid earlier = Tid.create(1_000_000L, 5);
        Tid later = Tid.create(1_000_001L, 0);

        assertTrue(earlier.compareTo(later) < 0);
        assertTrue(earlier.toString().compareTo(later.toString()) < 0);
    }

    @Test
    void validateRejectsWrongLength()
    {
        TidFormatException e = assertThrows(TidFormatException.class, () -> Tid.validate("222236tg2qm2"));
        assertTrue(e.getMessage().contains("length"));
        assertFalse(Tid.isValid("222236tg2qm222"));
    }

    @Test
    void validateRejectsWrongAlphabet()
    {
        assertThrows(TidFormatException.class, () -> Tid.validate("222236TG2QM22"));
        assertThrows(TidFormatException.class, () -> Tid.validate("2222361g2qm22"));
        // Leading digit must be below 16 so the top bit stays clear.
        assertThrows(TidFormatException.class, () -> Tid.parse("k22236tg2qm22"));
        assertTrue(Tid.isValid("j22236tg2qm22"));
    }

    @Test
    void highestLeadingDigitStillRoundTrips() throws Exception
    {
        Tid tid = Tid.parse("jzzzzzzzzzzzz");
        assertEquals(1023, tid.clockId());
        assertEquals("jzzzzzzzzzzzz", tid.toString());
        assertTrue(Tid.create(0, 0).compareTo(tid) < 0);
    }
}
