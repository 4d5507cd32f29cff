package com.questrail.dagcbor.codec.impl;

import com.questrail.dagcbor.codec.DagCborDecodeException;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CborReaderTest
 * -----------------------------------------------------------------------------
 * Argument-width minimality and bounds checks, independent of the decoder.
 */
final class CborReaderTest
{
    @Test
    void readsMinimalArguments() throws Exception
    {
        assertEquals(23, reader("").readArgument(23));
        assertEquals(24, reader("18").readArgument(24));
        assertEquals(0x100, reader("0100").readArgument(25));
        assertEquals(0x10000, reader("00010000").readArgument(26));
        assertEquals(0x1_0000_0000L, reader("0000000100000000").readArgument(27));
        assertEquals(-1L, reader("ffffffffffffffff").readArgument(27));
    }

    @Test
    void rejectsEveryNonMinimalWidth()
    {
        assertKind(DagCborDecodeException.Kind.MALFORMED, "17", 24);
        assertKind(DagCborDecodeException.Kind.MALFORMED, "00ff", 25);
        assertKind(DagCborDecodeException.Kind.MALFORMED, "0000ffff", 26);
        assertKind(DagCborDecodeException.Kind.MALFORMED, "00000000ffffffff", 27);
    }

    @Test
    void rejectsReservedAndIndefinite()
    {
        for (int info = 28; info <= 31; info++) {
            assertKind(DagCborDecodeException.Kind.MALFORMED, "00", info);
        }
    }

    @Test
    void shortArgumentIsTruncated()
    {
        assertKind(DagCborDecodeException.Kind.TRUNCATED, "01", 25);
        assertKind(DagCborDecodeException.Kind.TRUNCATED, "", 24);
    }

    @Test
    void readBytesChecksRemainingLength() throws Exception
    {
        CborReader r = reader("010203");
        assertArrayEquals(new byte[] { 1, 2 }, r.readBytes(2));
        assertEquals(1, r.remaining());

        CborWireException e = assertThrows(CborWireException.class, () -> r.readBytes(2));
        assertEquals(DagCborDecodeException.Kind.TRUNCATED, e.kind());

        // Lengths above Long.MAX_VALUE are unsigned, not negative.
        assertThrows(CborWireException.class, () -> r.readBytes(-1L));
    }

    @Test
    void utf8IsStrict() throws Exception
    {
        CborReader r = reader("");
        assertEquals("é", r.utf8(HexFormat.of().parseHex("c3a9")));

        // Overlong '/', an encoded surrogate, and a lone continuation byte.
        for (String bad : new String[] { "c0af", "eda080", "80" }) {
            CborWireException e = assertThrows(CborWireException.class,
                    () -> r.utf8(HexFormat.of().parseHex(bad)));
            assertEquals(DagCborDecodeException.Kind.MALFORMED, e.kind());
        }
    }

    @Test
    void remainderIsACopyOfUnreadInput() throws Exception
    {
        CborReader r = reader("0a0b0c");
        r.readUint8();
        assertArrayEquals(new byte[] { 0x0b, 0x0c }, r.remainder());
        assertEquals(1, r.position());
    }

    private static CborReader reader(String hex)
    {
        return new CborReader(HexFormat.of().parseHex(hex));
    }

    private static void assertKind(DagCborDecodeException.Kind expected, String hex, int info)
    {
        CborWireException e = assertThrows(CborWireException.class, () -> reader(hex).readArgument(info));
        assertEquals(expected, e.kind(), e.getMessage());
    }
}
