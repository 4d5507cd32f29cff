package com.questrail.dagcbor.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CanonicalKeyOrderTest
{
    @Test
    void shorterKeysSortFirst()
    {
        assertTrue(CanonicalKeyOrder.INSTANCE.compare("b", "aa") < 0);
        assertTrue(CanonicalKeyOrder.INSTANCE.compare("zz", "aaa") < 0);
    }

    @Test
    void equalLengthKeysSortByteWise()
    {
        assertTrue(CanonicalKeyOrder.INSTANCE.compare("aa", "ab") < 0);
        assertTrue(CanonicalKeyOrder.INSTANCE.compare("B", "a") < 0);
        assertEquals(0, CanonicalKeyOrder.INSTANCE.compare("key", "key"));
    }

    @Test
    void lengthIsMeasuredInUtf8Bytes()
    {
        // Both are two UTF-8 bytes; 0xC3 sorts after 'z'.
        assertTrue(CanonicalKeyOrder.INSTANCE.compare("zz", "é") < 0);
        // Three UTF-8 bytes against two.
        assertTrue(CanonicalKeyOrder.INSTANCE.compare("é", "€") < 0);
    }

    @Test
    void disagreesWithUtf16Order()
    {
        // U+FF61 (3 bytes, EF BD A1) vs U+1F600 (4 bytes): length wins.
        String halfwidth = "｡";
        String emoji = "😀";
        assertTrue(halfwidth.compareTo(emoji) > 0);
        assertTrue(CanonicalKeyOrder.INSTANCE.compare(halfwidth, emoji) < 0);
    }

    @Test
    void sortsMixedKeys()
    {
        List<String> keys = new ArrayList<>(List.of("bb", "a", "ccc", "b", "ab"));
        keys.sort(CanonicalKeyOrder.INSTANCE);
        assertEquals(List.of("a", "b", "ab", "bb", "ccc"), keys);
    }

    @Test
    void compareBytesIsUnsigned()
    {
        assertTrue(CanonicalKeyOrder.compareBytes(new byte[] { 0x7F }, new byte[] { (byte) 0x80 }) < 0);
        assertTrue(CanonicalKeyOrder.compareBytes(new byte[] { (byte) 0xFF }, new byte[] { 0, 0 }) < 0);
    }
}
