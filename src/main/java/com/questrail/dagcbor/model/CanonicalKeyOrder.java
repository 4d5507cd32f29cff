package com.questrail.dagcbor.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Canonical DAG-CBOR map key ordering.
 *
 * <p>Keys are compared on their UTF-8 bytes:</p>
 * <ol>
 *   <li>shorter byte length first</li>
 *   <li>for equal length, unsigned byte-wise lexicographic order</li>
 * </ol>
 *
 * <p>Note that this is not {@link String#compareTo(String)}: UTF-16 code unit
 * order and UTF-8 byte order disagree for supplementary characters, and the
 * length rule comes first.</p>
 */
public enum CanonicalKeyOrder implements Comparator<String>
{
    INSTANCE;

    @Override
    public int compare(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        int c = compareBytes(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
        // Unpaired surrogates all encode to '?'; keep such keys distinct.
        return c != 0 ? c : a.compareTo(b);
    }

    /**
     * Compares two encoded keys under the canonical order.
     */
    public static int compareBytes(byte[] a, byte[] b) {
        if (a.length != b.length) {
            return Integer.compare(a.length, b.length);
        }
        return Arrays.compareUnsigned(a, b);
    }
}
