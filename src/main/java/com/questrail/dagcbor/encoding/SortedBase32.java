package com.questrail.dagcbor.encoding;

import java.util.Arrays;
import java.util.Objects;

/**
 * SortedBase32
 * -----------------------------------------------------------------------------
 * Lowercase base32 over the sorted alphabet {@code 234567abcdefghijklmnopqrstuvwxyz}.
 *
 * <p>Because the alphabet is in ASCII order, encoded strings of equal length
 * sort the same way as the values they encode. Two forms are provided:</p>
 * <ul>
 *   <li><b>Byte form</b> ({@link #encode(byte[])} / {@link #decode(CharSequence)}):
 *       RFC 4648 style 5-bit packing, most significant bit first, no padding.
 *       Used for CID text.</li>
 *   <li><b>Fixed-width integer form</b> ({@link #encodeFixed(long, int)} /
 *       {@link #decodeFixed(CharSequence)}): a non-negative number written in
 *       radix 32, left-padded with the zero digit. Used for TIDs.</li>
 * </ul>
 *
 * <p>Decoding accepts only the canonical spelling: characters outside the
 * alphabet, impossible lengths and non-zero trailing pad bits are rejected.</p>
 */
public final class SortedBase32
{
    public static final String ALPHABET = "234567abcdefghijklmnopqrstuvwxyz";

    private static final char[] DIGITS = ALPHABET.toCharArray();
    private static final byte[] LOOKUP = new byte[128];

    static {
        Arrays.fill(LOOKUP, (byte) -1);
        for (int i = 0; i < DIGITS.length; i++) {
            LOOKUP[DIGITS[i]] = (byte) i;
        }
    }

    private SortedBase32() {}

    /**
     * Returns the 5-bit value of {@code c}, or -1 if it is not in the alphabet.
     */
    public static int digitOf(char c) {
        return c < LOOKUP.length ? LOOKUP[c] : -1;
    }

    /**
     * Returns the number of characters {@link #encode(byte[])} produces for
     * {@code byteLength} bytes.
     */
    public static int encodedLength(int byteLength) {
        return (byteLength * 8 + 4) / 5;
    }

    public static String encode(byte[] data) {
        Objects.requireNonNull(data, "data");

        StringBuilder out = new StringBuilder(encodedLength(data.length));
        int buffer = 0;
        int bits = 0;

        for (byte b : data) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                bits -= 5;
                out.append(DIGITS[(buffer >>> bits) & 0x1F]);
            }
        }

        if (bits > 0) {
            // Final partial group, zero-filled on the right.
            out.append(DIGITS[(buffer << (5 - bits)) & 0x1F]);
        }
        return out.toString();
    }

    /**
     * Decodes unpadded base32 text.
     *
     * @throws IllegalArgumentException if the text is not a canonical encoding
     */
    public static byte[] decode(CharSequence text) {
        Objects.requireNonNull(text, "text");

        final int length = text.length();
        final int byteLength = length * 5 / 8;

        // A trailing group of 5+ leftover bits would be a whole wasted character.
        if (length * 5 - byteLength * 8 >= 5) {
            throw new IllegalArgumentException("Invalid base32 length: " + length);
        }

        byte[] out = new byte[byteLength];
        int buffer = 0;
        int bits = 0;
        int w = 0;

        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            int digit = digitOf(c);
            if (digit < 0) {
                throw new IllegalArgumentException(
                        "Invalid base32 character '" + c + "' at index " + i);
            }
            buffer = (buffer << 5) | digit;
            bits += 5;
            if (bits >= 8) {
                bits -= 8;
                out[w++] = (byte) (buffer >>> bits);
            }
        }

        if ((buffer & ((1 << bits) - 1)) != 0) {
            throw new IllegalArgumentException("Non-zero trailing bits in base32 text");
        }
        return out;
    }

    /**
     * Writes a non-negative value as exactly {@code width} digits.
     *
     * @throws IllegalArgumentException if the value is negative or needs more digits
     */
    public static String encodeFixed(long value, int width) {
        if (value < 0) {
            throw new IllegalArgumentException("Value must be non-negative: " + value);
        }
        if (width < 1 || width > 13) {
            throw new IllegalArgumentException("Width must be 1-13: " + width);
        }

        char[] out = new char[width];
        long v = value;
        for (int i = width - 1; i >= 0; i--) {
            out[i] = DIGITS[(int) (v & 0x1F)];
            v >>>= 5;
        }
        if (v != 0) {
            throw new IllegalArgumentException(value + " does not fit in " + width + " base32 digits");
        }
        return new String(out);
    }

    /**
     * Reads a fixed-width radix-32 number of at most 12 digits.
     *
     * @throws IllegalArgumentException on a character outside the alphabet
     */
    public static long decodeFixed(CharSequence text) {
        Objects.requireNonNull(text, "text");
        if (text.length() > 12) {
            throw new IllegalArgumentException("At most 12 digits fit a long without sign loss");
        }

        long v = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            int digit = digitOf(c);
            if (digit < 0) {
                throw new IllegalArgumentException(
                        "Invalid base32 character '" + c + "' at index " + i);
            }
            v = (v << 5) | digit;
        }
        return v;
    }
}
