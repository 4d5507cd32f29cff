package com.questrail.dagcbor.tid;

import com.questrail.dagcbor.encoding.SortedBase32;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Tid
 * -----------------------------------------------------------------------------
 * Timestamp identifier: a short, sortable record key that encodes creation order.
 *
 * <h2>Layout</h2>
 * <pre>
 *   bit 63      : 0 when created (parsed text may set it)
 *   bits 62..10 : timestamp (53 bits, microseconds since the epoch)
 *   bits 9..0   : clock id  (10 bits)
 * </pre>
 * <p>The 64-bit value is written as exactly 13 {@link SortedBase32} digits, so
 * lexicographic order of the text equals numeric order of the value.</p>
 *
 * <p>Instances are immutable and compare by value.</p>
 */
public final class Tid implements Comparable<Tid>
{
    public static final int LENGTH = 13;

    static final long TIMESTAMP_MASK = (1L << 53) - 1;
    static final int CLOCK_ID_MASK = 0x3FF;

    private static final Pattern FORMAT =
            Pattern.compile("^[234567abcdefghij][234567abcdefghijklmnopqrstuvwxyz]{12}$");

    private final long value;

    private Tid(long value) {
        this.value = value;
    }

    /**
     * Builds a TID. Bits of {@code timestampMicros} above 53 and of
     * {@code clockId} above 10 are discarded.
     */
    public static Tid create(long timestampMicros, int clockId) {
        return new Tid(((timestampMicros & TIMESTAMP_MASK) << 10) | (clockId & CLOCK_ID_MASK));
    }

    /**
     * Parses the text form.
     *
     * @throws TidFormatException if {@link #validate(String)} fails
     */
    public static Tid parse(String text) throws TidFormatException {
        validate(text);
        long timestamp = SortedBase32.decodeFixed(text.substring(0, 11));
        long clockId = SortedBase32.decodeFixed(text.substring(11, LENGTH));
        return new Tid((timestamp << 10) | clockId);
    }

    /**
     * Checks that {@code text} is 13 characters of the sorted alphabet with a
     * leading digit below 16.
     *
     * @throws TidFormatException naming the failed check
     */
    public static void validate(String text) throws TidFormatException {
        Objects.requireNonNull(text, "text");
        if (text.length() != LENGTH) {
            throw new TidFormatException("Invalid TID length " + text.length() + " (expected " + LENGTH + ")");
        }
        if (!FORMAT.matcher(text).matches()) {
            throw new TidFormatException("Invalid TID format: " + text);
        }
    }

    public static boolean isValid(String text) {
        try {
            validate(text);
            return true;
        } catch (TidFormatException e) {
            return false;
        }
    }

    public long timestamp() {
        return value >>> 10;
    }

    public int clockId() {
        return (int) (value & CLOCK_ID_MASK);
    }

    /**
     * The packed value. Parsed text may set bit 63; compare unsigned.
     */
    public long value() {
        return value;
    }

    @Override
    public int compareTo(Tid other) {
        return Long.compareUnsigned(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tid that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return SortedBase32.encodeFixed(timestamp(), 11) + SortedBase32.encodeFixed(clockId(), 2);
    }
}
