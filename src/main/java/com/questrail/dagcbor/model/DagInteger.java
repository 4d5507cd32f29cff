package com.questrail.dagcbor.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Signed integer in the range {@code [-2^64, 2^64 - 1]}.
 *
 * <h2>Representation</h2>
 * <p>
 * The value is stored exactly as it travels on the wire: a sign flag plus an
 * unsigned 64-bit {@code argument}.
 * </p>
 * <ul>
 *   <li>{@code negative == false}: value = argument (major type 0)</li>
 *   <li>{@code negative == true}: value = -1 - argument (major type 1)</li>
 * </ul>
 *
 * <p>
 * {@code argument} is interpreted as unsigned, so values above
 * {@link Long#MAX_VALUE} and below {@link Long#MIN_VALUE} are representable.
 * </p>
 */
public record DagInteger(boolean negative, long argument) implements DagValue
{
    private static final BigInteger TWO_64 = BigInteger.ONE.shiftLeft(64);
    private static final BigInteger MAX = TWO_64.subtract(BigInteger.ONE);
    private static final BigInteger MIN = TWO_64.negate();

    /**
     * Creates an integer from a signed Java long.
     */
    public static DagInteger of(long value) {
        return value >= 0
                ? new DagInteger(false, value)
                : new DagInteger(true, ~value);
    }

    /**
     * Creates a non-negative integer whose 64 bits are read as unsigned.
     */
    public static DagInteger ofUnsigned(long unsignedValue) {
        return new DagInteger(false, unsignedValue);
    }

    /**
     * Creates an integer from an arbitrary-precision value.
     *
     * @throws IllegalArgumentException if the value is outside [-2^64, 2^64 - 1]
     */
    public static DagInteger of(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.compareTo(MAX) > 0 || value.compareTo(MIN) < 0) {
            throw new IllegalArgumentException("Integer out of 64-bit CBOR range: " + value);
        }
        return value.signum() >= 0
                ? new DagInteger(false, value.longValue())
                : new DagInteger(true, value.negate().subtract(BigInteger.ONE).longValue());
    }

    /**
     * Returns true if the value fits a signed Java long.
     */
    public boolean fitsLong() {
        return argument >= 0;
    }

    /**
     * Returns the value as a signed long.
     *
     * @throws ArithmeticException if the value does not fit
     */
    public long longValueExact() {
        if (!fitsLong()) {
            throw new ArithmeticException("Integer does not fit in a long: " + toBigInteger());
        }
        return negative ? ~argument : argument;
    }

    public BigInteger toBigInteger() {
        BigInteger unsigned = new BigInteger(Long.toUnsignedString(argument));
        return negative ? unsigned.add(BigInteger.ONE).negate() : unsigned;
    }

    @Override
    public String kind() {
        return "integer";
    }

    @Override
    public String toString() {
        return fitsLong() ? Long.toString(longValueExact()) : toBigInteger().toString();
    }
}
