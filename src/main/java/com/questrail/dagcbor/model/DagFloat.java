package com.questrail.dagcbor.model;

/**
 * Double-precision float. Always travels as an 8-byte IEEE-754 value.
 *
 * <p>NaN and the infinities have no canonical encoding and are not
 * representable.</p>
 */
public record DagFloat(double value) implements DagValue
{
    public DagFloat {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("DAG-CBOR floats must be finite (was " + value + ")");
        }
    }

    public static DagFloat of(double value) {
        return new DagFloat(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DagFloat that)) return false;
        // Bitwise, so that 0.0 and -0.0 stay distinct like their encodings.
        return Double.doubleToRawLongBits(value) == Double.doubleToRawLongBits(that.value);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(Double.doubleToRawLongBits(value));
    }

    @Override
    public String kind() {
        return "float";
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
